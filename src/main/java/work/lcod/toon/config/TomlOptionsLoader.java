package work.lcod.toon.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.toon.api.Delimiter;
import work.lcod.toon.api.EncodeOptions;
import work.lcod.toon.api.KeyCollapsing;

/**
 * Reads encode options from the {@code [encode]} table of a TOML file.
 * <pre>
 * [encode]
 * delimiter = "pipe"
 * keyCollapsing = "safe"
 * flattenDepth = 3
 * indent = 2
 * maxDepth = 500
 * </pre>
 */
public final class TomlOptionsLoader {
    public static final String TABLE = "encode";

    private static final Logger log = LoggerFactory.getLogger(TomlOptionsLoader.class);
    private static final Set<String> KNOWN_KEYS = Set.of("delimiter", "keyCollapsing", "flattenDepth", "indent", "maxDepth");

    private TomlOptionsLoader() {}

    public static EncodeOptions.Builder load(Path path, EncodeOptions.Builder base) throws IOException {
        String raw = Files.readString(path, StandardCharsets.UTF_8);
        return apply(raw, path.toString(), base);
    }

    public static EncodeOptions.Builder apply(String toml, String source, EncodeOptions.Builder base) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid TOML in " + source + ": " + result.errors().get(0).toString());
        }
        TomlTable table = result.getTable(TABLE);
        if (table == null) {
            log.debug("No [{}] table in {}, keeping defaults", TABLE, source);
            return base;
        }
        for (String key : table.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                log.warn("Ignoring unknown option '{}' in {}", key, source);
            }
        }
        try {
            if (table.contains("delimiter")) {
                base.delimiter(Delimiter.from(table.getString("delimiter")));
            }
            if (table.contains("keyCollapsing")) {
                base.keyCollapsing(KeyCollapsing.from(table.getString("keyCollapsing")));
            }
            if (table.contains("flattenDepth")) {
                base.flattenDepth(toInt(table.getLong("flattenDepth"), "flattenDepth"));
            }
            if (table.contains("indent")) {
                base.indent(toInt(table.getLong("indent"), "indent"));
            }
            if (table.contains("maxDepth")) {
                base.maxDepth(toInt(table.getLong("maxDepth"), "maxDepth"));
            }
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid option type in " + source + ": " + ex.getMessage(), ex);
        }
        return base;
    }

    private static int toInt(Long value, String name) {
        if (value == null || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(name + " is out of range: " + value);
        }
        return value.intValue();
    }
}
