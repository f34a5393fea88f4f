package work.lcod.toon.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.lcod.toon.api.Delimiter;
import work.lcod.toon.api.EncodeOptions;
import work.lcod.toon.api.KeyCollapsing;
import work.lcod.toon.api.Toon;
import work.lcod.toon.config.TomlOptionsLoader;

@CommandLine.Command(
    name = "toon-encode",
    description = "Convert JSON into TOON (Token-Oriented Object Notation).",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ToonEncodeCommand implements Callable<Integer> {
    static final String CONFIG_ENV = "TOON_CONFIG";

    private static final Logger log = LoggerFactory.getLogger(ToonEncodeCommand.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final InputStream stdin;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "PATH|-|JSON",
        description = "JSON input file, inline JSON, or '-' for stdin (default: stdin).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String input;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write TOON to this file instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path output;

    @CommandLine.Option(
        names = {"-d", "--delimiter"},
        description = "Field delimiter (comma|pipe|tab).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String delimiterRaw;

    @CommandLine.Option(
        names = "--key-collapsing",
        description = "Collapse single-key chains into dotted keys (off|safe).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String keyCollapsingRaw;

    @CommandLine.Option(
        names = "--flatten-depth",
        description = "Maximum number of segments in a collapsed key.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer flattenDepth;

    @CommandLine.Option(
        names = "--indent",
        description = "Spaces per indentation level.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer indent;

    @CommandLine.Option(
        names = "--max-depth",
        description = "Maximum nesting depth accepted from the input.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer maxDepth;

    @CommandLine.Option(
        names = "--config",
        description = "TOML file with an [encode] table (default: $" + CONFIG_ENV + ").",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    ToonEncodeCommand() {
        this(System.in);
    }

    ToonEncodeCommand(InputStream stdin) {
        this.stdin = stdin;
    }

    @Override
    public Integer call() throws Exception {
        JsonNode tree = parseInput(loadInputPayload());
        EncodeOptions options = resolveOptions();
        String toon = Toon.encode(tree, options);

        if (output != null) {
            Path target = output.toAbsolutePath().normalize();
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, toon, StandardCharsets.UTF_8);
            log.info("Wrote {} characters of TOON to {}", toon.length(), target);
        } else {
            spec.commandLine().getOut().println(toon);
            spec.commandLine().getOut().flush();
        }
        return 0;
    }

    EncodeOptions resolveOptions() {
        EncodeOptions.Builder builder = EncodeOptions.builder();
        Optional<Path> configPath = resolveConfigPath();
        if (configPath.isPresent()) {
            try {
                TomlOptionsLoader.load(configPath.get(), builder);
            } catch (IOException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read config file: " + configPath.get());
            }
        }
        try {
            if (delimiterRaw != null) {
                builder.delimiter(Delimiter.from(delimiterRaw));
            }
            if (keyCollapsingRaw != null) {
                builder.keyCollapsing(KeyCollapsing.from(keyCollapsingRaw));
            }
            if (flattenDepth != null) {
                builder.flattenDepth(flattenDepth);
            }
            if (indent != null) {
                builder.indent(indent);
            }
            if (maxDepth != null) {
                builder.maxDepth(maxDepth);
            }
            return builder.build();
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private Optional<Path> resolveConfigPath() {
        if (config != null) {
            return Optional.of(config);
        }
        String fromEnv = System.getenv(CONFIG_ENV);
        if (fromEnv == null || fromEnv.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Paths.get(fromEnv));
    }

    private String loadInputPayload() {
        if (input == null || "-".equals(input)) {
            return readStdin();
        }
        String trimmed = input.trim();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            return trimmed;
        }
        Path path = Paths.get(input).toAbsolutePath().normalize();
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read input file: " + path);
        }
    }

    private JsonNode parseInput(String payload) {
        if (payload.isBlank()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Empty JSON input");
        }
        try {
            return JSON.readTree(payload);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid JSON input: " + ex.getMessage());
        }
    }

    private String readStdin() {
        try {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
        }
    }
}
