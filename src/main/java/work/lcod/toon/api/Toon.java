package work.lcod.toon.api;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.toon.encode.LineWriter;
import work.lcod.toon.encode.ValueEncoder;
import work.lcod.toon.value.Normalizer;
import work.lcod.toon.value.ReplacerPass;
import work.lcod.toon.value.ToonValue;

/**
 * Public entry point: host value in, TOON text out.
 * <p>
 * Each call owns its own normaliser and line buffer, so concurrent calls need no coordination.
 * Output uses {@code \n} line separators and has no trailing newline.
 */
public final class Toon {
    private static final Logger log = LoggerFactory.getLogger(Toon.class);

    private Toon() {}

    public static String encode(Object value) {
        return encode(value, EncodeOptions.defaults());
    }

    public static String encode(Object value, EncodeOptions options) {
        return render(value, options).render();
    }

    /**
     * Same as {@link #encode(Object, EncodeOptions)} without joining the lines.
     */
    public static List<String> encodeLines(Object value, EncodeOptions options) {
        return List.copyOf(render(value, options).lines());
    }

    public static ToonValue normalize(Object value) {
        return new Normalizer().normalize(value);
    }

    public static ToonValue normalize(Object value, int maxDepth) {
        return new Normalizer(maxDepth).normalize(value);
    }

    private static LineWriter render(Object value, EncodeOptions options) {
        Objects.requireNonNull(options, "options");
        var normalizer = new Normalizer(options.maxDepth());
        ToonValue normalized = normalizer.normalize(value);
        if (options.replacer().isPresent()) {
            normalized = new ReplacerPass(options.replacer().get(), normalizer).apply(normalized);
        }
        LineWriter writer = ValueEncoder.encode(normalized, options);
        if (log.isDebugEnabled()) {
            log.debug("Encoded {} root into {} line(s) (delimiter={}, keyCollapsing={})",
                normalized.kind(), writer.size(), options.delimiter(), options.keyCollapsing());
        }
        return writer;
    }
}
