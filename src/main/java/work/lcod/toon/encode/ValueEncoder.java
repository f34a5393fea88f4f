package work.lcod.toon.encode;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import work.lcod.toon.api.EncodeOptions;
import work.lcod.toon.value.ToonArray;
import work.lcod.toon.value.ToonObject;
import work.lcod.toon.value.ToonValue;

/**
 * Top-level dispatch from a normalised value to the primitive, array or object encoder.
 */
public final class ValueEncoder {
    private ValueEncoder() {}

    public static LineWriter encode(ToonValue value, EncodeOptions options) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(options, "options");
        var writer = new LineWriter(options.indent());
        var ctx = new EncodeContext(options, writer, rootLiteralKeys(value));
        switch (value.kind()) {
            case ARRAY -> ctx.arrays().encode(null, (ToonArray) value, 0);
            case OBJECT -> ctx.objects().encodeObject((ToonObject) value, 0, null, ctx.rootLiteralKeys(),
                options.effectiveFlattenDepth());
            default -> writer.push(0, PrimitiveEncoder.encode(value, options.delimiter()));
        }
        return writer;
    }

    private static Set<String> rootLiteralKeys(ToonValue value) {
        Set<String> dotted = new LinkedHashSet<>();
        if (value instanceof ToonObject object) {
            for (String key : object.fields().keySet()) {
                if (key.contains(".")) {
                    dotted.add(key);
                }
            }
        }
        return dotted;
    }
}
