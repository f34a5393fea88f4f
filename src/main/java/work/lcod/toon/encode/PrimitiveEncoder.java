package work.lcod.toon.encode;

import java.util.List;
import java.util.StringJoiner;
import work.lcod.toon.api.Delimiter;
import work.lcod.toon.error.NotEncodableException;
import work.lcod.toon.value.ToonBool;
import work.lcod.toon.value.ToonNumber;
import work.lcod.toon.value.ToonString;
import work.lcod.toon.value.ToonValue;

/**
 * Renders scalar values. Strings are quoted against the active delimiter.
 */
public final class PrimitiveEncoder {
    private PrimitiveEncoder() {}

    public static String encode(ToonValue value, Delimiter delimiter) {
        return switch (value.kind()) {
            case NULL -> "null";
            case BOOL -> ((ToonBool) value).value() ? "true" : "false";
            case NUMBER -> ((ToonNumber) value).canonical();
            case STRING -> ToonQuoting.quoteValue(((ToonString) value).value(), delimiter);
            case ARRAY, OBJECT -> throw new NotEncodableException(value.kind().name());
        };
    }

    /**
     * Primitive values joined by the delimiter, as used by inline arrays and tabular rows.
     */
    public static String join(List<ToonValue> values, Delimiter delimiter) {
        var joiner = new StringJoiner(delimiter.token());
        for (ToonValue value : values) {
            joiner.add(encode(value, delimiter));
        }
        return joiner.toString();
    }
}
