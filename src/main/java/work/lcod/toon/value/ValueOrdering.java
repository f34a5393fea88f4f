package work.lcod.toon.value;

import java.util.Comparator;
import java.util.Map;

/**
 * Total order over normalised values, used to give unordered host collections a stable output order.
 * Kinds rank null, boolean, number, string, array, object; composites compare by their canonical text.
 */
public final class ValueOrdering implements Comparator<ToonValue> {
    public static final ValueOrdering INSTANCE = new ValueOrdering();

    private ValueOrdering() {}

    @Override
    public int compare(ToonValue left, ToonValue right) {
        int byKind = Integer.compare(left.kind().ordinal(), right.kind().ordinal());
        if (byKind != 0) {
            return byKind;
        }
        return switch (left.kind()) {
            case NULL -> 0;
            case BOOL -> Boolean.compare(((ToonBool) left).value(), ((ToonBool) right).value());
            case NUMBER -> Double.compare(((ToonNumber) left).value(), ((ToonNumber) right).value());
            case STRING -> ((ToonString) left).value().compareTo(((ToonString) right).value());
            case ARRAY, OBJECT -> canonicalText(left).compareTo(canonicalText(right));
        };
    }

    static String canonicalText(ToonValue value) {
        var out = new StringBuilder();
        appendCanonical(value, out);
        return out.toString();
    }

    private static void appendCanonical(ToonValue value, StringBuilder out) {
        switch (value.kind()) {
            case NULL -> out.append("null");
            case BOOL -> out.append(((ToonBool) value).value());
            case NUMBER -> out.append(((ToonNumber) value).canonical());
            case STRING -> out.append('"').append(((ToonString) value).value()).append('"');
            case ARRAY -> {
                out.append('[');
                boolean first = true;
                for (ToonValue item : ((ToonArray) value).items()) {
                    if (!first) {
                        out.append(',');
                    }
                    appendCanonical(item, out);
                    first = false;
                }
                out.append(']');
            }
            case OBJECT -> {
                out.append('{');
                boolean first = true;
                for (Map.Entry<String, ToonValue> entry : ((ToonObject) value).fields().entrySet()) {
                    if (!first) {
                        out.append(',');
                    }
                    out.append('"').append(entry.getKey()).append("\":");
                    appendCanonical(entry.getValue(), out);
                    first = false;
                }
                out.append('}');
            }
        }
    }
}
