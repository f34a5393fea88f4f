package work.lcod.toon.value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical, post-normalisation value: one of null, boolean, number, string, array or object.
 */
public interface ToonValue {
    Kind kind();

    default boolean isPrimitive() {
        return kind().primitive;
    }

    default boolean isArray() {
        return kind() == Kind.ARRAY;
    }

    default boolean isObject() {
        return kind() == Kind.OBJECT;
    }

    static ToonValue nullValue() {
        return ToonNull.INSTANCE;
    }

    static ToonValue bool(boolean value) {
        return value ? ToonBool.TRUE : ToonBool.FALSE;
    }

    /**
     * Non-finite doubles collapse to null; everything else becomes a {@link ToonNumber}.
     */
    static ToonValue number(double value) {
        if (!Double.isFinite(value)) {
            return ToonNull.INSTANCE;
        }
        return new ToonNumber(value);
    }

    static ToonValue string(String value) {
        return new ToonString(value);
    }

    static ToonArray array(List<? extends ToonValue> items) {
        return new ToonArray(List.copyOf(items));
    }

    static ToonObject object(Map<String, ? extends ToonValue> fields) {
        return new ToonObject(new LinkedHashMap<String, ToonValue>(fields));
    }

    enum Kind {
        NULL(true),
        BOOL(true),
        NUMBER(true),
        STRING(true),
        ARRAY(false),
        OBJECT(false);

        private final boolean primitive;

        Kind(boolean primitive) {
            this.primitive = primitive;
        }

        public boolean primitive() {
            return primitive;
        }
    }
}
