package work.lcod.toon.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered string-keyed mapping. Insertion order is the output order.
 */
public record ToonObject(Map<String, ToonValue> fields) implements ToonValue {
    public static final ToonObject EMPTY = new ToonObject(Map.of());

    public ToonObject {
        Objects.requireNonNull(fields, "fields");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    @Override
    public Kind kind() {
        return Kind.OBJECT;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public List<String> keys() {
        return List.copyOf(fields.keySet());
    }

    public ToonValue get(String key) {
        return fields.get(key);
    }
}
