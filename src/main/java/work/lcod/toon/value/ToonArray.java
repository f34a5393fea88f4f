package work.lcod.toon.value;

import java.util.List;
import java.util.Objects;

public record ToonArray(List<ToonValue> items) implements ToonValue {
    public ToonArray {
        items = List.copyOf(Objects.requireNonNull(items, "items"));
    }

    @Override
    public Kind kind() {
        return Kind.ARRAY;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean allPrimitive() {
        for (ToonValue item : items) {
            if (!item.isPrimitive()) {
                return false;
            }
        }
        return true;
    }

    public boolean allObjects() {
        for (ToonValue item : items) {
            if (!item.isObject()) {
                return false;
            }
        }
        return true;
    }

    public boolean allArrays() {
        for (ToonValue item : items) {
            if (!item.isArray()) {
                return false;
            }
        }
        return true;
    }
}
