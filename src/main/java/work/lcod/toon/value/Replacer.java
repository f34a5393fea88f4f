package work.lcod.toon.value;

import java.util.List;

/**
 * Host-supplied transform applied to every node after normalisation.
 * <p>
 * Return {@link #OMIT} to drop an object field or array element, the given value to keep it,
 * or any host object to replace it (the replacement is normalised and its children visited).
 */
@FunctionalInterface
public interface Replacer {
    /** Marker result removing the current field or element. Ignored for the root. */
    Object OMIT = new Object() {
        @Override
        public String toString() {
            return "Replacer.OMIT";
        }
    };

    /**
     * @param key  field name, element index as text, or {@code ""} for the root
     * @param value current node
     * @param path keys ({@link String}) and indices ({@link Integer}) from the root to this node
     */
    Object replace(String key, ToonValue value, List<Object> path);
}
