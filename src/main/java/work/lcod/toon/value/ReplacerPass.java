package work.lcod.toon.value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.toon.error.MaxDepthExceededException;

/**
 * Depth-first application of a {@link Replacer}: parents before children, array indices ascending,
 * object fields in insertion order.
 * <p>
 * Replacements are normalised at the depth they are spliced in, so the result honours the same
 * {@code maxDepth} as the input.
 */
public final class ReplacerPass {
    private final Replacer replacer;
    private final Normalizer normalizer;

    public ReplacerPass(Replacer replacer, Normalizer normalizer) {
        this.replacer = Objects.requireNonNull(replacer, "replacer");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    public ToonValue apply(ToonValue root) {
        Object replaced = replacer.replace("", root, List.of());
        if (replaced == Replacer.OMIT) {
            return transformChildren(root, List.of());
        }
        return transformChildren(normalizer.normalize(replaced, 0), List.of());
    }

    private ToonValue transformElement(String key, ToonValue value, List<Object> path) {
        Object replaced = replacer.replace(key, value, path);
        if (replaced == Replacer.OMIT) {
            return null;
        }
        return transformChildren(normalizer.normalize(replaced, path.size()), path);
    }

    private ToonValue transformChildren(ToonValue value, List<Object> path) {
        if (path.size() > normalizer.maxDepth()) {
            throw new MaxDepthExceededException(path.size(), normalizer.maxDepth());
        }
        if (value instanceof ToonObject object) {
            Map<String, ToonValue> fields = new LinkedHashMap<>();
            for (Map.Entry<String, ToonValue> entry : object.fields().entrySet()) {
                ToonValue child = transformElement(entry.getKey(), entry.getValue(), childPath(path, entry.getKey()));
                if (child != null) {
                    fields.put(entry.getKey(), child);
                }
            }
            return new ToonObject(fields);
        }
        if (value instanceof ToonArray array) {
            List<ToonValue> items = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                ToonValue child = transformElement(String.valueOf(i), array.items().get(i), childPath(path, i));
                if (child != null) {
                    items.add(child);
                }
            }
            return new ToonArray(items);
        }
        return value;
    }

    private static List<Object> childPath(List<Object> path, Object segment) {
        List<Object> child = new ArrayList<>(path.size() + 1);
        child.addAll(path);
        child.add(segment);
        return List.copyOf(child);
    }
}
