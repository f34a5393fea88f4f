package work.lcod.toon.encode;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.lcod.toon.value.ToonArray;
import work.lcod.toon.value.ToonObject;
import work.lcod.toon.value.ToonValue;

/**
 * Writes object fields in insertion order, collapsing single-key chains when enabled.
 */
final class ObjectEncoder {
    private final EncodeContext ctx;

    ObjectEncoder(EncodeContext ctx) {
        this.ctx = ctx;
    }

    /**
     * @param pathPrefix   dotted path of {@code object} from its scope, {@code null} at the top of the scope
     * @param literalKeys  dotted keys a collapsed path must not shadow: the root's literal dotted keys in
     *                     document scope, empty inside list items
     * @param flattenDepth collapse budget left for chains starting in this object
     */
    void encodeObject(ToonObject object, int depth, String pathPrefix, Set<String> literalKeys, int flattenDepth) {
        Collection<String> siblings = object.fields().keySet();
        for (Map.Entry<String, ToonValue> field : object.fields().entrySet()) {
            encodeField(field.getKey(), field.getValue(), depth, siblings, pathPrefix, literalKeys, flattenDepth);
        }
    }

    /**
     * Writes one field. Collapsing is only attempted when {@code siblings} is given.
     */
    void encodeField(
        String key,
        ToonValue value,
        int depth,
        Collection<String> siblings,
        String pathPrefix,
        Set<String> literalKeys,
        int flattenDepth
    ) {
        if (ctx.collapsingEnabled() && siblings != null) {
            Optional<CollapseResult> collapsed = KeyCollapser.tryCollapse(
                key, value, siblings, literalKeys, pathPrefix, flattenDepth);
            if (collapsed.isPresent()) {
                writeCollapsed(collapsed.get(), depth, pathPrefix, literalKeys, flattenDepth);
                return;
            }
        }
        String currentPath = pathPrefix == null ? key : pathPrefix + "." + key;
        writeField(key, value, depth, currentPath, literalKeys, flattenDepth);
    }

    private void writeCollapsed(
        CollapseResult result,
        int depth,
        String pathPrefix,
        Set<String> literalKeys,
        int flattenDepth
    ) {
        String key = result.collapsedKey();
        String collapsedPath = pathPrefix == null ? key : pathPrefix + "." + key;
        if (result.remainder().isPresent()) {
            ctx.writer().push(depth, ToonQuoting.quoteKey(key) + ":");
            encodeObject(result.remainder().get(), depth + 1, collapsedPath, literalKeys,
                flattenDepth - result.segmentCount());
            return;
        }
        writeField(key, result.leafValue(), depth, collapsedPath, literalKeys, flattenDepth);
    }

    private void writeField(
        String key,
        ToonValue value,
        int depth,
        String currentPath,
        Set<String> literalKeys,
        int flattenDepth
    ) {
        String quoted = ToonQuoting.quoteKey(key);
        switch (value.kind()) {
            case ARRAY -> ctx.arrays().encode(key, (ToonArray) value, depth);
            case OBJECT -> {
                ctx.writer().push(depth, quoted + ":");
                ToonObject nested = (ToonObject) value;
                if (!nested.isEmpty()) {
                    encodeObject(nested, depth + 1, currentPath, literalKeys, flattenDepth);
                }
            }
            default -> ctx.writer().push(depth, quoted + ": " + PrimitiveEncoder.encode(value, ctx.delimiter()));
        }
    }
}
