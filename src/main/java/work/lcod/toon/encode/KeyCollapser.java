package work.lcod.toon.encode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.toon.value.ToonObject;
import work.lcod.toon.value.ToonValue;

/**
 * Decides whether a chain of single-key objects may be written as one dotted key.
 * Pure function of its arguments; never writes output.
 */
public final class KeyCollapser {
    private static final Logger log = LoggerFactory.getLogger(KeyCollapser.class);
    private static final String DOT = ".";

    private KeyCollapser() {}

    /**
     * @param key             key of the pair being encoded
     * @param value           its value
     * @param siblingKeys     every key of the enclosing object
     * @param rootLiteralKeys literal dotted keys of the document root, empty when the chain sits inside a list item
     * @param pathPrefix      dotted path of the enclosing object, {@code null} at the top of its scope
     * @param flattenDepth    longest chain allowed
     */
    public static Optional<CollapseResult> tryCollapse(
        String key,
        ToonValue value,
        Collection<String> siblingKeys,
        Set<String> rootLiteralKeys,
        String pathPrefix,
        int flattenDepth
    ) {
        if (!(value instanceof ToonObject)) {
            return Optional.empty();
        }
        List<String> segments = new ArrayList<>();
        segments.add(key);
        ToonValue current = value;
        while (segments.size() < flattenDepth
            && current instanceof ToonObject object
            && object.size() == 1) {
            var entry = object.fields().entrySet().iterator().next();
            segments.add(entry.getKey());
            current = entry.getValue();
        }
        if (segments.size() < 2) {
            return Optional.empty();
        }
        for (String segment : segments) {
            if (!ToonQuoting.isIdentifierSegment(segment)) {
                log.debug("Not collapsing '{}': segment '{}' is not an identifier", key, segment);
                return Optional.empty();
            }
        }
        String collapsedKey = String.join(DOT, segments);
        if (siblingKeys.contains(collapsedKey)) {
            log.debug("Not collapsing '{}': sibling key '{}' already exists", key, collapsedKey);
            return Optional.empty();
        }
        String absolutePath = pathPrefix == null ? collapsedKey : pathPrefix + DOT + collapsedKey;
        if (rootLiteralKeys.contains(absolutePath)) {
            log.debug("Not collapsing '{}': root key '{}' already exists", key, absolutePath);
            return Optional.empty();
        }
        Optional<ToonObject> remainder = current instanceof ToonObject object && !object.isEmpty()
            ? Optional.of(object)
            : Optional.empty();
        return Optional.of(new CollapseResult(collapsedKey, remainder, current, segments.size()));
    }
}
