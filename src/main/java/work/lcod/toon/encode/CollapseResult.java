package work.lcod.toon.encode;

import java.util.Optional;
import work.lcod.toon.value.ToonObject;
import work.lcod.toon.value.ToonValue;

/**
 * Accepted collapse of a single-key chain.
 *
 * @param collapsedKey dotted key replacing the original key
 * @param remainder    multi-key object where the chain stopped, if any
 * @param leafValue    value at the stopping point
 * @param segmentCount number of keys joined into {@code collapsedKey}
 */
public record CollapseResult(String collapsedKey, Optional<ToonObject> remainder, ToonValue leafValue, int segmentCount) {}
