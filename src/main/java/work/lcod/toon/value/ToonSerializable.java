package work.lcod.toon.value;

/**
 * Capability for host types that want a custom TOON representation.
 * <p>
 * The returned object is normalised in place of the original. Returning {@code this}
 * opts out and lets the normaliser treat the instance structurally.
 */
@FunctionalInterface
public interface ToonSerializable {
    Object toToon();
}
