package work.lcod.toon.error;

import java.util.Map;

/**
 * A non-primitive value reached the primitive encoder. Signals a broken normalisation invariant.
 */
public final class NotEncodableException extends ToonException {
    public static final String CODE = "not_encodable";

    public NotEncodableException(String kind) {
        super(CODE, "Value of kind " + kind + " is not a primitive", Map.of("kind", kind));
    }
}
