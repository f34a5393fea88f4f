package work.lcod.toon.api;

import java.util.Locale;

/**
 * Policy for flattening single-key wrapper chains into dotted keys.
 */
public enum KeyCollapsing {
    OFF,
    SAFE;

    public static KeyCollapsing from(String value) {
        if (value == null || value.isBlank()) {
            return OFF;
        }
        try {
            return KeyCollapsing.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported key collapsing mode: " + value);
        }
    }
}
