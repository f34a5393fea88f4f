package work.lcod.toon.api;

import java.util.Locale;

/**
 * Field separator for inline and tabular value lists.
 */
public enum Delimiter {
    COMMA(","),
    PIPE("|"),
    TAB("\t");

    private final String token;

    Delimiter(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /**
     * Text embedded in array headers: empty for the default comma, the delimiter itself otherwise.
     */
    public String headerMarker() {
        return this == COMMA ? "" : token;
    }

    public static Delimiter from(String value) {
        if (value == null || value.isEmpty()) {
            return COMMA;
        }
        if (value.equals("\t")) {
            return TAB;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "comma", "," -> COMMA;
            case "pipe", "|" -> PIPE;
            case "tab", "\\t" -> TAB;
            default -> throw new IllegalArgumentException("Unsupported delimiter: " + value);
        };
    }
}
