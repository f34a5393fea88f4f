package work.lcod.toon.encode;

import java.util.regex.Pattern;
import work.lcod.toon.api.Delimiter;

/**
 * Quoting and escaping rules for keys and string values.
 */
public final class ToonQuoting {
    private static final Pattern UNQUOTED_KEY = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.]*$");
    private static final Pattern IDENTIFIER_SEGMENT = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
    private static final Pattern NUMERIC_LIKE = Pattern.compile("^-?\\d+(?:\\.\\d+)?(?:[eE][+-]?\\d+)?$");
    private static final String STRUCTURAL_CHARS = ":\"\\[]{}\n\r\t";
    private static final Pattern LEADING_ZERO = Pattern.compile("^0\\d+$");

    private ToonQuoting() {}

    public static String quoteKey(String key) {
        if (UNQUOTED_KEY.matcher(key).matches()) {
            return key;
        }
        return '"' + escape(key) + '"';
    }

    public static String quoteValue(String value, Delimiter delimiter) {
        if (isSafeUnquoted(value, delimiter)) {
            return value;
        }
        return '"' + escape(value) + '"';
    }

    /**
     * True when {@code segment} may take part in a dotted collapsed key.
     */
    public static boolean isIdentifierSegment(String segment) {
        return IDENTIFIER_SEGMENT.matcher(segment).matches();
    }

    static boolean isSafeUnquoted(String value, Delimiter delimiter) {
        if (value.isEmpty() || !value.equals(value.strip())) {
            return false;
        }
        if (value.equals("true") || value.equals("false") || value.equals("null")) {
            return false;
        }
        if (NUMERIC_LIKE.matcher(value).matches() || LEADING_ZERO.matcher(value).matches()) {
            return false;
        }
        if (value.startsWith("-") || value.contains(delimiter.token())) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (STRUCTURAL_CHARS.indexOf(value.charAt(i)) >= 0) {
                return false;
            }
        }
        return true;
    }

    static String escape(String value) {
        var out = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> out.append(ch);
            }
        }
        return out.toString();
    }
}
