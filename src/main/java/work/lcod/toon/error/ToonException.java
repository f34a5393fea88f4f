package work.lcod.toon.error;

import java.util.Map;

/**
 * Base failure raised while turning a host value into TOON text.
 * Carries a stable machine code plus optional diagnostic data.
 */
public class ToonException extends RuntimeException {
    private final String code;
    private final Map<String, Object> data;

    public ToonException(String code, String message, Map<String, Object> data) {
        super(message);
        this.code = code;
        this.data = data == null ? Map.of() : Map.copyOf(data);
    }

    public String code() {
        return code;
    }

    public Map<String, Object> data() {
        return data;
    }
}
