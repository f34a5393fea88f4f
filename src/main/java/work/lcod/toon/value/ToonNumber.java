package work.lcod.toon.value;

import java.math.BigDecimal;

/**
 * Finite IEEE-754 double. Negative zero is stored as positive zero.
 */
public record ToonNumber(double value) implements ToonValue {
    public ToonNumber {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("TOON numbers must be finite: " + value);
        }
        if (value == 0.0d) {
            value = 0.0d;
        }
    }

    @Override
    public Kind kind() {
        return Kind.NUMBER;
    }

    /**
     * Plain decimal text without exponent or trailing zeros ({@code 1.0} renders {@code 1}).
     */
    public String canonical() {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
