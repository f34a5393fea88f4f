package work.lcod.toon.value;

import java.util.Objects;

public record ToonString(String value) implements ToonValue {
    public ToonString {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public Kind kind() {
        return Kind.STRING;
    }
}
