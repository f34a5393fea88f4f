package work.lcod.toon.value;

public record ToonBool(boolean value) implements ToonValue {
    public static final ToonBool TRUE = new ToonBool(true);
    public static final ToonBool FALSE = new ToonBool(false);

    @Override
    public Kind kind() {
        return Kind.BOOL;
    }
}
