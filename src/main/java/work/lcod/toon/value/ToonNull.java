package work.lcod.toon.value;

public record ToonNull() implements ToonValue {
    public static final ToonNull INSTANCE = new ToonNull();

    @Override
    public Kind kind() {
        return Kind.NULL;
    }
}
