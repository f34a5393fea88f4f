package work.lcod.toon.api;

import java.util.Objects;
import java.util.Optional;
import work.lcod.toon.value.Normalizer;
import work.lcod.toon.value.Replacer;

/**
 * Immutable configuration for one encode call.
 */
public record EncodeOptions(
    Delimiter delimiter,
    KeyCollapsing keyCollapsing,
    Optional<Integer> flattenDepth,
    int indent,
    int maxDepth,
    Optional<Replacer> replacer
) {
    public static final int DEFAULT_INDENT = 2;

    private static final EncodeOptions DEFAULTS = builder().build();

    public EncodeOptions {
        Objects.requireNonNull(delimiter, "delimiter");
        Objects.requireNonNull(keyCollapsing, "keyCollapsing");
        Objects.requireNonNull(flattenDepth, "flattenDepth");
        Objects.requireNonNull(replacer, "replacer");
        if (flattenDepth.isPresent() && flattenDepth.get() < 1) {
            throw new IllegalArgumentException("flattenDepth must be positive: " + flattenDepth.get());
        }
        if (indent < 1) {
            throw new IllegalArgumentException("indent must be >= 1: " + indent);
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1: " + maxDepth);
        }
    }

    public static EncodeOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Longest collapse chain allowed, {@link Integer#MAX_VALUE} when unbounded.
     */
    public int effectiveFlattenDepth() {
        return flattenDepth.orElse(Integer.MAX_VALUE);
    }

    public Builder toBuilder() {
        return new Builder()
            .delimiter(delimiter)
            .keyCollapsing(keyCollapsing)
            .flattenDepth(flattenDepth)
            .indent(indent)
            .maxDepth(maxDepth)
            .replacer(replacer);
    }

    public static final class Builder {
        private Delimiter delimiter = Delimiter.COMMA;
        private KeyCollapsing keyCollapsing = KeyCollapsing.OFF;
        private Optional<Integer> flattenDepth = Optional.empty();
        private int indent = DEFAULT_INDENT;
        private int maxDepth = Normalizer.DEFAULT_MAX_DEPTH;
        private Optional<Replacer> replacer = Optional.empty();

        public Builder delimiter(Delimiter delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public Builder keyCollapsing(KeyCollapsing keyCollapsing) {
            this.keyCollapsing = keyCollapsing;
            return this;
        }

        public Builder flattenDepth(Optional<Integer> flattenDepth) {
            this.flattenDepth = flattenDepth;
            return this;
        }

        public Builder flattenDepth(int flattenDepth) {
            return flattenDepth(Optional.of(flattenDepth));
        }

        public Builder indent(int indent) {
            this.indent = indent;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder replacer(Optional<Replacer> replacer) {
            this.replacer = replacer;
            return this;
        }

        public Builder replacer(Replacer replacer) {
            return replacer(Optional.ofNullable(replacer));
        }

        public EncodeOptions build() {
            return new EncodeOptions(delimiter, keyCollapsing, flattenDepth, indent, maxDepth, replacer);
        }
    }
}
