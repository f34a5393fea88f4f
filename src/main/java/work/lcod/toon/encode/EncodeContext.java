package work.lcod.toon.encode;

import java.util.Set;
import work.lcod.toon.api.Delimiter;
import work.lcod.toon.api.EncodeOptions;
import work.lcod.toon.api.KeyCollapsing;

/**
 * State owned by one encode call: options, output lines and the mutually recursive encoders.
 */
final class EncodeContext {
    private final EncodeOptions options;
    private final LineWriter writer;
    private final Set<String> rootLiteralKeys;
    private final ObjectEncoder objects;
    private final ArrayFormatter arrays;

    EncodeContext(EncodeOptions options, LineWriter writer, Set<String> rootLiteralKeys) {
        this.options = options;
        this.writer = writer;
        this.rootLiteralKeys = Set.copyOf(rootLiteralKeys);
        this.objects = new ObjectEncoder(this);
        this.arrays = new ArrayFormatter(this);
    }

    EncodeOptions options() {
        return options;
    }

    Delimiter delimiter() {
        return options.delimiter();
    }

    boolean collapsingEnabled() {
        return options.keyCollapsing() == KeyCollapsing.SAFE;
    }

    LineWriter writer() {
        return writer;
    }

    Set<String> rootLiteralKeys() {
        return rootLiteralKeys;
    }

    ObjectEncoder objects() {
        return objects;
    }

    ArrayFormatter arrays() {
        return arrays;
    }
}
