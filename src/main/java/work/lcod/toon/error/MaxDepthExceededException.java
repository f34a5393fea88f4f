package work.lcod.toon.error;

import java.util.Map;

/**
 * Normalisation descended deeper than the configured bound (cyclic or pathologically deep input).
 */
public final class MaxDepthExceededException extends ToonException {
    public static final String CODE = "max_depth_exceeded";

    private final int depth;
    private final int limit;

    public MaxDepthExceededException(int depth, int limit) {
        super(CODE, "Maximum nesting depth exceeded: depth " + depth + " > limit " + limit,
            Map.of("depth", depth, "limit", limit));
        this.depth = depth;
        this.limit = limit;
    }

    public int depth() {
        return depth;
    }

    public int limit() {
        return limit;
    }
}
