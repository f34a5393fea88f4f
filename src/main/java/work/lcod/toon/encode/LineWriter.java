package work.lcod.toon.encode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates indented output lines for a single encode call.
 */
public final class LineWriter {
    static final String LIST_MARKER = "-";

    private final String indentUnit;
    private final List<String> lines = new ArrayList<>();
    private final List<String> indentCache = new ArrayList<>();

    public LineWriter() {
        this(2);
    }

    public LineWriter(int indentSize) {
        this(" ".repeat(indentSize));
    }

    public LineWriter(String indentUnit) {
        this.indentUnit = Objects.requireNonNull(indentUnit, "indentUnit");
        indentCache.add("");
    }

    /**
     * Appends {@code content} at {@code depth}, dropping trailing whitespace.
     */
    public LineWriter push(int depth, String content) {
        lines.add(indent(depth) + content.stripTrailing());
        return this;
    }

    /**
     * Appends a {@code "- "} list item; empty content leaves a bare marker.
     */
    public LineWriter pushListItem(int depth, String content) {
        return push(depth, LIST_MARKER + " " + content);
    }

    public List<String> lines() {
        return Collections.unmodifiableList(lines);
    }

    public int size() {
        return lines.size();
    }

    public String render() {
        return String.join("\n", lines);
    }

    private String indent(int depth) {
        while (indentCache.size() <= depth) {
            indentCache.add(indentCache.get(indentCache.size() - 1) + indentUnit);
        }
        return indentCache.get(depth);
    }
}
