package work.lcod.toon.encode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import work.lcod.toon.api.Delimiter;
import work.lcod.toon.value.ToonArray;
import work.lcod.toon.value.ToonObject;
import work.lcod.toon.value.ToonValue;

/**
 * Classifies arrays and writes them in inline, tabular or list form.
 */
final class ArrayFormatter {
    private static final String EMPTY_ELEMENT = "[]";

    private final EncodeContext ctx;

    ArrayFormatter(EncodeContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Writes {@code array} under {@code key}, or as the document root when {@code key} is {@code null}.
     */
    void encode(String key, ToonArray array, int depth) {
        String prefix = key == null ? "" : ToonQuoting.quoteKey(key);
        writeHeaded(prefix, array, depth, false);
    }

    /**
     * Header form shared by keyed, root and list-item arrays. The body sits one level below {@code depth},
     * or two levels below for the first field of a list-item object.
     */
    private void writeHeaded(String prefix, ToonArray array, int depth, boolean listItem) {
        LineWriter writer = ctx.writer();
        Delimiter delimiter = ctx.delimiter();
        String header = prefix + header(array.size(), delimiter);
        int bodyDepth = listItem ? depth + 2 : depth + 1;
        switch (classify(array)) {
            case EMPTY -> emit(listItem, depth, prefix + header(0, delimiter));
            case INLINE -> emit(listItem, depth, header + ": " + PrimitiveEncoder.join(array.items(), delimiter));
            case TABULAR -> {
                List<String> columns = tabularColumns(array).orElseThrow();
                emit(listItem, depth, header + fieldList(columns) + ":");
                writeRows(array, columns, bodyDepth);
            }
            case NESTED_LIST, MIXED_LIST -> {
                emit(listItem, depth, header + ":");
                writeListItems(array, bodyDepth);
            }
        }
    }

    private void emit(boolean listItem, int depth, String content) {
        if (listItem) {
            ctx.writer().pushListItem(depth, content);
        } else {
            ctx.writer().push(depth, content);
        }
    }

    private void writeRows(ToonArray array, List<String> columns, int depth) {
        for (ToonValue item : array.items()) {
            ToonObject row = (ToonObject) item;
            List<ToonValue> cells = new ArrayList<>(columns.size());
            for (String column : columns) {
                cells.add(row.get(column));
            }
            ctx.writer().push(depth, PrimitiveEncoder.join(cells, ctx.delimiter()));
        }
    }

    void writeListItems(ToonArray array, int depth) {
        for (ToonValue item : array.items()) {
            writeListItem(item, depth);
        }
    }

    private void writeListItem(ToonValue item, int depth) {
        switch (item.kind()) {
            case ARRAY -> writeArrayItem((ToonArray) item, depth);
            case OBJECT -> writeObjectItem((ToonObject) item, depth);
            default -> ctx.writer().pushListItem(depth, PrimitiveEncoder.encode(item, ctx.delimiter()));
        }
    }

    private void writeArrayItem(ToonArray array, int depth) {
        if (array.isEmpty()) {
            ctx.writer().pushListItem(depth, EMPTY_ELEMENT);
            return;
        }
        String header = header(array.size(), ctx.delimiter());
        switch (classify(array)) {
            case INLINE -> ctx.writer().pushListItem(depth,
                header + ": " + PrimitiveEncoder.join(array.items(), ctx.delimiter()));
            case TABULAR -> {
                List<String> columns = tabularColumns(array).orElseThrow();
                ctx.writer().pushListItem(depth, header + fieldList(columns) + ":");
                writeRows(array, columns, depth + 1);
            }
            default -> {
                ctx.writer().pushListItem(depth, header + ":");
                writeListItems(array, depth + 1);
            }
        }
    }

    /**
     * An object as a list element: the first field shares the marker line, the rest follow one level deeper.
     */
    private void writeObjectItem(ToonObject object, int depth) {
        if (object.isEmpty()) {
            ctx.writer().push(depth, LineWriter.LIST_MARKER);
            return;
        }
        var fields = object.fields().entrySet().iterator();
        Map.Entry<String, ToonValue> first = fields.next();
        String key = ToonQuoting.quoteKey(first.getKey());
        ToonValue value = first.getValue();
        switch (value.kind()) {
            case ARRAY -> writeHeaded(key, (ToonArray) value, depth, true);
            case OBJECT -> {
                ctx.writer().pushListItem(depth, key + ":");
                ToonObject nested = (ToonObject) value;
                if (!nested.isEmpty()) {
                    ctx.objects().encodeObject(nested, depth + 2, null, Set.of(),
                        ctx.options().effectiveFlattenDepth());
                }
            }
            default -> ctx.writer().pushListItem(depth, key + ": " + PrimitiveEncoder.encode(value, ctx.delimiter()));
        }
        while (fields.hasNext()) {
            Map.Entry<String, ToonValue> field = fields.next();
            ctx.objects().encodeField(field.getKey(), field.getValue(), depth + 1, null, null, Set.of(),
                ctx.options().effectiveFlattenDepth());
        }
    }

    static ArrayLayout classify(ToonArray array) {
        if (array.isEmpty()) {
            return ArrayLayout.EMPTY;
        }
        if (array.allPrimitive()) {
            return ArrayLayout.INLINE;
        }
        if (tabularColumns(array).isPresent()) {
            return ArrayLayout.TABULAR;
        }
        if (array.allArrays()) {
            return ArrayLayout.NESTED_LIST;
        }
        return ArrayLayout.MIXED_LIST;
    }

    /**
     * Keys present in every element, in first-element order, provided every element is an object and
     * every such key holds a primitive. Empty when the array is not tabular.
     */
    static Optional<List<String>> tabularColumns(ToonArray array) {
        if (array.isEmpty() || !array.allObjects()) {
            return Optional.empty();
        }
        List<ToonValue> items = array.items();
        ToonObject first = (ToonObject) items.get(0);
        Set<String> common = new HashSet<>(first.fields().keySet());
        for (int i = 1; i < items.size() && !common.isEmpty(); i++) {
            common.retainAll(((ToonObject) items.get(i)).fields().keySet());
        }
        List<String> columns = new ArrayList<>();
        for (String key : first.fields().keySet()) {
            if (common.contains(key)) {
                columns.add(key);
            }
        }
        if (columns.isEmpty()) {
            return Optional.empty();
        }
        for (ToonValue item : items) {
            ToonObject row = (ToonObject) item;
            for (String column : columns) {
                if (!row.get(column).isPrimitive()) {
                    return Optional.empty();
                }
            }
        }
        return Optional.of(columns);
    }

    static String header(int length, Delimiter delimiter) {
        return "[" + length + delimiter.headerMarker() + "]";
    }

    private static String fieldList(List<String> columns) {
        var joiner = new StringJoiner(",", "{", "}");
        for (String column : columns) {
            joiner.add(ToonQuoting.quoteKey(column));
        }
        return joiner.toString();
    }

    enum ArrayLayout {
        EMPTY,
        INLINE,
        TABULAR,
        NESTED_LIST,
        MIXED_LIST
    }
}
