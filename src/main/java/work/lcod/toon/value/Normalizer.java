package work.lcod.toon.value;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.POJONode;
import java.lang.reflect.Array;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URL;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.BaseStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.toon.error.MaxDepthExceededException;

/**
 * Maps arbitrary host objects onto the {@link ToonValue} model.
 * <p>
 * Conversion follows a fixed table (see {@link #normalize(Object)}); the only failure is
 * {@link MaxDepthExceededException} when the input nests deeper than {@code maxDepth}.
 */
public final class Normalizer {
    public static final int DEFAULT_MAX_DEPTH = 1000;

    private static final Logger log = LoggerFactory.getLogger(Normalizer.class);
    private static final long MAX_SAFE_INTEGER = 9_007_199_254_740_991L;
    private static final BigInteger MAX_SAFE = BigInteger.valueOf(MAX_SAFE_INTEGER);
    private static final BigInteger MIN_SAFE = MAX_SAFE.negate();

    private final int maxDepth;

    public Normalizer() {
        this(DEFAULT_MAX_DEPTH);
    }

    public Normalizer(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public ToonValue normalize(Object value) {
        return normalize(value, 0);
    }

    /**
     * Normalises {@code value} as if it sat {@code depth} levels below the document root.
     */
    public ToonValue normalize(Object value, int depth) {
        if (depth > maxDepth) {
            throw new MaxDepthExceededException(depth, maxDepth);
        }
        if (value instanceof ToonValue toon) {
            return toon;
        }
        if (value instanceof ToonSerializable custom) {
            Object replacement = custom.toToon();
            if (replacement != value) {
                return normalize(replacement, depth + 1);
            }
        }
        if (value == null) {
            return ToonNull.INSTANCE;
        }
        if (value instanceof Optional<?> optional) {
            return optional.isPresent() ? normalize(optional.get(), depth) : ToonNull.INSTANCE;
        }
        if (value instanceof Boolean bool) {
            return ToonValue.bool(bool);
        }
        if (value instanceof Number number) {
            return normalizeNumber(number);
        }
        if (value instanceof CharSequence text) {
            return ToonValue.string(text.toString());
        }
        if (value instanceof Character ch) {
            return ToonValue.string(String.valueOf(ch));
        }
        if (value instanceof Enum<?> constant) {
            return ToonValue.string(constant.name());
        }
        if (value instanceof UUID || value instanceof URI || value instanceof URL || value instanceof Path) {
            return ToonValue.string(value.toString());
        }
        if (value instanceof ZonedDateTime zoned) {
            return ToonValue.string(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(zoned));
        }
        if (value instanceof TemporalAccessor temporal) {
            return ToonValue.string(temporal.toString());
        }
        if (value instanceof Date date) {
            return ToonValue.string(Instant.ofEpochMilli(date.getTime()).toString());
        }
        if (value instanceof JsonNode node) {
            return normalizeJsonNode(node, depth);
        }
        if (value instanceof Set<?> set) {
            List<ToonValue> items = new ArrayList<>(set.size());
            for (Object element : set) {
                items.add(normalize(element, depth + 1));
            }
            items.sort(ValueOrdering.INSTANCE);
            return new ToonArray(items);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, ToonValue> fields = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                fields.put(normalizeKey(entry.getKey(), depth + 1), normalize(entry.getValue(), depth + 1));
            }
            return new ToonObject(fields);
        }
        if (value instanceof Record record) {
            return normalizeRecord(record, depth);
        }
        if (value instanceof Iterable<?> iterable) {
            return normalizeIterator(iterable.iterator(), depth);
        }
        if (value instanceof Iterator<?> iterator) {
            return normalizeIterator(iterator, depth);
        }
        if (value instanceof BaseStream<?, ?> stream) {
            try (stream) {
                return normalizeIterator(stream.iterator(), depth);
            }
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<ToonValue> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(normalize(Array.get(value, i), depth + 1));
            }
            return new ToonArray(items);
        }
        log.debug("Normalizing unsupported host type {} to null", value.getClass().getName());
        return ToonNull.INSTANCE;
    }

    private ToonValue normalizeIterator(Iterator<?> iterator, int depth) {
        List<ToonValue> items = new ArrayList<>();
        while (iterator.hasNext()) {
            items.add(normalize(iterator.next(), depth + 1));
        }
        return new ToonArray(items);
    }

    private String normalizeKey(Object key, int depth) {
        if (key instanceof String text) {
            return text;
        }
        ToonValue normalized = normalize(key, depth);
        return switch (normalized.kind()) {
            case STRING -> ((ToonString) normalized).value();
            case NUMBER -> ((ToonNumber) normalized).canonical();
            case BOOL -> Boolean.toString(((ToonBool) normalized).value());
            case NULL -> "null";
            case ARRAY, OBJECT -> String.valueOf(key);
        };
    }

    private ToonValue normalizeRecord(Record record, int depth) {
        Map<String, ToonValue> fields = new LinkedHashMap<>();
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            Object componentValue;
            try {
                var accessor = component.getAccessor();
                accessor.trySetAccessible();
                componentValue = accessor.invoke(record);
            } catch (ReflectiveOperationException | RuntimeException ex) {
                log.debug("Unable to read record component {}.{}: {}",
                    record.getClass().getName(), component.getName(), ex.getMessage());
                componentValue = null;
            }
            fields.put(component.getName(), normalize(componentValue, depth + 1));
        }
        return new ToonObject(fields);
    }

    private ToonValue normalizeJsonNode(JsonNode node, int depth) {
        if (node.isObject()) {
            Map<String, ToonValue> fields = new LinkedHashMap<>();
            var it = node.fields();
            while (it.hasNext()) {
                var entry = it.next();
                fields.put(entry.getKey(), normalize(entry.getValue(), depth + 1));
            }
            return new ToonObject(fields);
        }
        if (node.isArray()) {
            return normalizeIterator(node.elements(), depth);
        }
        if (node.isTextual()) {
            return ToonValue.string(node.textValue());
        }
        if (node.isBoolean()) {
            return ToonValue.bool(node.booleanValue());
        }
        if (node.isNumber()) {
            if (node.isIntegralNumber()) {
                return normalizeBigInteger(node.bigIntegerValue());
            }
            if (node.isBigDecimal()) {
                return normalizeBigDecimal(node.decimalValue());
            }
            return ToonValue.number(node.doubleValue());
        }
        if (node.isBinary()) {
            return ToonValue.string(node.asText());
        }
        if (node.isPojo()) {
            return normalize(((POJONode) node).getPojo(), depth);
        }
        return ToonNull.INSTANCE;
    }

    private static ToonValue normalizeNumber(Number number) {
        if (number instanceof BigInteger big) {
            return normalizeBigInteger(big);
        }
        if (number instanceof BigDecimal decimal) {
            return normalizeBigDecimal(decimal);
        }
        if (number instanceof Long || number instanceof AtomicLong) {
            long raw = number.longValue();
            if (raw > MAX_SAFE_INTEGER || raw < -MAX_SAFE_INTEGER) {
                return ToonValue.string(Long.toString(raw));
            }
            return ToonValue.number(raw);
        }
        if (number instanceof Integer || number instanceof Short || number instanceof Byte
            || number instanceof AtomicInteger) {
            return ToonValue.number(number.intValue());
        }
        return ToonValue.number(number.doubleValue());
    }

    private static ToonValue normalizeBigInteger(BigInteger big) {
        if (big.compareTo(MAX_SAFE) > 0 || big.compareTo(MIN_SAFE) < 0) {
            return ToonValue.string(big.toString());
        }
        return ToonValue.number(big.longValue());
    }

    private static ToonValue normalizeBigDecimal(BigDecimal decimal) {
        double asDouble = decimal.doubleValue();
        if (Double.isFinite(asDouble) && BigDecimal.valueOf(asDouble).compareTo(decimal) == 0) {
            return ToonValue.number(asDouble);
        }
        return ToonValue.string(decimal.toPlainString());
    }
}
