package work.lcod.mustache.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Read-only accessors over the document value model. Every variant check goes through {@link ValueKind}.
 */
public final class Values {
    private static final ObjectMapper JSON = new ObjectMapper();

    private Values() {}

    /**
     * Key lookup. Only the Map variant answers; every other variant reports a miss.
     */
    public static Resolution lookup(Object container, String key) {
        return switch (ValueKind.of(container)) {
            case MAP -> lookupKey((Map<?, ?>) container, key);
            case NULL, FALSE, TRUE, NUMBER, STRING, ARRAY -> Resolution.notFound();
        };
    }

    private static Resolution lookupKey(Map<?, ?> map, String key) {
        if (map.containsKey(key)) {
            return Resolution.found(map.get(key));
        }
        return Resolution.notFound();
    }

    public static boolean isMap(Object value) {
        return ValueKind.of(value) == ValueKind.MAP;
    }

    public static boolean isArray(Object value) {
        return ValueKind.of(value) == ValueKind.ARRAY;
    }

    public static int length(Object array) {
        return asList(array).size();
    }

    public static Object element(Object array, int index) {
        return asList(array).get(index);
    }

    /**
     * Text form used for interpolation. Null and False render as empty text.
     */
    public static String toText(Object value) {
        return switch (ValueKind.of(value)) {
            case NULL, FALSE -> "";
            case TRUE -> "true";
            case NUMBER -> formatNumber((Number) value);
            case STRING -> value.toString();
            case ARRAY, MAP -> toJson(value);
        };
    }

    private static List<?> asList(Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        throw new IllegalArgumentException("Expected an array value, got " + ValueKind.of(value));
    }

    private static String formatNumber(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (!Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        return number.toString();
    }

    private static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize value: " + ex.getOriginalMessage(), ex);
        }
    }
}
