package work.lcod.mustache.value;

import java.util.List;
import java.util.Map;

/**
 * Variants of the document value model. Documents are the plain trees produced by Jackson/tomlj
 * ({@code null}, {@link Boolean}, {@link Number}, {@link String}, {@link List}, {@link Map}).
 */
public enum ValueKind {
    NULL,
    FALSE,
    TRUE,
    NUMBER,
    STRING,
    ARRAY,
    MAP;

    public static ValueKind of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Boolean bool) {
            return bool ? TRUE : FALSE;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof CharSequence) {
            return STRING;
        }
        if (value instanceof List<?>) {
            return ARRAY;
        }
        if (value instanceof Map<?, ?>) {
            return MAP;
        }
        throw new IllegalArgumentException("Unsupported document value: " + value.getClass().getName());
    }

    /**
     * Null and False are the only falsy variants. Empty arrays are handled by the repetition count.
     */
    public boolean isFalsy() {
        return this == NULL || this == FALSE;
    }
}
