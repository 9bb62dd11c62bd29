package work.lcod.mustache.value;

import java.util.Objects;

/**
 * Outcome of a name lookup. Separates "no binding anywhere" from a binding whose value is {@code null}.
 */
public final class Resolution {
    private static final Resolution NOT_FOUND = new Resolution(false, null);

    private final boolean found;
    private final Object value;

    private Resolution(boolean found, Object value) {
        this.found = found;
        this.value = value;
    }

    public static Resolution found(Object value) {
        return new Resolution(true, value);
    }

    public static Resolution notFound() {
        return NOT_FOUND;
    }

    public boolean isFound() {
        return found;
    }

    /**
     * @throws IllegalStateException when called on a miss
     */
    public Object value() {
        if (!found) {
            throw new IllegalStateException("No value bound");
        }
        return value;
    }

    public ValueKind kind() {
        return found ? ValueKind.of(value) : ValueKind.NULL;
    }

    /**
     * True when a section would skip this binding: a miss, Null or False.
     */
    public boolean isFalsy() {
        return !found || kind().isFalsy();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Resolution that)) {
            return false;
        }
        return found == that.found && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(found, value);
    }

    @Override
    public String toString() {
        return found ? "Resolution[" + value + "]" : "Resolution[not found]";
    }
}
