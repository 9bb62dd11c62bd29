package work.lcod.mustache.resolve;

import java.util.List;
import java.util.Objects;

/**
 * A tag name split at its dots. Empty segments are kept as literal (empty) keys.
 */
public record NamePath(String head, List<String> tail) {
    public NamePath {
        Objects.requireNonNull(head, "head");
        tail = tail == null ? List.of() : List.copyOf(tail);
    }

    public static NamePath parse(String name) {
        Objects.requireNonNull(name, "name");
        var segments = List.of(name.split("\\.", -1));
        return new NamePath(segments.get(0), segments.subList(1, segments.size()));
    }

    public boolean isDotted() {
        return !tail.isEmpty();
    }
}
