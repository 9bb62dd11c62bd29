package work.lcod.mustache.section;

import java.util.Map;
import work.lcod.mustache.render.RenderException;
import work.lcod.mustache.resolve.NameResolver;
import work.lcod.mustache.scope.ScopeFrame;
import work.lcod.mustache.value.Values;

/**
 * Decides how often a section repeats and which context each repetition sees.
 */
public final class SectionPolicy {
    /** Count returned when the section cannot be evaluated at all. */
    public static final int ERROR = -1;

    private SectionPolicy() {}

    /**
     * Repetition count for {@code name}: 0 for a miss, Null or False; the length for an array;
     * 1 for anything else. Callable sections are not interpreted and follow the same rules.
     */
    public static int test(ScopeFrame frame, String name, boolean callable) {
        var resolved = NameResolver.resolve(frame, name);
        // a miss reports NULL
        return switch (resolved.kind()) {
            case ARRAY -> Values.length(resolved.value());
            case NULL, FALSE -> 0;
            case TRUE, NUMBER, STRING, MAP -> 1;
        };
    }

    /**
     * Context for repetition {@code index}: the array element for arrays, the value itself otherwise.
     *
     * @throws RenderException when the name no longer resolves or the index is outside the array
     */
    public static Object enter(ScopeFrame frame, String name, int index) {
        var resolved = NameResolver.resolve(frame, name);
        if (!resolved.isFound()) {
            throw RenderException.structural(
                "Section '" + name + "' has no value to enter",
                Map.of("name", name, "index", index)
            );
        }
        var value = resolved.value();
        if (!Values.isArray(value)) {
            return value;
        }
        int length = Values.length(value);
        if (index < 0 || index >= length) {
            throw RenderException.structural(
                "Section '" + name + "' index " + index + " out of range (length " + length + ")",
                Map.of("name", name, "index", index, "length", length)
            );
        }
        return Values.element(value, index);
    }
}
