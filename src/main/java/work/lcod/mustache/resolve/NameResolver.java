package work.lcod.mustache.resolve;

import java.util.List;
import work.lcod.mustache.scope.ScopeFrame;
import work.lcod.mustache.scope.ScopeStack;
import work.lcod.mustache.value.Resolution;
import work.lcod.mustache.value.Values;

/**
 * Binds tag names to document values.
 *
 * <p>The first segment of a name is looked up against the scope chain (nearest enclosing section wins).
 * Remaining segments descend strictly into the value found, so a missing nested field never falls back
 * to an unrelated ancestor scope.
 */
public final class NameResolver {
    private NameResolver() {}

    public static Resolution resolve(ScopeFrame frame, String name) {
        var path = NamePath.parse(name);
        var head = walkChain(frame, path.head());
        if (!head.isFound() || !path.isDotted()) {
            return head;
        }
        return descend(head.value(), path.tail());
    }

    /**
     * Finds {@code key} in the context of {@code frame} or the closest ancestor whose context is a map
     * holding that key.
     */
    public static Resolution walkChain(ScopeFrame frame, String key) {
        var frames = ScopeStack.chain(frame);
        while (frames.hasNext()) {
            var hit = Values.lookup(frames.next().context(), key);
            if (hit.isFound()) {
                return hit;
            }
        }
        return Resolution.notFound();
    }

    /**
     * Follows {@code segments} from {@code localRoot}, one map key per segment. No scope walking.
     */
    public static Resolution descend(Object localRoot, List<String> segments) {
        var current = Resolution.found(localRoot);
        for (String segment : segments) {
            current = Values.lookup(current.value(), segment);
            if (!current.isFound()) {
                return current;
            }
        }
        return current;
    }
}
