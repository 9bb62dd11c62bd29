package work.lcod.mustache.scope;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Chain of open section frames for a single render. Not thread-safe; one instance per render.
 */
public final class ScopeStack implements Iterable<ScopeFrame> {
    private final ScopeFrame root;
    private ScopeFrame top;

    public ScopeStack(Object document) {
        this.root = ScopeFrame.root(document);
        this.top = root;
    }

    public ScopeFrame root() {
        return root;
    }

    public ScopeFrame top() {
        return top;
    }

    public ScopeFrame push(Object context) {
        top = top.child(context);
        return top;
    }

    public ScopeFrame pop() {
        if (top.isRoot()) {
            throw new IllegalStateException("Cannot pop the root scope");
        }
        var popped = top;
        top = top.parentOrNull();
        return popped;
    }

    /** Number of frames pushed above the root. */
    public int depth() {
        return top.depth();
    }

    public static Optional<ScopeFrame> parentOf(ScopeFrame frame) {
        return frame.parent();
    }

    /**
     * Innermost first, ending with the root.
     */
    @Override
    public Iterator<ScopeFrame> iterator() {
        return chain(top);
    }

    public static Iterator<ScopeFrame> chain(ScopeFrame start) {
        return new Iterator<>() {
            private ScopeFrame next = start;

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public ScopeFrame next() {
                if (next == null) {
                    throw new NoSuchElementException();
                }
                var current = next;
                next = current.parentOrNull();
                return current;
            }
        };
    }
}
