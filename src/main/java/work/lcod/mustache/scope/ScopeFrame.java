package work.lcod.mustache.scope;

import java.util.Optional;

/**
 * One open section level. Holds a non-owning reference to the value in context and a link to the
 * enclosing frame ({@code null} at the root).
 */
public final class ScopeFrame {
    private final Object context;
    private final ScopeFrame parent;
    private final int depth;

    private ScopeFrame(Object context, ScopeFrame parent) {
        this.context = context;
        this.parent = parent;
        this.depth = parent == null ? 0 : parent.depth + 1;
    }

    public static ScopeFrame root(Object document) {
        return new ScopeFrame(document, null);
    }

    ScopeFrame child(Object context) {
        return new ScopeFrame(context, this);
    }

    public Object context() {
        return context;
    }

    public Optional<ScopeFrame> parent() {
        return Optional.ofNullable(parent);
    }

    ScopeFrame parentOrNull() {
        return parent;
    }

    /** Zero for the root frame. */
    public int depth() {
        return depth;
    }

    public boolean isRoot() {
        return parent == null;
    }

    @Override
    public String toString() {
        return "ScopeFrame[depth=" + depth + "]";
    }
}
