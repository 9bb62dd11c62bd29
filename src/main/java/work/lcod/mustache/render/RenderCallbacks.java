package work.lcod.mustache.render;

import work.lcod.mustache.scope.ScopeFrame;

/**
 * Callbacks an instruction executor invokes while walking a compiled template. Every call receives the
 * frame at the top of the scope stack.
 */
public interface RenderCallbacks {
    /** Plain template text, emitted verbatim. */
    void onText(ScopeFrame frame, String text);

    /** Interpolation tag. */
    void onArg(ScopeFrame frame, String name, boolean escape);

    /**
     * Section open. Returns the repetition count, or {@code -1} to abort the render.
     */
    int onSectionTest(ScopeFrame frame, String name, boolean callable);

    /**
     * Called once per repetition; returns the context of the frame pushed for the section body.
     */
    Object onSectionStart(ScopeFrame frame, String name, int index);

    /** Unrecoverable failure. Implementations must not throw. */
    void onError(Object context);
}
