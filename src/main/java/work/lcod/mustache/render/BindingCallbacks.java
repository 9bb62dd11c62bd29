package work.lcod.mustache.render;

import java.util.Objects;
import work.lcod.mustache.resolve.NameResolver;
import work.lcod.mustache.scope.ScopeFrame;
import work.lcod.mustache.section.SectionPolicy;
import work.lcod.mustache.value.Values;

/**
 * Answers executor callbacks from the document bound to the scope chain and appends output to a
 * caller-owned sink.
 */
public final class BindingCallbacks implements RenderCallbacks {
    private final StringBuilder sink;
    private final TextEscaper escaper;

    public BindingCallbacks(StringBuilder sink, TextEscaper escaper) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.escaper = escaper == null ? TextEscaper.NONE : escaper;
    }

    public StringBuilder sink() {
        return sink;
    }

    @Override
    public void onText(ScopeFrame frame, String text) {
        sink.append(text);
    }

    @Override
    public void onArg(ScopeFrame frame, String name, boolean escape) {
        var resolved = NameResolver.resolve(frame, name);
        if (!resolved.isFound()) {
            return;
        }
        String text = Values.toText(resolved.value());
        if (text.isEmpty()) {
            return;
        }
        if (escape) {
            escaper.escape(text, sink);
        } else {
            sink.append(text);
        }
    }

    @Override
    public int onSectionTest(ScopeFrame frame, String name, boolean callable) {
        return SectionPolicy.test(frame, name, callable);
    }

    @Override
    public Object onSectionStart(ScopeFrame frame, String name, int index) {
        return SectionPolicy.enter(frame, name, index);
    }

    @Override
    public void onError(Object context) {
        // frames own nothing; partial output stays in the sink
    }
}
