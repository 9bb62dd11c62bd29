package work.lcod.mustache.api;

import work.lcod.mustache.escape.HtmlEscaper;
import work.lcod.mustache.render.TextEscaper;

/**
 * Escaping applied to {@code {{name}}} tags. {@code {{& name}}} tags are never escaped.
 */
public enum EscapeMode {
    HTML(HtmlEscaper.INSTANCE),
    NONE(TextEscaper.NONE);

    private final TextEscaper escaper;

    EscapeMode(TextEscaper escaper) {
        this.escaper = escaper;
    }

    public TextEscaper escaper() {
        return escaper;
    }
}
