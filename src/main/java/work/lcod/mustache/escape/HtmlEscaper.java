package work.lcod.mustache.escape;

import work.lcod.mustache.render.TextEscaper;

/**
 * HTML escaping with numeric entities for markup-significant characters and spaces
 * ({@code "User 0"} becomes {@code "User&#32;0"}).
 */
public final class HtmlEscaper implements TextEscaper {
    public static final HtmlEscaper INSTANCE = new HtmlEscaper();

    private static final String ESCAPED = "&<>\"'/=` ";

    private HtmlEscaper() {}

    @Override
    public void escape(CharSequence text, StringBuilder out) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (ESCAPED.indexOf(c) >= 0) {
                out.append("&#").append((int) c).append(';');
            } else {
                out.append(c);
            }
        }
    }

    public static String escape(CharSequence text) {
        var out = new StringBuilder(text.length() + 16);
        INSTANCE.escape(text, out);
        return out.toString();
    }
}
