package work.lcod.mustache.render;

/**
 * Escaping rule applied to interpolated text when the tag asks for it.
 */
@FunctionalInterface
public interface TextEscaper {
    TextEscaper NONE = (text, out) -> out.append(text);

    void escape(CharSequence text, StringBuilder out);
}
