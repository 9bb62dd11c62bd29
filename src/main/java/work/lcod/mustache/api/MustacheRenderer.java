package work.lcod.mustache.api;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Objects;
import work.lcod.mustache.exec.InstructionExecutor;
import work.lcod.mustache.io.DocumentLoader;
import work.lcod.mustache.program.Program;
import work.lcod.mustache.program.ProgramLoader;
import work.lcod.mustache.render.BindingCallbacks;
import work.lcod.mustache.render.RenderException;
import work.lcod.mustache.render.TextEscaper;
import work.lcod.mustache.shared.RenderLog;

/**
 * Public entry point for rendering compiled programs against documents.
 *
 * <p>Instances are stateless and may be shared; each call gets its own scope stack and sink.
 */
public final class MustacheRenderer {
    private final TextEscaper escaper;
    private final RenderLog log;

    public MustacheRenderer() {
        this(EscapeMode.HTML.escaper(), RenderLog.silent());
    }

    public MustacheRenderer(TextEscaper escaper, RenderLog log) {
        this.escaper = escaper == null ? TextEscaper.NONE : escaper;
        this.log = log == null ? RenderLog.silent() : log;
    }

    /**
     * Renders into a new buffer sized from the program's literal text.
     *
     * @throws RenderException if the render aborts
     */
    public String render(Program program, Object document) {
        Objects.requireNonNull(program, "program");
        return renderInto(new StringBuilder(program.literalLength()), program, document).toString();
    }

    /**
     * Appends the rendered text to {@code dest}. On failure the emitted prefix stays in {@code dest}.
     *
     * @throws RenderException if the render aborts
     */
    public StringBuilder renderInto(StringBuilder dest, Program program, Object document) {
        Objects.requireNonNull(dest, "dest");
        new InstructionExecutor(new BindingCallbacks(dest, escaper), log).execute(program, document);
        return dest;
    }

    /**
     * Loads the program and document named by the configuration and renders them. Never throws.
     */
    public static RenderResult run(RenderConfiguration configuration) {
        var started = Instant.now();
        var log = RenderLog.stderr(configuration.logLevel());
        var renderer = new MustacheRenderer(configuration.escapeMode().escaper(), log);
        var sink = new StringBuilder();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("program", configuration.programPath().toString());
        try {
            var program = ProgramLoader.loadFromLocalFile(configuration.programPath());
            var document = DocumentLoader.parse(configuration.documentPayload(), configuration.documentFormat());
            renderer.renderInto(sink, program, document);
            metadata.put("escape", configuration.escapeMode().name());
            metadata.put("logLevel", configuration.logLevel().name());
            return RenderResult.success(sink.toString(), metadata, started);
        } catch (RenderException ex) {
            metadata.put("code", ex.code());
            if (ex.data() != null) {
                metadata.put("data", ex.data());
            }
            debugTrace(ex);
            return RenderResult.failure(ex.getMessage(), sink.toString(), metadata, started);
        } catch (RuntimeException ex) {
            metadata.put("code", RenderException.UNEXPECTED_ERROR);
            debugTrace(ex);
            return RenderResult.failure(ex.getMessage(), sink.toString(), metadata, started);
        }
    }

    private static void debugTrace(Exception ex) {
        if (Boolean.getBoolean("lcod.debug")) {
            ex.printStackTrace();
        }
    }
}
