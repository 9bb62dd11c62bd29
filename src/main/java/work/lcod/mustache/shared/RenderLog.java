package work.lcod.mustache.shared;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;
import work.lcod.mustache.api.LogLevel;

/**
 * Threshold-filtered diagnostics written to stderr (or a supplied stream).
 */
public final class RenderLog {
    private static final RenderLog SILENT = new RenderLog(LogLevel.FATAL, System.err);

    private final LogLevel threshold;
    private final PrintStream out;

    public RenderLog(LogLevel threshold, PrintStream out) {
        this.threshold = threshold == null ? LogLevel.FATAL : threshold;
        this.out = Objects.requireNonNull(out, "out");
    }

    public static RenderLog stderr(LogLevel threshold) {
        return new RenderLog(threshold, System.err);
    }

    public static RenderLog silent() {
        return SILENT;
    }

    public boolean isEnabled(LogLevel level) {
        return threshold.allows(level);
    }

    public void log(LogLevel level, String format, Object... args) {
        if (!isEnabled(level)) {
            return;
        }
        out.printf("[%s] %s%n", level.name().toLowerCase(Locale.ROOT), String.format(format, args));
    }

    public void trace(String format, Object... args) {
        log(LogLevel.TRACE, format, args);
    }

    public void warn(String format, Object... args) {
        log(LogLevel.WARN, format, args);
    }

    public void error(String format, Object... args) {
        log(LogLevel.ERROR, format, args);
    }
}
