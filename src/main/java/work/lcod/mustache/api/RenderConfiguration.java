package work.lcod.mustache.api;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable configuration for a single render run.
 */
public record RenderConfiguration(
    Path programPath,
    String documentPayload,
    DocumentFormat documentFormat,
    EscapeMode escapeMode,
    LogLevel logLevel
) {
    public RenderConfiguration {
        Objects.requireNonNull(programPath, "programPath");
        Objects.requireNonNull(documentPayload, "documentPayload");
        Objects.requireNonNull(documentFormat, "documentFormat");
        Objects.requireNonNull(escapeMode, "escapeMode");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path programPath;
        private String documentPayload = "{}";
        private DocumentFormat documentFormat = DocumentFormat.JSON;
        private EscapeMode escapeMode = EscapeMode.HTML;
        private LogLevel logLevel = LogLevel.FATAL;

        public Builder programPath(Path programPath) {
            this.programPath = programPath;
            return this;
        }

        public Builder documentPayload(String documentPayload) {
            this.documentPayload = documentPayload;
            return this;
        }

        public Builder documentFormat(DocumentFormat documentFormat) {
            this.documentFormat = documentFormat;
            return this;
        }

        public Builder escapeMode(EscapeMode escapeMode) {
            this.escapeMode = escapeMode;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public RenderConfiguration build() {
            return new RenderConfiguration(programPath, documentPayload, documentFormat, escapeMode, logLevel);
        }
    }
}
