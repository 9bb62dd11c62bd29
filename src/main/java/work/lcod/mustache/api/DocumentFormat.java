package work.lcod.mustache.api;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Serialization of the input document.
 */
public enum DocumentFormat {
    JSON,
    YAML,
    TOML;

    public static DocumentFormat from(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        try {
            return DocumentFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported document format: " + value);
        }
    }

    /** Guess from the file extension, JSON when unknown. */
    public static DocumentFormat detect(Path path) {
        if (path == null || path.getFileName() == null) {
            return JSON;
        }
        String file = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (file.endsWith(".yaml") || file.endsWith(".yml")) {
            return YAML;
        }
        if (file.endsWith(".toml")) {
            return TOML;
        }
        return JSON;
    }
}
