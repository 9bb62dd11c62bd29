package work.lcod.mustache.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of a {@link MustacheRenderer} run. On failure {@code output} holds the prefix emitted before
 * the render aborted.
 */
public record RenderResult(Status status, String output, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RenderResult {
        output = output == null ? "" : output;
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RenderResult success(String output, Map<String, Object> metadata, Instant startedAt) {
        return new RenderResult(Status.SUCCESS, output, metadata, startedAt, Instant.now());
    }

    public static RenderResult failure(String message, String partialOutput, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new RenderResult(Status.FAILURE, partialOutput, meta, startedAt, Instant.now());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("output", output);
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
