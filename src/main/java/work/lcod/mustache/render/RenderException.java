package work.lcod.mustache.render;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unrecoverable render failure carrying an error code, message and optional data.
 */
public final class RenderException extends RuntimeException {
    public static final String STRUCTURAL_ERROR = "structural_error";
    public static final String INVALID_PROGRAM = "invalid_program";
    public static final String INVALID_DOCUMENT = "invalid_document";
    public static final String UNEXPECTED_ERROR = "unexpected_error";

    private final String code;
    private final Object data;

    public RenderException(String code, String message, Object data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public RenderException(String code, String message, Object data, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.data = data;
    }

    public static RenderException structural(String message, Object data) {
        return new RenderException(STRUCTURAL_ERROR, message, data);
    }

    public String code() {
        return code;
    }

    public Object data() {
        return data;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code);
        map.put("message", getMessage() == null ? "Unexpected error" : getMessage());
        if (data != null) {
            map.put("data", data);
        }
        return map;
    }
}
