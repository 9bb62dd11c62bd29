package work.lcod.mustache.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.mustache.api.DocumentFormat;
import work.lcod.mustache.render.RenderException;

/**
 * Turns JSON/YAML/TOML text into the plain Map/List value tree the resolver reads.
 */
public final class DocumentLoader {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private DocumentLoader() {}

    public static Object loadFromLocalFile(Path path) {
        return loadFromLocalFile(path, DocumentFormat.detect(path));
    }

    public static Object loadFromLocalFile(Path path, DocumentFormat format) {
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8), format);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read document: " + path, ex);
        }
    }

    public static Object parse(String text, DocumentFormat format) {
        if (text == null || text.isBlank()) {
            return new LinkedHashMap<String, Object>();
        }
        return switch (format) {
            case JSON -> readJackson(JSON, text, format);
            case YAML -> readJackson(YAML, text, format);
            case TOML -> parseToml(text);
        };
    }

    private static Object readJackson(ObjectMapper mapper, String text, DocumentFormat format) {
        try {
            return normalize(mapper.readValue(text, Object.class));
        } catch (JsonProcessingException ex) {
            throw new RenderException(
                RenderException.INVALID_DOCUMENT,
                format.name().toLowerCase(Locale.ROOT) + " parse error: " + ex.getOriginalMessage(),
                null,
                ex
            );
        }
    }

    /**
     * Reduces Jackson's untyped output to the plain value model; YAML tags such as {@code !!binary}
     * or timestamps would otherwise leak other types.
     */
    private static Object normalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            map.forEach((key, item) -> normalized.put(String.valueOf(key), normalize(item)));
            return normalized;
        }
        if (value instanceof List<?> list) {
            List<Object> normalized = new ArrayList<>(list.size());
            for (Object item : list) {
                normalized.add(normalize(item));
            }
            return normalized;
        }
        if (value instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof String || value == null) {
            return value;
        }
        return value.toString();
    }

    private static Object parseToml(String text) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new RenderException(
                RenderException.INVALID_DOCUMENT,
                "toml parse error: " + result.errors().get(0).toString(),
                null
            );
        }
        return convertTomlTable(result);
    }

    private static Map<String, Object> convertTomlTable(TomlTable table) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            map.put(key, convertTomlValue(table.get(List.of(key))));
        }
        return map;
    }

    private static Object convertTomlValue(Object value) {
        if (value instanceof TomlTable table) {
            return convertTomlTable(table);
        }
        if (value instanceof TomlArray array) {
            List<Object> list = new ArrayList<>();
            for (int i = 0; i < array.size(); i++) {
                list.add(convertTomlValue(array.get(i)));
            }
            return list;
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof String || value == null) {
            return value;
        }
        // dates and times
        return value.toString();
    }
}
