package work.lcod.mustache.program;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.lcod.mustache.render.RenderException;

/**
 * Loads compiled programs from their YAML/JSON form:
 *
 * <pre>
 * name: users
 * program:
 *   - text: "* Users:\n"
 *   - section: users
 *     body:
 *       - arg: name
 *         escape: false
 * </pre>
 */
public final class ProgramLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ProgramLoader() {}

    public static Program loadFromLocalFile(Path path) {
        try (var in = Files.newInputStream(path)) {
            return parse(in, fileName(path));
        } catch (JsonProcessingException ex) {
            throw invalid("Unable to parse program " + path + ": " + ex.getOriginalMessage(), null, ex);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read program: " + path, ex);
        }
    }

    public static Program parse(String source) {
        try {
            return fromTree(YAML_MAPPER.readTree(source), null);
        } catch (IOException ex) {
            throw invalid("Unable to parse program: " + ex.getMessage(), null, ex);
        }
    }

    public static Program parse(InputStream in, String fallbackName) throws IOException {
        return fromTree(YAML_MAPPER.readTree(in), fallbackName);
    }

    private static Program fromTree(JsonNode root, String fallbackName) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return new Program(fallbackName, List.of());
        }
        if (root.isArray()) {
            return new Program(fallbackName, toInstructions(root, "program"));
        }
        if (!root.isObject()) {
            throw invalid("Program must be an object or a list of instructions", root, null);
        }
        var name = root.hasNonNull("name") ? root.get("name").asText() : fallbackName;
        var body = root.get("program");
        if (body == null || body.isNull()) {
            return new Program(name, List.of());
        }
        return new Program(name, toInstructions(body, "program"));
    }

    private static List<Instruction> toInstructions(JsonNode node, String where) {
        if (!node.isArray()) {
            throw invalid("'" + where + "' must be a list of instructions", node, null);
        }
        var instructions = new ArrayList<Instruction>();
        for (var item : node) {
            instructions.add(toInstruction(item));
        }
        return instructions;
    }

    private static Instruction toInstruction(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw invalid("Instruction must be an object", node, null);
        }
        if (node.has("text")) {
            return new Instruction.Text(requireText(node, "text"));
        }
        if (node.has("arg")) {
            return new Instruction.Arg(requireText(node, "arg"), flag(node, "escape", true));
        }
        if (node.has("section")) {
            var name = requireText(node, "section");
            var body = node.get("body");
            List<Instruction> children = body == null || body.isNull()
                ? List.of()
                : toInstructions(body, "section " + name + " body");
            return new Instruction.Section(name, flag(node, "inverted", false), flag(node, "callable", false), children);
        }
        throw invalid("Unknown instruction: " + node, node, null);
    }

    private static String requireText(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || !value.isValueNode() || value.isNull()) {
            throw invalid("'" + field + "' must be a scalar value", node, null);
        }
        return value.asText();
    }

    private static boolean flag(JsonNode node, String field, boolean fallback) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isBoolean()) {
            throw invalid("'" + field + "' must be a boolean", node, null);
        }
        return value.booleanValue();
    }

    private static RenderException invalid(String message, JsonNode node, Throwable cause) {
        Object data = node == null ? null : Map.of("node", node.toString());
        return new RenderException(RenderException.INVALID_PROGRAM, message, data, cause);
    }

    private static String fileName(Path path) {
        var file = path.getFileName();
        return file == null ? null : file.toString();
    }
}
