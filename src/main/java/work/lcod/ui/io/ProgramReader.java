package work.lcod.ui.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import work.lcod.ui.ast.LayoutProgram;
import work.lcod.ui.ast.Program;

/**
 * Loads program and layout files (JSON, or YAML for {@code .yaml}/{@code .yml}) into the AST.
 */
public final class ProgramReader {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ProgramReader() {}

    public static Program readProgram(Path path) {
        return AstMapper.program(readTree(path));
    }

    public static LayoutProgram readLayout(Path path) {
        return AstMapper.layout(readTree(path));
    }

    public static Program parseProgram(String json) {
        return AstMapper.program(parseTree(json));
    }

    public static LayoutProgram parseLayout(String json) {
        return AstMapper.layout(parseTree(json));
    }

    public static boolean isLayoutFile(Path path) {
        return AstMapper.isLayout(readTree(path));
    }

    /**
     * Reads a file into a plain tree of maps, lists and scalars.
     */
    public static Map<String, Object> readTree(Path path) {
        var mapper = isYaml(path) ? YAML_MAPPER : JSON_MAPPER;
        try (InputStream in = Files.newInputStream(path)) {
            return toMap(mapper.readTree(in));
        } catch (JsonProcessingException ex) {
            throw new ProgramFormatException("", "Malformed program file " + path + ": " + ex.getOriginalMessage());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read program: " + path, ex);
        }
    }

    public static Map<String, Object> parseTree(String json) {
        try {
            return toMap(JSON_MAPPER.readTree(json));
        } catch (JsonProcessingException ex) {
            throw new ProgramFormatException("", "Malformed program: " + ex.getOriginalMessage());
        }
    }

    private static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private static Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ProgramFormatException("", "Program root must be an object");
        }
        @SuppressWarnings("unchecked")
        var map = (Map<String, Object>) convertNode(node);
        return map;
    }

    static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.asText();
    }
}
