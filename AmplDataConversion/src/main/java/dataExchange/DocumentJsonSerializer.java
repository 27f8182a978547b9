package dataExchange;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import models.AmplDataDocument;

/**
 * Writes an {@link AmplDataDocument} as JSON ({@code {"sets": {...}, "params": {...}}})
 * with two-space indentation and reads such JSON back.
 *
 * <p>Numbers are written as doubles. Non-finite values become the strings
 * "NaN", "Infinity" and "-Infinity" and are turned back into doubles when read.
 */
public class DocumentJsonSerializer {

    private static final Logger logger = LoggerFactory.getLogger(DocumentJsonSerializer.class);

    static final String SETS = "sets";
    static final String PARAMS = "params";

    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    public DocumentJsonSerializer() {
        this.mapper = new ObjectMapper();
        this.writer = mapper.writer(new TwoSpacePrettyPrinter());
    }

    public String writeString(AmplDataDocument document) throws IOException {
        return writer.writeValueAsString(toTree(document));
    }

    public void write(AmplDataDocument document, Path jsonFile) throws IOException {
        Path parent = jsonFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(jsonFile, writeString(document));
        logger.info("Wrote {}", jsonFile);
    }

    public AmplDataDocument readString(String json) throws IOException {
        return fromTree(mapper.readTree(json));
    }

    public AmplDataDocument read(Path jsonFile) throws IOException {
        return fromTree(mapper.readTree(jsonFile.toFile()));
    }

    ObjectNode toTree(AmplDataDocument document) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode sets = root.putObject(SETS);
        for (Map.Entry<String, List<String>> set : document.getSets().entrySet()) {
            ArrayNode elements = sets.putArray(set.getKey());
            for (String element : set.getValue()) {
                elements.add(element);
            }
        }

        ObjectNode params = root.putObject(PARAMS);
        for (Map.Entry<String, Object> param : document.getParams().entrySet()) {
            putValue(params, param.getKey(), param.getValue());
        }
        return root;
    }

    private void putValue(ObjectNode target, String name, Object value) {
        if (value instanceof Double) {
            target.put(name, (Double) value);
        } else if (value instanceof String) {
            target.put(name, (String) value);
        } else if (value instanceof Map) {
            ObjectNode nested = target.putObject(name);
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                putValue(nested, String.valueOf(entry.getKey()), entry.getValue());
            }
        } else {
            throw new IllegalArgumentException("Unsupported value for " + name + ": " + value);
        }
    }

    AmplDataDocument fromTree(JsonNode root) throws IOException {
        if (root == null || !root.isObject()) {
            throw new IOException("Expected a JSON object with 'sets' and 'params'");
        }
        AmplDataDocument document = new AmplDataDocument();

        JsonNode sets = requireObject(root, SETS);
        Iterator<Map.Entry<String, JsonNode>> setFields = sets.fields();
        while (setFields.hasNext()) {
            Map.Entry<String, JsonNode> set = setFields.next();
            if (!set.getValue().isArray()) {
                throw new IOException("Set " + set.getKey() + " is not an array");
            }
            List<String> elements = new ArrayList<>();
            for (JsonNode element : set.getValue()) {
                elements.add(element.asText());
            }
            document.putSet(set.getKey(), elements);
        }

        JsonNode params = requireObject(root, PARAMS);
        Iterator<Map.Entry<String, JsonNode>> paramFields = params.fields();
        while (paramFields.hasNext()) {
            Map.Entry<String, JsonNode> param = paramFields.next();
            readParam(document, param.getKey(), param.getValue());
        }
        return document;
    }

    private void readParam(AmplDataDocument document, String name, JsonNode node) throws IOException {
        if (!node.isObject()) {
            Double number = toDouble(node);
            if (number != null) {
                document.putScalar(name, number);
            } else if (node.isTextual()) {
                document.putScalar(name, node.textValue());
            } else {
                throw new IOException("Param " + name + " has unsupported value " + node);
            }
            return;
        }

        boolean table = false;
        for (JsonNode child : node) {
            table |= child.isObject();
        }
        if (table) {
            Map<String, Map<String, Double>> rows = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> rowFields = node.fields();
            while (rowFields.hasNext()) {
                Map.Entry<String, JsonNode> row = rowFields.next();
                if (!row.getValue().isObject()) {
                    throw new IOException("Row " + row.getKey() + " of table " + name + " is not an object");
                }
                rows.put(row.getKey(), readNumbers(name, row.getValue()));
            }
            document.putTable(name, rows);
        } else {
            document.putIndexedParam(name, readNumbers(name, node));
        }
    }

    private Map<String, Double> readNumbers(String name, JsonNode node) throws IOException {
        Map<String, Double> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Double number = toDouble(field.getValue());
            if (number == null) {
                throw new IOException("Param " + name + "[" + field.getKey() + "] is not a number");
            }
            values.put(field.getKey(), number);
        }
        return values;
    }

    private static Double toDouble(JsonNode node) {
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            switch (node.textValue()) {
                case "NaN":
                    return Double.NaN;
                case "Infinity":
                    return Double.POSITIVE_INFINITY;
                case "-Infinity":
                    return Double.NEGATIVE_INFINITY;
                default:
                    return null;
            }
        }
        return null;
    }

    private static JsonNode requireObject(JsonNode root, String field) throws IOException {
        JsonNode node = root.get(field);
        if (node == null || !node.isObject()) {
            throw new IOException("Missing object '" + field + "'");
        }
        return node;
    }

    /**
     * Two spaces per level, arrays one element per line, {@code "key": value} and
     * {@code {}} / {@code []} for empty containers.
     */
    static class TwoSpacePrettyPrinter extends DefaultPrettyPrinter {

        private static final long serialVersionUID = 1L;

        TwoSpacePrettyPrinter() {
            DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
            indentObjectsWith(indenter);
            indentArraysWith(indenter);
        }

        TwoSpacePrettyPrinter(TwoSpacePrettyPrinter base) {
            super(base);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new TwoSpacePrettyPrinter(this);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
            if (!_objectIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfEntries > 0) {
                _objectIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw('}');
        }

        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            if (!_arrayIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfValues > 0) {
                _arrayIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw(']');
        }
    }
}
