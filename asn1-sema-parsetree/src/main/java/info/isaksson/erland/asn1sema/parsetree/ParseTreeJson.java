package info.isaksson.erland.asn1sema.parsetree;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON codec for parse forests handed over by an external ASN.1 parser.
 *
 * <p>Format: a forest is a JSON array of nodes. A node is {@code {"ty": "<tag>", "elements": [...]}};
 * an element is a node, a token (JSON string or number) or a nested sequence (JSON array of nodes).</p>
 *
 * <p>Writing is deterministic so fixtures can be diffed.</p>
 */
public final class ParseTreeJson {

    static final String TYPE_FIELD = "ty";
    static final String ELEMENTS_FIELD = "elements";

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private ParseTreeJson() {}

    public static List<ParseNode> read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return toForest(MAPPER.readTree(in));
        }
    }

    /** Parse a forest from a JSON string. */
    public static List<ParseNode> readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return toForest(MAPPER.readTree(json));
    }

    public static void write(List<ParseNode> forest, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, fromForest(forest));
            // Ensure trailing newline for diff-friendliness.
            out.write('\n');
        }
    }

    public static String toJsonString(List<ParseNode> forest) throws JsonProcessingException {
        return MAPPER.writer(PRETTY).writeValueAsString(fromForest(forest)) + "\n";
    }

    private static List<ParseNode> toForest(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new MalformedParseTreeException("Parse forest must be a JSON array of nodes");
        }
        List<ParseNode> out = new ArrayList<>(root.size());
        for (JsonNode n : root) {
            out.add(toNode(n));
        }
        return out;
    }

    private static ParseNode toNode(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new MalformedParseTreeException("Parse node must be a JSON object but was: " + json);
        }
        JsonNode ty = json.get(TYPE_FIELD);
        if (ty == null || !ty.isTextual()) {
            throw new MalformedParseTreeException("Parse node lacks a textual '" + TYPE_FIELD + "': " + json);
        }
        ProductionKind kind = ProductionKind.fromTag(ty.asText());

        JsonNode elements = json.get(ELEMENTS_FIELD);
        if (elements == null || elements.isNull()) {
            return new ParseNode(kind, List.of());
        }
        if (!elements.isArray()) {
            throw new MalformedParseTreeException(kind + ": '" + ELEMENTS_FIELD + "' must be an array");
        }
        List<ParseElement> out = new ArrayList<>(elements.size());
        for (JsonNode e : elements) {
            out.add(toElement(kind, e));
        }
        return new ParseNode(kind, out);
    }

    private static ParseElement toElement(ProductionKind owner, JsonNode e) {
        if (e.isObject()) return toNode(e);
        if (e.isTextual()) return new ParseToken(e.asText());
        if (e.isIntegralNumber()) return new ParseToken(e.bigIntegerValue().toString());
        if (e.isNumber()) return new ParseToken(e.decimalValue().toPlainString());
        if (e.isArray()) {
            List<ParseNode> nodes = new ArrayList<>(e.size());
            for (JsonNode n : e) {
                if (!n.isObject()) {
                    throw new MalformedParseTreeException(owner + ": nested sequences may only contain nodes, found " + n);
                }
                nodes.add(toNode(n));
            }
            return new ParseSequence(nodes);
        }
        throw new MalformedParseTreeException(owner + ": unsupported element " + e);
    }

    private static ArrayNode fromForest(List<ParseNode> forest) {
        ArrayNode arr = JsonNodeFactory.instance.arrayNode();
        if (forest == null) return arr;
        for (ParseNode n : forest) {
            arr.add(fromNode(n));
        }
        return arr;
    }

    private static ObjectNode fromNode(ParseNode node) {
        ObjectNode obj = JsonNodeFactory.instance.objectNode();
        obj.put(TYPE_FIELD, node.kind.tag());
        ArrayNode elements = obj.putArray(ELEMENTS_FIELD);
        for (ParseElement e : node.elements) {
            if (e.isNode()) {
                elements.add(fromNode(e.asNode()));
            } else if (e.isToken()) {
                elements.add(e.asToken().text);
            } else {
                ArrayNode seq = elements.addArray();
                for (ParseNode n : e.asSequence().nodes) {
                    seq.add(fromNode(n));
                }
            }
        }
        return obj;
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
