package com.raditha.ompx.frontend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.ompx.ast.ArraySectionExpr;
import com.raditha.ompx.ast.ArraySubscriptExpr;
import com.raditha.ompx.ast.BinaryOpcode;
import com.raditha.ompx.ast.BinaryOperation;
import com.raditha.ompx.ast.CapturedStmt;
import com.raditha.ompx.ast.CastExpr;
import com.raditha.ompx.ast.ClauseKind;
import com.raditha.ompx.ast.CompoundStmt;
import com.raditha.ompx.ast.ConstantExpr;
import com.raditha.ompx.ast.DeclRefExpr;
import com.raditha.ompx.ast.DirectiveKind;
import com.raditha.ompx.ast.DirectiveStmt;
import com.raditha.ompx.ast.DoStmt;
import com.raditha.ompx.ast.FloatingLiteral;
import com.raditha.ompx.ast.ForStmt;
import com.raditha.ompx.ast.FunctionDecl;
import com.raditha.ompx.ast.GenericNode;
import com.raditha.ompx.ast.IntegerLiteral;
import com.raditha.ompx.ast.MapType;
import com.raditha.ompx.ast.Node;
import com.raditha.ompx.ast.OmpClause;
import com.raditha.ompx.ast.TranslationUnit;
import com.raditha.ompx.ast.UnaryOperation;
import com.raditha.ompx.ast.WhileStmt;
import com.raditha.ompx.extraction.SourceBuffer;
import com.raditha.ompx.model.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads translation units from the JSON tree format produced by the front-end
 * dump step. Node kinds carry the names of the corresponding clang classes.
 * <pre>
 * { "file": "heat.c",
 *   "functions": [ { "name": "main", "file": "heat.c", "systemHeader": false,
 *                    "range": {...}, "body": { "kind": "CompoundStmt", ... } } ] }
 * </pre>
 * Source text for every file named in the tree is read relative to the source
 * root. A file that cannot be found is analyzed without text.
 */
public class JsonSyntaxTreeReader implements SyntaxTreeProvider {

    private static final Logger logger = LoggerFactory.getLogger(JsonSyntaxTreeReader.class);

    private static final ObjectMapper mapper = new ObjectMapper();

    private static final String KIND = "kind";
    private static final String INNER = "inner";
    private static final String RANGE = "range";

    private final Path sourceRoot;

    public JsonSyntaxTreeReader(Path sourceRoot) {
        this.sourceRoot = sourceRoot;
    }

    @Override
    public TranslationUnit load(Path input) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(input.toFile());
        } catch (JsonProcessingException e) {
            throw new TreeFormatException("Malformed syntax tree " + input + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new TreeFormatException("Syntax tree " + input + " is not a JSON object");
        }
        TranslationUnit unit = parseTranslationUnit(root);
        logger.debug("Loaded {} function(s) from {}", unit.functions().size(), input);
        return unit;
    }

    /**
     * Build a translation unit from an already parsed document.
     */
    public TranslationUnit parseTranslationUnit(JsonNode root) throws IOException {
        String mainFile = requiredText(root, "file", "translation unit");
        List<FunctionDecl> functions = new ArrayList<>();
        for (JsonNode function : elements(root, "functions")) {
            functions.add(parseFunction(function, mainFile));
        }

        Set<String> files = new LinkedHashSet<>();
        files.add(mainFile);
        functions.forEach(f -> files.add(f.filename()));
        Map<String, SourceBuffer> buffers = new LinkedHashMap<>();
        for (String file : files) {
            readSource(file).ifPresent(buffer -> buffers.put(file, buffer));
        }
        return new TranslationUnit(mainFile, functions, buffers);
    }

    private Optional<SourceBuffer> readSource(String file) throws IOException {
        Path path = sourceRoot.resolve(file);
        if (!Files.isRegularFile(path)) {
            logger.warn("Source text for {} not found at {}; snippets and statement ids are disabled for it",
                    file, path);
            return Optional.empty();
        }
        return Optional.of(SourceBuffer.of(file, Files.readString(path, StandardCharsets.UTF_8)));
    }

    private FunctionDecl parseFunction(JsonNode function, String mainFile) throws IOException {
        String name = requiredText(function, "name", "function");
        String file = function.path("file").asText(mainFile);
        boolean systemHeader = function.path("systemHeader").asBoolean(false);
        Node body = optionalNode(function, "body");
        if (body != null && !(body instanceof CompoundStmt)) {
            throw new TreeFormatException("Body of function " + name + " must be a CompoundStmt, got " + body.getKindName());
        }
        return new FunctionDecl(name, file, systemHeader, parseRange(function.get(RANGE)), (CompoundStmt) body);
    }

    /**
     * Convert one node object and its subtree.
     */
    Node parseNode(JsonNode json) throws IOException {
        if (json == null || !json.isObject()) {
            throw new TreeFormatException("Expected a node object, got " + json);
        }
        String kind = requiredText(json, KIND, "node");
        SourceSpan span = parseRange(json.get(RANGE));

        switch (kind) {
            case "CompoundStmt":
                return new CompoundStmt(span, inner(json));
            case "CapturedStmt":
                return new CapturedStmt(span, innerAt(json, 0, kind));
            case "ForStmt":
                return new ForStmt(span,
                        optionalNode(json, "init"),
                        optionalNode(json, "cond"),
                        optionalNode(json, "inc"),
                        optionalNode(json, "body"));
            case "WhileStmt":
                return new WhileStmt(span, optionalNode(json, "cond"), optionalNode(json, "body"));
            case "DoStmt":
                return new DoStmt(span, optionalNode(json, "body"), optionalNode(json, "cond"));
            case "DeclRefExpr":
                return new DeclRefExpr(span, requiredText(json, "name", kind));
            case "IntegerLiteral":
                return new IntegerLiteral(span, integerValue(json));
            case "FloatingLiteral":
                return new FloatingLiteral(span, json.path("value").asText(""));
            case "BinaryOperator", "CompoundAssignOperator":
                return new BinaryOperation(span, binaryOpcode(json), innerAt(json, 0, kind), innerAt(json, 1, kind));
            case "UnaryOperator":
                return new UnaryOperation(span,
                        requiredText(json, "opcode", kind),
                        json.path("isPostfix").asBoolean(false),
                        innerAt(json, 0, kind));
            case "ArraySubscriptExpr":
                return new ArraySubscriptExpr(span, innerAt(json, 0, kind), innerAt(json, 1, kind));
            case "OMPArraySectionExpr":
                return new ArraySectionExpr(span,
                        requiredNode(json, "base", kind),
                        optionalNode(json, "lowerBound"),
                        optionalNode(json, "length"));
            case "ImplicitCastExpr":
                return new CastExpr(span, true, innerAt(json, 0, kind));
            case "CStyleCastExpr":
                return new CastExpr(span, false, innerAt(json, 0, kind));
            case "ConstantExpr":
                return new ConstantExpr(span, innerAt(json, 0, kind));
            default:
                if (kind.startsWith("OMP") && kind.endsWith("Directive")) {
                    return parseDirective(json, kind, span);
                }
                return new GenericNode(span, kind, inner(json));
        }
    }

    private DirectiveStmt parseDirective(JsonNode json, String kind, SourceSpan span) throws IOException {
        DirectiveKind directiveKind = DirectiveKind.fromNodeKind(kind).orElseGet(() -> {
            logger.warn("Unknown directive kind {} treated as an unclassified directive", kind);
            return DirectiveKind.OTHER;
        });
        List<OmpClause> clauses = new ArrayList<>();
        for (JsonNode clause : elements(json, "clauses")) {
            clauses.add(parseClause(clause));
        }
        return new DirectiveStmt(span, directiveKind, clauses, optionalNode(json, "associated"));
    }

    private OmpClause parseClause(JsonNode json) throws IOException {
        String kind = requiredText(json, KIND, "clause");
        ClauseKind clauseKind = ClauseKind.fromNodeKind(kind).orElse(ClauseKind.OTHER);
        String operator = json.hasNonNull("operator") ? json.get("operator").asText() : null;
        MapType mapType = json.hasNonNull("mapType") ? mapType(json.get("mapType")) : null;
        return new OmpClause(clauseKind, json.path("implicit").asBoolean(false), inner(json), operator, mapType);
    }

    /**
     * Map type of a clause, {@code null} when the value is not recognised. Such a
     * clause is kept but its operands are not reported.
     */
    private static MapType mapType(JsonNode value) {
        Optional<MapType> mapType = value.isNumber()
                ? MapType.fromDiscriminant(value.asInt())
                : MapType.fromName(value.asText());
        if (mapType.isEmpty()) {
            logger.warn("Unknown map type {}, map clause will not be reported", value);
            return null;
        }
        return mapType.get();
    }

    private static BinaryOpcode binaryOpcode(JsonNode json) throws TreeFormatException {
        String opcode = requiredText(json, "opcode", json.path(KIND).asText());
        return BinaryOpcode.fromSpelling(opcode)
                .orElseThrow(() -> new TreeFormatException("Unknown binary operator '" + opcode + "'"));
    }

    private static BigInteger integerValue(JsonNode json) throws TreeFormatException {
        JsonNode value = json.get("value");
        if (value != null && value.isIntegralNumber()) {
            return value.bigIntegerValue();
        }
        if (value != null && value.isTextual()) {
            try {
                return new BigInteger(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new TreeFormatException("IntegerLiteral value is not an integer: " + value, e);
            }
        }
        throw new TreeFormatException("IntegerLiteral without an integer value");
    }

    /**
     * Span of a range object, {@code null} when the range is absent.
     * Missing coordinates read as 0, which makes the span invalid.
     */
    static SourceSpan parseRange(JsonNode range) {
        if (range == null || !range.isObject()) {
            return null;
        }
        JsonNode begin = range.path("begin");
        JsonNode end = range.path("end");
        return new SourceSpan(
                begin.path("line").asInt(0),
                end.path("line").asInt(0),
                begin.path("col").asInt(0),
                end.path("col").asInt(0));
    }

    private List<Node> inner(JsonNode json) throws IOException {
        List<Node> nodes = new ArrayList<>();
        for (JsonNode child : elements(json, INNER)) {
            nodes.add(parseNode(child));
        }
        return nodes;
    }

    private Node innerAt(JsonNode json, int index, String kind) throws IOException {
        JsonNode inner = json.get(INNER);
        if (inner == null || !inner.isArray() || inner.size() <= index) {
            throw new TreeFormatException(kind + " needs at least " + (index + 1) + " inner node(s)");
        }
        return parseNode(inner.get(index));
    }

    private Node optionalNode(JsonNode json, String field) throws IOException {
        JsonNode child = json.get(field);
        if (child == null || child.isNull()) {
            return null;
        }
        return parseNode(child);
    }

    private Node requiredNode(JsonNode json, String field, String kind) throws IOException {
        Node node = optionalNode(json, field);
        if (node == null) {
            throw new TreeFormatException(kind + " without '" + field + "'");
        }
        return node;
    }

    private static Iterable<JsonNode> elements(JsonNode json, String field) throws TreeFormatException {
        JsonNode array = json.get(field);
        if (array == null || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new TreeFormatException("'" + field + "' must be an array");
        }
        return array;
    }

    private static String requiredText(JsonNode json, String field, String what) throws TreeFormatException {
        JsonNode value = json.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new TreeFormatException(what + " without '" + field + "'");
        }
        return value.asText();
    }
}
