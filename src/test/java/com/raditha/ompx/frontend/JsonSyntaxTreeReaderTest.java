package com.raditha.ompx.frontend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.ompx.analysis.ExpressionPrinter;
import com.raditha.ompx.ast.ArraySectionExpr;
import com.raditha.ompx.ast.BinaryOpcode;
import com.raditha.ompx.ast.BinaryOperation;
import com.raditha.ompx.ast.CapturedStmt;
import com.raditha.ompx.ast.ClauseKind;
import com.raditha.ompx.ast.CompoundStmt;
import com.raditha.ompx.ast.DirectiveKind;
import com.raditha.ompx.ast.DirectiveStmt;
import com.raditha.ompx.ast.ForStmt;
import com.raditha.ompx.ast.FunctionDecl;
import com.raditha.ompx.ast.GenericNode;
import com.raditha.ompx.ast.IntegerLiteral;
import com.raditha.ompx.ast.MapType;
import com.raditha.ompx.ast.Node;
import com.raditha.ompx.ast.OmpClause;
import com.raditha.ompx.ast.TranslationUnit;
import com.raditha.ompx.ast.WhileStmt;
import com.raditha.ompx.model.SourceSpan;
import com.raditha.ompx.testsupport.TestResources;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonSyntaxTreeReaderTest {

    @TempDir
    Path tempDir;

    private static final ObjectMapper mapper = new ObjectMapper();

    private JsonSyntaxTreeReader reader;

    @BeforeEach
    void setUp() {
        reader = new JsonSyntaxTreeReader(tempDir);
    }

    private Node parse(String json) throws IOException {
        return reader.parseNode(mapper.readTree(json));
    }

    @Test
    void testLoad_HeatTree() throws IOException {
        TestResources.copyTree(TestResources.HEAT_SOURCE, tempDir);
        Path tree = TestResources.copyTree(TestResources.HEAT_TREE, tempDir);

        TranslationUnit unit = reader.load(tree);

        assertEquals("heat.c", unit.mainFile());
        assertEquals(3, unit.functions().size());
        assertTrue(unit.getBuffer("heat.c").isPresent());
        assertTrue(unit.getBuffer("include/stdio.h").isEmpty());

        FunctionDecl printf = unit.functions().get(0);
        assertTrue(printf.systemHeader());
        assertEquals("include/stdio.h", printf.filename());
        assertTrue(printf.getBody().isEmpty());

        FunctionDecl step = unit.functions().get(1);
        assertEquals("step", step.name());
        CompoundStmt body = step.getBody().orElseThrow();
        assertEquals(3, body.getStatements().size());
        DirectiveStmt directive = assertInstanceOf(DirectiveStmt.class, body.getStatements().get(1));
        assertEquals(DirectiveKind.TARGET_PARALLEL_FOR, directive.getKind());
        assertEquals(new SourceSpan(3, 3, 3, 84), directive.getSpan().orElseThrow());
        assertEquals(3, directive.getClauses().size());
        assertEquals(MapType.TO, directive.getClauses().get(0).getMapType().orElseThrow());
        assertEquals(MapType.TOFROM, directive.getClauses().get(1).getMapType().orElseThrow());
        assertEquals("operator+", directive.getClauses().get(2).getReductionOperator().orElseThrow());
        assertInstanceOf(CapturedStmt.class, directive.getAssociatedStmt().orElseThrow());

        ForStmt loop = assertInstanceOf(ForStmt.class, directive.getInnermostCapturedStmt().orElseThrow());
        ExpressionPrinter printer = new ExpressionPrinter();
        BinaryOperation condition = assertInstanceOf(BinaryOperation.class, loop.getCondition().orElseThrow());
        assertEquals(BinaryOpcode.LT, condition.getOpcode());
        assertEquals("n", printer.print(condition.getRhs()));
        assertEquals("i", printer.inductionVariable(loop).orElseThrow());
        ArraySectionExpr section = assertInstanceOf(ArraySectionExpr.class,
                directive.getClauses().get(0).getOperands().get(0));
        assertEquals("a[0:n]", printer.print(section));

        FunctionDecl fixup = unit.functions().get(2);
        assertInstanceOf(WhileStmt.class, fixup.getBody().orElseThrow().getStatements().get(1));
    }

    @Test
    void testLoad_MissingSourceTextIsTolerated() throws IOException {
        Path tree = TestResources.copyTree(TestResources.HEAT_TREE, tempDir);

        TranslationUnit unit = reader.load(tree);

        assertTrue(unit.getBuffer("heat.c").isEmpty());
        assertEquals(3, unit.functions().size());
    }

    @Test
    void testLoad_MalformedJson() throws IOException {
        Path tree = Files.writeString(tempDir.resolve("broken.json"), "{\"file\": \"a.c\", \"functions\": [");

        assertThrows(TreeFormatException.class, () -> reader.load(tree));
    }

    @Test
    void testLoad_RootMustBeObject() throws IOException {
        Path tree = Files.writeString(tempDir.resolve("array.json"), "[1, 2, 3]");

        TreeFormatException e = assertThrows(TreeFormatException.class, () -> reader.load(tree));
        assertTrue(e.getMessage().contains("not a JSON object"));
    }

    @Test
    void testLoad_FunctionWithoutName() throws IOException {
        Path tree = Files.writeString(tempDir.resolve("anon.json"),
                "{\"file\": \"a.c\", \"functions\": [{\"file\": \"a.c\"}]}");

        assertThrows(TreeFormatException.class, () -> reader.load(tree));
    }

    @Test
    void testLoad_MissingTreeFile() {
        IOException e = assertThrows(IOException.class, () -> reader.load(tempDir.resolve("absent.json")));
        assertFalse(e instanceof TreeFormatException);
    }

    @Test
    void testParseNode_UnknownDirectiveIsUnclassified() throws IOException {
        Node node = parse("""
                {"kind": "OMPMetaDirective",
                 "range": {"begin": {"line": 1, "col": 1}, "end": {"line": 1, "col": 20}}}
                """);

        DirectiveStmt directive = assertInstanceOf(DirectiveStmt.class, node);
        assertEquals(DirectiveKind.OTHER, directive.getKind());
        assertTrue(directive.getAssociatedStmt().isEmpty());
    }

    @Test
    void testParseNode_MapTypeByNameOrNumber() throws IOException {
        DirectiveStmt directive = (DirectiveStmt) parse("""
                {"kind": "OMPTargetEnterDataDirective",
                 "clauses": [
                   {"kind": "OMPMapClause", "mapType": "From", "inner": []},
                   {"kind": "OMPMapClause", "mapType": 5, "inner": []},
                   {"kind": "OMPNowaitClause"}]}
                """);

        assertEquals(DirectiveKind.TARGET_ENTER_DATA, directive.getKind());
        assertEquals(MapType.FROM, directive.getClauses().get(0).getMapType().orElseThrow());
        assertEquals(MapType.RELEASE, directive.getClauses().get(1).getMapType().orElseThrow());
        OmpClause nowait = directive.getClauses().get(2);
        assertEquals(ClauseKind.OTHER, nowait.getKind());
        assertTrue(nowait.getMapType().isEmpty());
    }

    @Test
    void testParseNode_UnknownMapTypeNotReported() throws IOException {
        DirectiveStmt directive = assertInstanceOf(DirectiveStmt.class, parse("""
                {"kind": "OMPTargetDirective",
                 "clauses": [{"kind": "OMPMapClause", "mapType": 42, "implicit": true,
                              "inner": [{"kind": "DeclRefExpr", "name": "a"}]},
                             {"kind": "OMPMapClause", "mapType": "present",
                              "inner": [{"kind": "DeclRefExpr", "name": "b"}]}]}
                """));

        assertEquals(2, directive.getClauses().size());
        assertTrue(directive.getClauses().get(0).getMapType().isEmpty());
        assertTrue(directive.getClauses().get(1).getMapType().isEmpty());
        assertEquals(1, directive.getClauses().get(1).getOperands().size());
    }

    @Test
    void testParseNode_UnsignedLongLiteral() throws IOException {
        IntegerLiteral textual = assertInstanceOf(IntegerLiteral.class, parse("""
                {"kind": "IntegerLiteral", "value": "18446744073709551615"}
                """));
        IntegerLiteral numeric = assertInstanceOf(IntegerLiteral.class, parse("""
                {"kind": "IntegerLiteral", "value": 18446744073709551615}
                """));

        BigInteger max = new BigInteger("18446744073709551615");
        assertEquals(max, textual.getValue());
        assertEquals(max, numeric.getValue());
        assertEquals("18446744073709551615", new ExpressionPrinter().print(textual));
    }

    @Test
    void testParseNode_NonIntegerLiteralRejected() {
        assertThrows(TreeFormatException.class, () -> parse("""
                {"kind": "IntegerLiteral", "value": "0x1F"}
                """));
    }

    @Test
    void testLoad_WideLiteralKeepsTranslationUnit() throws IOException {
        Path tree = Files.writeString(tempDir.resolve("wide.json"), """
                {"file": "wide.c",
                 "functions": [{"name": "mask", "file": "wide.c",
                   "body": {"kind": "CompoundStmt", "inner": [
                     {"kind": "BinaryOperator", "opcode": "=",
                      "inner": [{"kind": "DeclRefExpr", "name": "m"},
                                {"kind": "IntegerLiteral", "value": "18446744073709551615"}]}]}}]}
                """);

        TranslationUnit unit = reader.load(tree);

        assertEquals(1, unit.functions().size());
        assertEquals(1, unit.functions().get(0).getBody().orElseThrow().getStatements().size());
    }

    @Test
    void testParseNode_BinaryOperators() throws IOException {
        BinaryOperation op = assertInstanceOf(BinaryOperation.class, parse("""
                {"kind": "CompoundAssignOperator", "opcode": "<<=",
                 "inner": [{"kind": "DeclRefExpr", "name": "x"},
                           {"kind": "IntegerLiteral", "value": "3"}]}
                """));

        assertEquals(BinaryOpcode.SHL_ASSIGN, op.getOpcode());
        assertEquals(BigInteger.valueOf(3), assertInstanceOf(IntegerLiteral.class, op.getRhs()).getValue());
        assertTrue(op.getSpan().isEmpty());
    }

    @Test
    void testParseNode_UnknownBinaryOperatorRejected() {
        assertThrows(TreeFormatException.class, () -> parse("""
                {"kind": "BinaryOperator", "opcode": "**",
                 "inner": [{"kind": "DeclRefExpr", "name": "x"}, {"kind": "DeclRefExpr", "name": "y"}]}
                """));
    }

    @Test
    void testParseNode_MissingOperandsRejected() {
        assertThrows(TreeFormatException.class, () -> parse("""
                {"kind": "ArraySubscriptExpr", "inner": [{"kind": "DeclRefExpr", "name": "a"}]}
                """));
    }

    @Test
    void testParseNode_UnknownKindKeepsChildren() throws IOException {
        GenericNode node = assertInstanceOf(GenericNode.class, parse("""
                {"kind": "IfStmt",
                 "inner": [{"kind": "DeclRefExpr", "name": "flag"},
                           {"kind": "CompoundStmt", "inner": []}]}
                """));

        assertEquals("IfStmt", node.getKindName());
        assertEquals(2, node.getChildren().size());
        assertInstanceOf(CompoundStmt.class, node.getChildren().get(1));
    }

    @Test
    void testParseRange_MissingCoordinatesAreInvalid() throws IOException {
        SourceSpan span = JsonSyntaxTreeReader.parseRange(mapper.readTree("""
                {"begin": {"line": 4}, "end": {"line": 4, "col": 9}}
                """));

        assertEquals(new SourceSpan(4, 4, 0, 9), span);
        assertFalse(span.isValid());
        assertNull(JsonSyntaxTreeReader.parseRange(null));
    }
}
