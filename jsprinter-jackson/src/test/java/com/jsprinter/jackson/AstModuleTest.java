package com.jsprinter.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.jsprinter.ast.Comment;
import com.jsprinter.ast.DeclareExportDeclaration;
import com.jsprinter.ast.ExportNamedDeclaration;
import com.jsprinter.ast.ExportSpecifier;
import com.jsprinter.ast.Identifier;
import com.jsprinter.ast.ImportDeclaration;
import com.jsprinter.ast.ImportDefaultSpecifier;
import com.jsprinter.ast.ImportSpecifier;
import com.jsprinter.ast.Literal;
import com.jsprinter.ast.OpaqueNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstModuleTest {

    private final ObjectMapper mapper = PrinterJackson.createObjectMapper();

    @Test
    void testEstreeImportDeclaration() throws Exception {
        // import a, { b as c } from "m" with { type: "json" };
        String json = """
            {
              "type": "ImportDeclaration", "start": 0, "end": 53,
              "specifiers": [
                {"type": "ImportDefaultSpecifier", "start": 7, "end": 8,
                 "local": {"type": "Identifier", "start": 7, "end": 8, "name": "a"}},
                {"type": "ImportSpecifier", "start": 12, "end": 18,
                 "imported": {"type": "Identifier", "start": 12, "end": 13, "name": "b"},
                 "local": {"type": "Identifier", "start": 17, "end": 18, "name": "c"}}
              ],
              "source": {"type": "Literal", "start": 26, "end": 29, "value": "m", "raw": "\\"m\\""},
              "attributes": [
                {"type": "ImportAttribute", "start": 37, "end": 49,
                 "key": {"type": "Identifier", "start": 37, "end": 41, "name": "type"},
                 "value": {"type": "Literal", "start": 43, "end": 49, "value": "json", "raw": "\\"json\\""}}
              ]
            }
            """;

        ImportDeclaration node = mapper.readValue(json, ImportDeclaration.class);

        assertEquals(0, node.start());
        assertEquals(53, node.end());
        assertEquals(2, node.specifiers().size());
        ImportDefaultSpecifier first = assertInstanceOf(ImportDefaultSpecifier.class, node.specifiers().get(0));
        assertEquals("a", first.local().name());
        ImportSpecifier second = assertInstanceOf(ImportSpecifier.class, node.specifiers().get(1));
        assertEquals("b", ((Identifier) second.imported()).name());
        assertEquals("c", second.local().name());
        assertEquals("\"m\"", node.source().rawText());
        assertEquals(1, node.attributes().size());
        assertEquals("\"json\"", node.attributes().get(0).value().rawText());
        assertTrue(node.assertions().isEmpty());
        assertTrue(node.comments().isEmpty());
        assertNull(node.importKind());
    }

    @Test
    void testBabelStringLiteralAndAttachedComments() throws Exception {
        String json = """
            {
              "type": "ExportNamedDeclaration", "start": 8, "end": 36, "exportKind": "value",
              "specifiers": [
                {"type": "ExportSpecifier", "start": 17, "end": 18, "exportKind": "value",
                 "local": {"type": "Identifier", "start": 17, "end": 18, "name": "a"},
                 "exported": {"type": "Identifier", "start": 17, "end": 18, "name": "a"},
                 "trailingComments": [{"type": "CommentBlock", "value": " b ", "start": 19, "end": 26}]}
              ],
              "source": {"type": "StringLiteral", "start": 34, "end": 37, "value": "m",
                         "extra": {"rawValue": "m", "raw": "'m'"}},
              "leadingComments": [{"type": "CommentLine", "value": " a", "start": 0, "end": 4}],
              "innerComments": [{"type": "CommentBlock", "value": "", "start": 5, "end": 7}]
            }
            """;

        ExportNamedDeclaration node = mapper.readValue(json, ExportNamedDeclaration.class);

        Literal source = node.source();
        assertEquals("Literal", source.type());
        assertEquals("m", source.value());
        assertEquals("'m'", source.rawText());
        assertNull(source.raw());

        List<Comment> comments = node.comments();
        assertEquals(2, comments.size());
        assertEquals(" a", comments.get(0).value());
        assertTrue(comments.get(0).leading());
        assertFalse(comments.get(0).isBlock());
        assertTrue(comments.get(1).isDangling());
        assertTrue(comments.get(1).isBlock());

        ExportSpecifier specifier = (ExportSpecifier) node.specifiers().get(0);
        assertEquals(1, specifier.comments().size());
        assertTrue(specifier.comments().get(0).trailing());
        assertEquals("value", specifier.exportKind());
    }

    @Test
    void testTypescriptEstreeRange() throws Exception {
        String json = """
            {
              "type": "ExportNamedDeclaration", "range": [23, 52],
              "loc": {"start": {"line": 3, "column": 0}, "end": {"line": 3, "column": 29}},
              "exportKind": "type", "declaration": null, "attributes": [],
              "specifiers": [
                {"type": "ExportSpecifier", "range": [37, 38], "exportKind": "value",
                 "local": {"type": "Identifier", "range": [37, 38], "name": "T"},
                 "exported": {"type": "Identifier", "range": [37, 38], "name": "T"}}
              ],
              "source": {"type": "Literal", "range": [46, 51], "value": "./t", "raw": "'./t'"}
            }
            """;

        ExportNamedDeclaration node = mapper.readValue(json, ExportNamedDeclaration.class);

        assertEquals(23, node.start());
        assertEquals(52, node.end());
        assertEquals("type", node.kind());
        assertEquals(46, node.source().start());
        assertEquals(51, node.source().end());
        ExportSpecifier specifier = (ExportSpecifier) node.specifiers().get(0);
        assertEquals(37, specifier.local().start());
        assertEquals(38, specifier.exported().end());
    }

    @Test
    void testUnknownTypesBecomeOpaqueNodes() throws Exception {
        // @dec export class A {}
        String json = """
            {
              "type": "ExportNamedDeclaration", "start": 5, "end": 22, "specifiers": [], "source": null,
              "declaration": {
                "type": "ClassDeclaration", "start": 12, "end": 22,
                "id": {"type": "Identifier", "start": 18, "end": 19, "name": "A"},
                "superClass": null,
                "body": {"type": "ClassBody", "start": 20, "end": 22, "body": []},
                "decorators": [
                  {"type": "Decorator", "start": 0, "end": 4,
                   "expression": {"type": "Identifier", "start": 1, "end": 4, "name": "dec"}}
                ]
              }
            }
            """;

        ExportNamedDeclaration node = mapper.readValue(json, ExportNamedDeclaration.class);

        OpaqueNode declaration = assertInstanceOf(OpaqueNode.class, node.declaration());
        assertEquals("ClassDeclaration", declaration.type());
        assertEquals(12, declaration.start());
        assertEquals(22, declaration.end());
        assertEquals(1, declaration.decorators().size());
        assertEquals(0, declaration.decorators().get(0).start());
        assertInstanceOf(Identifier.class, declaration.decorators().get(0).expression());
    }

    @Test
    void testFlowDefaultFlag() throws Exception {
        String json = """
            {
              "type": "DeclareExportDeclaration", "start": 0, "end": 33, "default": true,
              "declaration": {"type": "DeclareClass", "start": 23, "end": 33}
            }
            """;

        DeclareExportDeclaration node = mapper.readValue(json, DeclareExportDeclaration.class);

        assertTrue(node.isDefault());
        assertTrue(node.defaultExport());
        assertEquals("DeclareClass", node.declaration().type());
        assertTrue(node.specifiers().isEmpty());
    }

    @Test
    void testMissingOffsetsDefaultToZero() throws Exception {
        String json = """
            {"type": "ImportDeclaration", "specifiers": [],
             "source": {"type": "Literal", "value": "m", "raw": "'m'"}}
            """;

        ImportDeclaration node = mapper.readValue(json, ImportDeclaration.class);

        assertEquals(0, node.start());
        assertEquals(0, node.end());
        assertEquals(0, node.source().end());
        assertTrue(node.attributes().isEmpty());
    }

    @Test
    void testTypeThatCannotFillTheFieldFails() {
        String json = """
            {"type": "ImportDeclaration", "start": 0, "end": 10, "specifiers": [],
             "source": {"type": "TemplateLiteral", "start": 7, "end": 10}}
            """;

        InvalidTypeIdException e = assertThrows(InvalidTypeIdException.class,
            () -> mapper.readValue(json, ImportDeclaration.class));
        assertEquals("TemplateLiteral", e.getTypeId());
        assertTrue(e.getMessage().contains("Literal is expected"));
    }

    @Test
    void testSerializeNode() throws Exception {
        Literal literal = new Literal(0, 3, 1.0, "1.0");
        String json = mapper.writeValueAsString(literal);
        System.out.println("Serialized literal: " + json);

        assertTrue(json.contains("\"type\":\"Literal\""), "Should have type field");
        assertTrue(json.contains("\"value\":1,"), "Integral value should print without a decimal point");
        assertFalse(json.contains("\"string\""), "Helper accessors should not be written");

        Comment comment = new Comment("Block", " c ", 0, 7);
        String commentJson = mapper.writeValueAsString(comment);
        assertFalse(commentJson.contains("\"block\""));
        assertFalse(commentJson.contains("\"dangling\""));
    }

    @Test
    void testSerializedNodeReadsBack() throws Exception {
        DeclareExportDeclaration node = new DeclareExportDeclaration(0, 33, true,
            new OpaqueNode("DeclareClass", 23, 33));

        DeclareExportDeclaration copy = mapper.readValue(mapper.writeValueAsString(node),
            DeclareExportDeclaration.class);

        assertEquals(node, copy);
    }
}
