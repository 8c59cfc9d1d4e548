package com.jsprinter.print;

import com.jsprinter.ast.ExportAllDeclaration;
import com.jsprinter.ast.ExportNamedDeclaration;
import com.jsprinter.ast.ExportSpecifier;
import com.jsprinter.ast.Extra;
import com.jsprinter.ast.Identifier;
import com.jsprinter.ast.ImportAttribute;
import com.jsprinter.ast.ImportDeclaration;
import com.jsprinter.ast.ImportDefaultSpecifier;
import com.jsprinter.ast.Literal;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ModuleKeywordsTest {

    private static ImportDeclaration bareImport(SourceFixture src, String importKind) {
        Literal source = src.str("\"m\"");
        return new ImportDeclaration(0, src.length(), List.of(), source, List.of(), List.of(),
            importKind, false, null, null, List.of());
    }

    @Test
    void keepsFromWhenWrittenBeforeEmptyBraces() {
        SourceFixture src = new SourceFixture("import {} from \"m\";");
        ImportDeclaration node = bareImport(src, null);
        assertTrue(ModuleKeywords.needsFromKeyword(node, new SourceWindow(src.text())));
    }

    @Test
    void dropsFromForSideEffectImport() {
        SourceFixture src = new SourceFixture("import \"m\";");
        ImportDeclaration node = bareImport(src, null);
        assertFalse(ModuleKeywords.needsFromKeyword(node, new SourceWindow(src.text())));
    }

    @Test
    void ignoresFromInsideComment() {
        SourceFixture src = new SourceFixture("import /* from */ \"m\";");
        src.block(" from ");
        ImportDeclaration node = bareImport(src, null);
        assertFalse(ModuleKeywords.needsFromKeyword(node, new SourceWindow(src.text(), src.comments())));
    }

    @Test
    void typeImportAlwaysKeepsFrom() {
        SourceFixture src = new SourceFixture("import type \"m\";");
        ImportDeclaration node = bareImport(src, "type");
        assertTrue(ModuleKeywords.needsFromKeyword(node, new SourceWindow(src.text())));
    }

    @Test
    void importWithSpecifiersKeepsFrom() {
        SourceFixture src = new SourceFixture("import x from \"m\";");
        Identifier x = src.id("x");
        Literal source = src.str("\"m\"");
        ImportDeclaration node = new ImportDeclaration(0, src.length(),
            List.of(new ImportDefaultSpecifier(x.start(), x.end(), x)), source, List.of());
        assertTrue(ModuleKeywords.needsFromKeyword(node, new SourceWindow(src.text())));
    }

    @Test
    void exportsAlwaysKeepFrom() {
        SourceFixture src = new SourceFixture("export * from \"m\";");
        ExportAllDeclaration node = new ExportAllDeclaration(0, src.length(), src.str("\"m\""), null);
        assertTrue(ModuleKeywords.needsFromKeyword(node, new SourceWindow(src.text())));
    }

    @Test
    void assertionsResolveToAssert() {
        SourceFixture src = new SourceFixture("import x from \"y\" assert { type: \"json\" };");
        Literal source = src.str("\"y\"");
        ImportAttribute entry = attribute(src);
        ImportDeclaration node = new ImportDeclaration(0, src.length(), List.of(), source, List.of(),
            List.of(entry), null, false, null, null, List.of());

        assertEquals(AttributesKeyword.ASSERT, ModuleKeywords.attributesKeyword(node, new SourceWindow(src.text())));
    }

    @Test
    void attributesResolveToWith() {
        SourceFixture src = new SourceFixture("import x from \"y\" with { type: \"json\" };");
        Literal source = src.str("\"y\"");
        ImportDeclaration node = new ImportDeclaration(0, src.length(), List.of(), source, List.of(attribute(src)));

        assertEquals(AttributesKeyword.WITH, ModuleKeywords.attributesKeyword(node, new SourceWindow(src.text())));
    }

    @Test
    void deprecatedAssertFlagWins() {
        SourceFixture src = new SourceFixture("import x from \"y\" assert { type: \"json\" };");
        Literal source = src.str("\"y\"");
        ImportDeclaration node = new ImportDeclaration(0, src.length(), List.of(), source, List.of(attribute(src)),
            List.of(), null, false, null, new Extra(null, true), List.of());

        assertEquals(AttributesKeyword.ASSERT, ModuleKeywords.attributesKeyword(node, new SourceWindow(src.text())));
    }

    @Test
    void bothListsFilledFallsBackToSourceText() {
        SourceFixture src = new SourceFixture("import x from \"y\" assert { type: \"json\" };");
        Literal source = src.str("\"y\"");
        ImportAttribute entry = attribute(src);
        ImportDeclaration node = new ImportDeclaration(0, src.length(), List.of(), source, List.of(entry),
            List.of(entry), null, false, null, null, List.of());

        assertEquals(AttributesKeyword.ASSERT, ModuleKeywords.attributesKeyword(node, new SourceWindow(src.text())));
    }

    @Test
    void emptyBlockKeywordComesFromText() {
        SourceFixture assertSrc = new SourceFixture("export * from \"y\" assert {};");
        ExportAllDeclaration asserted = new ExportAllDeclaration(0, assertSrc.length(), assertSrc.str("\"y\""), null);
        assertEquals(AttributesKeyword.ASSERT,
            ModuleKeywords.attributesKeyword(asserted, new SourceWindow(assertSrc.text())));

        SourceFixture withSrc = new SourceFixture("export * from \"y\" with {};");
        ExportAllDeclaration with = new ExportAllDeclaration(0, withSrc.length(), withSrc.str("\"y\""), null);
        assertEquals(AttributesKeyword.WITH,
            ModuleKeywords.attributesKeyword(with, new SourceWindow(withSrc.text())));
    }

    @Test
    void assertInsideCommentIsNotTheKeyword() {
        SourceFixture src = new SourceFixture("export * from \"y\" /* assert */ with {};");
        Literal source = src.str("\"y\"");
        src.block(" assert ");
        ExportAllDeclaration node = new ExportAllDeclaration(0, src.length(), source, null);

        assertEquals(AttributesKeyword.WITH,
            ModuleKeywords.attributesKeyword(node, new SourceWindow(src.text(), src.comments())));
    }

    @Test
    void attributesBlockNeedsSource() {
        SourceFixture src = new SourceFixture("export { a };");
        Identifier a = src.id("a");
        ExportNamedDeclaration node = new ExportNamedDeclaration(0, src.length(), null,
            List.of(new ExportSpecifier(a.start(), a.end(), a, a)), null);

        assertFalse(ModuleKeywords.needsAttributesBlock(node, new SourceWindow(src.text())));
    }

    @Test
    void emptyAttributesBlockIsDetectedFromText() {
        SourceFixture withBlock = new SourceFixture("import x from \"y\" with {};");
        ImportDeclaration node = new ImportDeclaration(0, withBlock.length(), List.of(), withBlock.str("\"y\""), List.of());
        assertTrue(ModuleKeywords.needsAttributesBlock(node, new SourceWindow(withBlock.text())));

        SourceFixture withoutBlock = new SourceFixture("import x from \"y\";");
        Literal source = withoutBlock.str("\"y\"");
        ImportDeclaration plain = new ImportDeclaration(0, withoutBlock.length(), List.of(), source, List.of());
        assertFalse(ModuleKeywords.needsAttributesBlock(plain, new SourceWindow(withoutBlock.text())));
    }

    @Test
    void commentedOutBlockIsNotAnAttributesBlock() {
        SourceFixture src = new SourceFixture("import x from \"y\" /* with {} */;");
        Literal source = src.str("\"y\"");
        src.block(" with {} ");
        ImportDeclaration node = new ImportDeclaration(0, src.length(), List.of(), source, List.of());

        assertFalse(ModuleKeywords.needsAttributesBlock(node, new SourceWindow(src.text(), src.comments())));
    }

    private static ImportAttribute attribute(SourceFixture src) {
        Identifier key = src.id("type");
        Literal value = src.str("\"json\"");
        return new ImportAttribute(key.start(), value.end(), key, value);
    }
}
