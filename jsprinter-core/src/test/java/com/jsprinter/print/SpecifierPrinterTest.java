package com.jsprinter.print;

import com.jsprinter.ast.ExportNamespaceSpecifier;
import com.jsprinter.ast.ExportSpecifier;
import com.jsprinter.ast.Identifier;
import com.jsprinter.ast.ImportDefaultSpecifier;
import com.jsprinter.ast.ImportNamespaceSpecifier;
import com.jsprinter.ast.ImportSpecifier;
import com.jsprinter.ast.Literal;
import com.jsprinter.ast.ModuleSpecifier;
import com.jsprinter.doc.DocRenderer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SpecifierPrinterTest {

    private static String print(SourceFixture src, ModuleSpecifier specifier) {
        EstreePrinter printer = new EstreePrinter(new SourceWindow(src.text()), PrintOptions.defaults());
        return DocRenderer.render(SpecifierPrinter.print(specifier, printer));
    }

    @Test
    void shorthandSpecifierPrintsOneName() {
        SourceFixture src = new SourceFixture("{ a }");
        Identifier a = src.id("a");
        ImportSpecifier specifier = new ImportSpecifier(a.start(), a.end(), a, a);

        assertTrue(SpecifierPrinter.isShorthand(specifier));
        assertEquals("a", print(src, specifier));
    }

    @Test
    void sameNameWrittenTwiceIsNotShorthand() {
        SourceFixture src = new SourceFixture("{ a as a }");
        Identifier imported = src.id("a");
        Identifier local = src.id("a");
        ImportSpecifier specifier = new ImportSpecifier(imported.start(), local.end(), imported, local);

        assertFalse(SpecifierPrinter.isShorthand(specifier));
        assertEquals("a as a", print(src, specifier));
    }

    @Test
    void renamedImportPrintsImportedThenLocal() {
        SourceFixture src = new SourceFixture("{ a as b }");
        Identifier imported = src.id("a");
        Identifier local = src.id("b");

        assertEquals("a as b", print(src, new ImportSpecifier(imported.start(), local.end(), imported, local)));
    }

    @Test
    void renamedExportPrintsLocalThenExported() {
        SourceFixture src = new SourceFixture("{ a as default }");
        Identifier local = src.id("a");
        Identifier exported = src.id("default");

        assertEquals("a as default", print(src, new ExportSpecifier(local.start(), exported.end(), local, exported)));
    }

    @Test
    void stringLiteralShorthandNeedsSameRawText() {
        SourceFixture src = new SourceFixture("{ \"a-b\" }");
        Literal name = src.str("\"a-b\"");
        ExportSpecifier specifier = new ExportSpecifier(name.start(), name.end(), name, name);

        assertTrue(SpecifierPrinter.isShorthand(specifier));
        assertEquals("\"a-b\"", print(src, specifier));

        Literal sameSpanOtherRaw = new Literal(name.start(), name.end(), "a-b", "'a-b'");
        assertFalse(SpecifierPrinter.isShorthand(new ExportSpecifier(name.start(), name.end(), name, sameSpanOtherRaw)));
    }

    @Test
    void mixedNameKindsAreNeverShorthand() {
        SourceFixture src = new SourceFixture("{ \"a\" as a }");
        Literal imported = src.str("\"a\"");
        Identifier local = src.id("a");
        Identifier sameSpan = new Identifier(imported.start(), imported.end(), "a");

        assertFalse(SpecifierPrinter.isShorthand(new ImportSpecifier(imported.start(), imported.end(), imported, sameSpan)));
        assertEquals("\"a\" as a", print(src, new ImportSpecifier(imported.start(), local.end(), imported, local)));
    }

    @Test
    void namespaceSpecifiersUseStar() {
        SourceFixture src = new SourceFixture("* as ns");
        Identifier ns = src.id("ns");

        assertEquals("* as ns", print(src, new ImportNamespaceSpecifier(0, ns.end(), ns)));
        assertEquals("* as ns", print(src, new ExportNamespaceSpecifier(0, ns.end(), ns)));
    }

    @Test
    void defaultSpecifierPrintsLocalOnly() {
        SourceFixture src = new SourceFixture("def");
        Identifier def = src.id("def");

        assertFalse(SpecifierPrinter.isShorthand(new ImportDefaultSpecifier(0, 3, def)));
        assertEquals("def", print(src, new ImportDefaultSpecifier(0, 3, def)));
    }

    @Test
    void specifierKindPrecedesNames() {
        SourceFixture src = new SourceFixture("{ type A, typeof B as C }");
        Identifier a = src.id("A");
        Identifier b = src.id("B");
        Identifier c = src.id("C");

        assertEquals("type A", print(src, new ImportSpecifier(a.start() - 5, a.end(), a, a, "type", List.of())));
        assertEquals("typeof B as C", print(src, new ImportSpecifier(b.start() - 7, c.end(), b, c, "typeof", List.of())));
        assertEquals("A", print(src, new ImportSpecifier(a.start(), a.end(), a, a, "value", List.of())));
    }

    @Test
    void printsKindModifierWithEitherSpacing() {
        assertEquals(" type", DocRenderer.render(SpecifierPrinter.printKind("type", true)));
        assertEquals("typeof ", DocRenderer.render(SpecifierPrinter.printKind("typeof", false)));
        assertEquals("", DocRenderer.render(SpecifierPrinter.printKind("value", true)));
        assertEquals("", DocRenderer.render(SpecifierPrinter.printKind(null, false)));
    }
}
