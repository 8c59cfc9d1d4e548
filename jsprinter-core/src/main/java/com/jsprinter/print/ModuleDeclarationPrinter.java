package com.jsprinter.print;

import com.jsprinter.ast.DeclareExportAllDeclaration;
import com.jsprinter.ast.ExportAllDeclaration;
import com.jsprinter.ast.ImportAttribute;
import com.jsprinter.ast.ImportDeclaration;
import com.jsprinter.ast.ModuleDeclaration;
import com.jsprinter.ast.Node;
import com.jsprinter.ast.Nodes;
import com.jsprinter.doc.Doc;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.jsprinter.doc.Docs.EMPTY;
import static com.jsprinter.doc.Docs.concat;
import static com.jsprinter.doc.Docs.hardline;
import static com.jsprinter.doc.Docs.join;
import static com.jsprinter.doc.Docs.text;

/**
 * Prints import and export declarations.
 *
 * <p>Output is a pure function of the node, the source window, the options and the
 * hooks; nothing is kept between calls.</p>
 */
public final class ModuleDeclarationPrinter {

    // Declarations that end in a block, so a `;` after them would be an empty statement
    private static final Set<String> NO_SEMICOLON_AFTER = Set.of(
        "ClassDeclaration",
        "FunctionDeclaration",
        "TSInterfaceDeclaration",
        "DeclareClass",
        "DeclareFunction",
        "TSDeclareFunction",
        "EnumDeclaration"
    );

    private ModuleDeclarationPrinter() {
        // Utility class
    }

    public static Doc print(ModuleDeclaration node, PrintContext context) {
        if (node instanceof ImportDeclaration importDeclaration) {
            return printImportDeclaration(importDeclaration, context);
        }
        return printExportDeclaration(node, context);
    }

    public static Doc printImportDeclaration(ImportDeclaration node, PrintContext context) {
        List<Doc> parts = new ArrayList<>();
        parts.add(text("import"));
        if (node.module()) {
            parts.add(text(" module"));
        }
        if (node.phase() != null) {
            parts.add(text(" " + node.phase()));
        }
        parts.add(SpecifierPrinter.printKind(node.importKind(), true));
        parts.add(printModuleSpecifiers(node, context));
        parts.add(printModuleSource(node, context));
        parts.add(printImportAttributes(node, context));
        parts.add(context.options().semi() ? text(";") : EMPTY);
        return concat(parts);
    }

    /**
     * Prints every export form: named, default, all, and Flow's {@code declare export}.
     */
    public static Doc printExportDeclaration(ModuleDeclaration node, PrintContext context) {
        PrintHooks hooks = context.hooks();
        List<Doc> parts = new ArrayList<>();
        parts.add(hooks.printDecoratorsBeforeExport(node));
        parts.add(hooks.printDeclareToken(node));
        parts.add(text("export"));
        if (node.defaultExport()) {
            parts.add(text(" default"));
        }

        if (Nodes.hasDanglingComment(node)) {
            parts.add(text(" "));
            parts.add(CommentPrinter.printDanglingComments(node));
            if (CommentPrinter.needsHardlineAfterDanglingComment(node)) {
                parts.add(hardline());
            }
        }

        Node declaration = node.declaration();
        if (declaration != null) {
            parts.add(text(" "));
            parts.add(hooks.print(declaration));
        } else {
            parts.add(SpecifierPrinter.printKind(node.kind(), true));

            if (node instanceof ExportAllDeclaration || node instanceof DeclareExportAllDeclaration) {
                parts.add(text(" *"));
                if (node.exported() != null) {
                    parts.add(text(" as "));
                    parts.add(hooks.print(node.exported()));
                }
            } else {
                parts.add(printModuleSpecifiers(node, context));
            }

            parts.add(printModuleSource(node, context));
            parts.add(printImportAttributes(node, context));
        }

        parts.add(printSemicolonAfterExportDeclaration(node, context.options()));
        return concat(parts);
    }

    /**
     * A default export of an expression is a statement and takes a semicolon; a default
     * export of a class or function, like every other wrapped declaration, does not.
     */
    static boolean needsSemicolon(ModuleDeclaration node) {
        Node declaration = node.declaration();
        return declaration == null
            || (node.defaultExport() && !NO_SEMICOLON_AFTER.contains(declaration.type()));
    }

    private static Doc printSemicolonAfterExportDeclaration(ModuleDeclaration node, PrintOptions options) {
        return options.semi() && needsSemicolon(node) ? text(";") : EMPTY;
    }

    private static Doc printModuleSpecifiers(ModuleDeclaration node, PrintContext context) {
        if (!ModuleKeywords.needsFromKeyword(node, context.source())) {
            return EMPTY;
        }
        return SpecifierPrinter.printSpecifierList(node, context);
    }

    private static Doc printModuleSource(ModuleDeclaration node, PrintContext context) {
        if (node.source() == null) {
            return EMPTY;
        }

        List<Doc> parts = new ArrayList<>();
        if (ModuleKeywords.needsFromKeyword(node, context.source())) {
            parts.add(text(" from"));
        }
        parts.add(text(" "));
        parts.add(context.hooks().print(node.source()));
        return concat(parts);
    }

    /**
     * Prints {@code with { type: "json" }}, or the older {@code assert { ... }}.
     */
    private static Doc printImportAttributes(ModuleDeclaration node, PrintContext context) {
        if (!ModuleKeywords.needsAttributesBlock(node, context.source())) {
            return EMPTY;
        }

        AttributesKeyword keyword = ModuleKeywords.attributesKeyword(node, context.source());
        List<Doc> parts = new ArrayList<>();
        parts.add(text(" " + keyword.keyword() + " {"));

        // Both lists filled is not a valid parse; `attributes` wins, the lists are never merged
        List<ImportAttribute> entries = Nodes.isNonEmpty(node.attributes()) ? node.attributes()
            : Nodes.isNonEmpty(node.assertions()) ? node.assertions() : null;
        if (entries != null) {
            boolean spacing = context.options().bracketSpacing();
            if (spacing) {
                parts.add(text(" "));
            }
            parts.add(join(", ", entries.stream().map(context.hooks()::print).toList()));
            if (spacing) {
                parts.add(text(" "));
            }
        }
        parts.add(text("}"));
        return concat(parts);
    }
}
