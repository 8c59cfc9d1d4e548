package com.jsprinter.print;

import com.jsprinter.ast.ExportDefaultSpecifier;
import com.jsprinter.ast.ExportNamespaceSpecifier;
import com.jsprinter.ast.ExportSpecifier;
import com.jsprinter.ast.Identifier;
import com.jsprinter.ast.ImportDefaultSpecifier;
import com.jsprinter.ast.ImportNamespaceSpecifier;
import com.jsprinter.ast.ImportSpecifier;
import com.jsprinter.ast.Literal;
import com.jsprinter.ast.ModuleDeclaration;
import com.jsprinter.ast.ModuleSpecifier;
import com.jsprinter.ast.Node;
import com.jsprinter.ast.Nodes;
import com.jsprinter.doc.Doc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.jsprinter.doc.Docs.EMPTY;
import static com.jsprinter.doc.Docs.concat;
import static com.jsprinter.doc.Docs.group;
import static com.jsprinter.doc.Docs.ifBreak;
import static com.jsprinter.doc.Docs.indent;
import static com.jsprinter.doc.Docs.join;
import static com.jsprinter.doc.Docs.line;
import static com.jsprinter.doc.Docs.softline;
import static com.jsprinter.doc.Docs.text;

/**
 * Prints specifiers: one at a time ({@code type a as b}) and as the whole list of a
 * declaration ({@code def, { a, b }}).
 */
public final class SpecifierPrinter {

    private SpecifierPrinter() {
        // Utility class
    }

    /**
     * Prints {@code [kind ]left[ as right]}. The left side is the name in the other
     * module: {@code imported} for imports, {@code local} for exports, {@code *} for
     * namespaces. The right side is dropped when the specifier is shorthand.
     */
    public static Doc print(ModuleSpecifier specifier, PrintHooks hooks) {
        Node leftNode = null;
        Node rightNode;
        boolean namespace = false;

        if (specifier instanceof ImportSpecifier s) {
            leftNode = s.imported();
            rightNode = s.local();
        } else if (specifier instanceof ImportDefaultSpecifier s) {
            rightNode = s.local();
        } else if (specifier instanceof ImportNamespaceSpecifier s) {
            namespace = true;
            rightNode = s.local();
        } else if (specifier instanceof ExportSpecifier s) {
            leftNode = s.local();
            rightNode = s.exported();
        } else if (specifier instanceof ExportDefaultSpecifier s) {
            rightNode = s.exported();
        } else if (specifier instanceof ExportNamespaceSpecifier s) {
            namespace = true;
            rightNode = s.exported();
        } else {
            throw new IllegalStateException("Unknown specifier " + specifier.type());
        }

        Doc left = namespace ? text("*") : leftNode != null ? hooks.print(leftNode) : null;
        Doc right = rightNode != null && !isShorthand(specifier) ? hooks.print(rightNode) : null;

        List<Doc> parts = new ArrayList<>();
        parts.add(printKind(specifier.kind(), false));
        if (left != null) {
            parts.add(left);
        }
        if (left != null && right != null) {
            parts.add(text(" as "));
        }
        if (right != null) {
            parts.add(right);
        }
        return concat(parts);
    }

    /**
     * True when both names of a named specifier come from the same token, as in
     * {@code { a }}. {@code { a as a }} is not shorthand: the names have different spans.
     */
    public static boolean isShorthand(ModuleSpecifier specifier) {
        Node local;
        Node other;
        if (specifier instanceof ImportSpecifier s) {
            local = s.local();
            other = s.imported();
        } else if (specifier instanceof ExportSpecifier s) {
            local = s.local();
            other = s.exported();
        } else {
            return false;
        }
        if (local == null || other == null) {
            return false;
        }

        if (!local.type().equals(other.type()) || !Nodes.hasSameLocation(local, other)) {
            return false;
        }

        if (local instanceof Literal l && other instanceof Literal o && l.isString()) {
            return Objects.equals(l.value(), o.value())
                && Objects.equals(l.rawText(), o.rawText());
        }
        if (local instanceof Identifier l && other instanceof Identifier o) {
            return Objects.equals(l.name(), o.name());
        }
        return false;
    }

    /**
     * Prints the specifier list of a declaration with its leading space:
     * {@code " def, * as ns"}, {@code " { a, b }"}, {@code " {}"}.
     */
    public static Doc printSpecifierList(ModuleDeclaration declaration, PrintContext context) {
        List<Doc> parts = new ArrayList<>();
        parts.add(text(" "));

        if (declaration.specifiers().isEmpty()) {
            parts.add(text("{}"));
            return concat(parts);
        }

        PrintHooks hooks = context.hooks();
        SpecifierClassifier.Partition partition = SpecifierClassifier.partition(declaration);
        List<Doc> standalone = partition.standalone().stream().map(hooks::print).toList();
        List<Doc> grouped = partition.grouped().stream().map(hooks::print).toList();

        parts.add(join(", ", standalone));
        if (grouped.isEmpty()) {
            return concat(parts);
        }
        if (!standalone.isEmpty()) {
            parts.add(text(", "));
        }

        PrintOptions options = context.options();
        boolean canBreak = SpecifierClassifier.canBreak(
            partition, SpecifierClassifier.anySpecifierHasComment(declaration));

        if (canBreak) {
            Doc bracketLine = options.bracketSpacing() ? line() : softline();
            parts.add(group(concat(
                text("{"),
                indent(concat(bracketLine, join(concat(text(","), line()), grouped))),
                ifBreak(options.trailingComma().prints(TrailingComma.ES5) ? text(",") : EMPTY),
                bracketLine,
                text("}"))));
        } else {
            Doc spacing = options.bracketSpacing() ? text(" ") : EMPTY;
            List<Doc> block = new ArrayList<>();
            block.add(text("{"));
            block.add(spacing);
            block.addAll(grouped);
            block.add(spacing);
            block.add(text("}"));
            parts.add(concat(block));
        }
        return concat(parts);
    }

    /**
     * {@code type}/{@code typeof} modifier; nothing for value imports.
     */
    static Doc printKind(String kind, boolean spaceBeforeKind) {
        if (kind == null || kind.equals("value")) {
            return EMPTY;
        }
        return text(spaceBeforeKind ? " " + kind : kind + " ");
    }
}
