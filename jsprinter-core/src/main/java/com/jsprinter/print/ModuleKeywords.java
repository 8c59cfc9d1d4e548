package com.jsprinter.print;

import com.jsprinter.ast.ImportAttribute;
import com.jsprinter.ast.ImportDeclaration;
import com.jsprinter.ast.ModuleDeclaration;
import com.jsprinter.ast.Nodes;

/**
 * Decides the optional keywords of a module declaration that the AST alone does not pin
 * down, reading the original text where needed.
 */
public final class ModuleKeywords {

    private ModuleKeywords() {
        // Utility class
    }

    /**
     * Whether the specifier list and the {@code from} keyword are printed.
     *
     * <p>Only a bare import can go without: {@code import "m"} has neither, while
     * {@code import {} from "m"} keeps its empty braces. The two parse to the same
     * node, so the text before the source decides.</p>
     */
    public static boolean needsFromKeyword(ModuleDeclaration node, SourceWindow source) {
        if (!(node instanceof ImportDeclaration)
            || !node.specifiers().isEmpty()
            || "type".equals(node.kind())) {
            return true;
        }
        if (node.source() == null) {
            return false;
        }

        String text = source.maskedText(node.start(), node.source().start());
        return text.stripTrailing().endsWith("from");
    }

    /**
     * {@code with} or {@code assert}, as the declaration was written.
     */
    public static AttributesKeyword attributesKeyword(ModuleDeclaration node, SourceWindow source) {
        boolean hasAttributes = Nodes.isNonEmpty(node.attributes());
        boolean hasAssertions = Nodes.isNonEmpty(node.assertions());

        // Babel marks `assert` this way when it stores the entries under `attributes`
        if ((node.extra() != null && node.extra().deprecatedAssertSyntax())
            || (hasAssertions && !hasAttributes)) {
            return AttributesKeyword.ASSERT;
        }
        if (hasAttributes && !hasAssertions) {
            return AttributesKeyword.WITH;
        }

        ImportAttribute first = hasAttributes ? node.attributes().get(0)
            : hasAssertions ? node.assertions().get(0) : null;
        String between = source.maskedText(
            node.source().end(),
            first != null ? first.start() : node.end());

        if (between.stripLeading().startsWith("assert")) {
            return AttributesKeyword.ASSERT;
        }
        return AttributesKeyword.WITH;
    }

    /**
     * Whether an attributes block is printed. An empty {@code with {}} has no entries to
     * go by, so the text after the source decides.
     */
    public static boolean needsAttributesBlock(ModuleDeclaration node, SourceWindow source) {
        if (node.source() == null) {
            return false;
        }
        if (Nodes.isNonEmpty(node.attributes()) || Nodes.isNonEmpty(node.assertions())) {
            return true;
        }

        String text = source.maskedText(node.source().end(), node.end()).stripLeading();
        return text.startsWith("with") || text.startsWith("assert");
    }
}
