package com.jsprinter.ast;

import java.util.List;

/**
 * {@code * as ns} in {@code export * as ns from "mod"}, as Babel shapes it.
 */
public record ExportNamespaceSpecifier(
    int start,
    int end,
    Node exported,
    List<Comment> comments
) implements ModuleSpecifier {
    public ExportNamespaceSpecifier {
        comments = Nodes.listOf(comments);
    }

    public ExportNamespaceSpecifier(int start, int end, Node exported) {
        this(start, end, exported, List.of());
    }

    @Override
    public String type() {
        return "ExportNamespaceSpecifier";
    }
}
