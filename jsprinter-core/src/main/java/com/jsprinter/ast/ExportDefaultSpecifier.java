package com.jsprinter.ast;

import java.util.List;

/**
 * {@code v} in {@code export v from "mod"}.
 */
public record ExportDefaultSpecifier(
    int start,
    int end,
    Identifier exported,
    List<Comment> comments
) implements ModuleSpecifier {
    public ExportDefaultSpecifier {
        comments = Nodes.listOf(comments);
    }

    public ExportDefaultSpecifier(int start, int end, Identifier exported) {
        this(start, end, exported, List.of());
    }

    @Override
    public String type() {
        return "ExportDefaultSpecifier";
    }
}
