package com.jsprinter.ast;

import java.util.List;

public record DeclareExportAllDeclaration(
    int start,
    int end,
    Literal source,
    Node exported,
    String exportKind,
    List<Comment> comments
) implements ModuleDeclaration {
    public DeclareExportAllDeclaration {
        comments = Nodes.listOf(comments);
    }

    public DeclareExportAllDeclaration(int start, int end, Literal source) {
        this(start, end, source, null, null, List.of());
    }

    @Override
    public String kind() {
        return exportKind;
    }

    @Override
    public String type() {
        return "DeclareExportAllDeclaration";
    }
}
