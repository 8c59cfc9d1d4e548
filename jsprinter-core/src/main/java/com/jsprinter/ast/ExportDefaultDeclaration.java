package com.jsprinter.ast;

import java.util.List;

public record ExportDefaultDeclaration(
    int start,
    int end,
    Node declaration,  // Can be Expression or Declaration
    String exportKind,
    List<Comment> comments
) implements ModuleDeclaration {
    public ExportDefaultDeclaration {
        comments = Nodes.listOf(comments);
    }

    public ExportDefaultDeclaration(int start, int end, Node declaration) {
        this(start, end, declaration, null, List.of());
    }

    @Override
    public String kind() {
        return exportKind;
    }

    @Override
    public boolean defaultExport() {
        return true;
    }

    @Override
    public String type() {
        return "ExportDefaultDeclaration";
    }
}
