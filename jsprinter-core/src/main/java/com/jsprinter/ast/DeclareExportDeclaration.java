package com.jsprinter.ast;

import java.util.List;

/**
 * Flow's {@code declare export ...}; {@code isDefault} is the parser's {@code default} flag.
 */
public record DeclareExportDeclaration(
    int start,
    int end,
    boolean isDefault,
    Node declaration,
    List<Node> specifiers,
    Literal source,
    String exportKind,
    List<Comment> comments
) implements ModuleDeclaration {
    public DeclareExportDeclaration {
        specifiers = Nodes.listOf(specifiers);
        comments = Nodes.listOf(comments);
    }

    public DeclareExportDeclaration(int start, int end, boolean isDefault, Node declaration) {
        this(start, end, isDefault, declaration, List.of(), null, null, List.of());
    }

    @Override
    public String kind() {
        return exportKind;
    }

    @Override
    public boolean defaultExport() {
        return isDefault;
    }

    @Override
    public String type() {
        return "DeclareExportDeclaration";
    }
}
