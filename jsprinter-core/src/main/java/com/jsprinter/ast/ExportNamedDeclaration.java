package com.jsprinter.ast;

import java.util.List;

public record ExportNamedDeclaration(
    int start,
    int end,
    Node declaration,                     // Can be null if using specifiers
    List<Node> specifiers,                // ExportSpecifier, ExportDefaultSpecifier or ExportNamespaceSpecifier
    Literal source,                       // Can be null if not re-exporting
    List<ImportAttribute> attributes,
    List<ImportAttribute> assertions,
    String exportKind,
    Extra extra,
    List<Comment> comments
) implements ModuleDeclaration {
    public ExportNamedDeclaration {
        specifiers = Nodes.listOf(specifiers);
        attributes = Nodes.listOf(attributes);
        assertions = Nodes.listOf(assertions);
        comments = Nodes.listOf(comments);
    }

    public ExportNamedDeclaration(
        int start,
        int end,
        Node declaration,
        List<Node> specifiers,
        Literal source
    ) {
        this(start, end, declaration, specifiers, source, List.of(), List.of(), null, null, List.of());
    }

    @Override
    public String kind() {
        return exportKind;
    }

    @Override
    public String type() {
        return "ExportNamedDeclaration";
    }
}
