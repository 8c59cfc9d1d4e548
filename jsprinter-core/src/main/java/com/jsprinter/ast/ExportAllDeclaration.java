package com.jsprinter.ast;

import java.util.List;

public record ExportAllDeclaration(
    int start,
    int end,
    Literal source,      // String literal for the module
    Node exported,       // Null for "export * from 'mod'", Identifier/Literal for "export * as ns from 'mod'"
    List<ImportAttribute> attributes,
    List<ImportAttribute> assertions,
    String exportKind,
    Extra extra,
    List<Comment> comments
) implements ModuleDeclaration {
    public ExportAllDeclaration {
        attributes = Nodes.listOf(attributes);
        assertions = Nodes.listOf(assertions);
        comments = Nodes.listOf(comments);
    }

    public ExportAllDeclaration(int start, int end, Literal source, Node exported) {
        this(start, end, source, exported, List.of(), List.of(), null, null, List.of());
    }

    @Override
    public String kind() {
        return exportKind;
    }

    @Override
    public String type() {
        return "ExportAllDeclaration";
    }
}
