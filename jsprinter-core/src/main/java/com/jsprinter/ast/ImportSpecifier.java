package com.jsprinter.ast;

import java.util.List;

public record ImportSpecifier(
    int start,
    int end,
    Node imported,      // The name in the module (Identifier or Literal)
    Identifier local,   // The local binding name (always Identifier)
    String importKind,
    List<Comment> comments
) implements ModuleSpecifier {
    public ImportSpecifier {
        comments = Nodes.listOf(comments);
    }

    public ImportSpecifier(int start, int end, Node imported, Identifier local) {
        this(start, end, imported, local, null, List.of());
    }

    @Override
    public String kind() {
        return importKind;
    }

    @Override
    public String type() {
        return "ImportSpecifier";
    }
}
