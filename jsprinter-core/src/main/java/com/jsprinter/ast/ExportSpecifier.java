package com.jsprinter.ast;

import java.util.List;

public record ExportSpecifier(
    int start,
    int end,
    Node local,     // The local name (Identifier or Literal)
    Node exported,  // The exported name (Identifier or Literal)
    String exportKind,
    List<Comment> comments
) implements ModuleSpecifier {
    public ExportSpecifier {
        comments = Nodes.listOf(comments);
    }

    public ExportSpecifier(int start, int end, Node local, Node exported) {
        this(start, end, local, exported, null, List.of());
    }

    @Override
    public String kind() {
        return exportKind;
    }

    @Override
    public String type() {
        return "ExportSpecifier";
    }
}
