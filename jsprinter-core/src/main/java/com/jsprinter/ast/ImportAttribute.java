package com.jsprinter.ast;

import java.util.List;

public record ImportAttribute(
    int start,
    int end,
    Node key,      // Identifier or Literal
    Literal value, // Always a string Literal
    List<Comment> comments
) implements Node {
    public ImportAttribute {
        comments = Nodes.listOf(comments);
    }

    public ImportAttribute(int start, int end, Node key, Literal value) {
        this(start, end, key, value, List.of());
    }

    @Override
    public String type() {
        return "ImportAttribute";
    }
}
