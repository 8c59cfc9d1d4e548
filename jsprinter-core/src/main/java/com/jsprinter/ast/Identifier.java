package com.jsprinter.ast;

import java.util.List;

public record Identifier(
    int start,
    int end,
    String name,
    List<Comment> comments
) implements Node {
    public Identifier {
        comments = Nodes.listOf(comments);
    }

    public Identifier(int start, int end, String name) {
        this(start, end, name, List.of());
    }

    @Override
    public String type() {
        return "Identifier";
    }
}
