package com.jsprinter.ast;

import java.util.List;

public record Decorator(
    int start,
    int end,
    Node expression,
    List<Comment> comments
) implements Node {
    public Decorator {
        comments = Nodes.listOf(comments);
    }

    public Decorator(int start, int end, Node expression) {
        this(start, end, expression, List.of());
    }

    @Override
    public String type() {
        return "Decorator";
    }
}
