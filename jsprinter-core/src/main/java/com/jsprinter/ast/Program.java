package com.jsprinter.ast;

import java.util.List;

public record Program(
    int start,
    int end,
    List<Node> body,
    String sourceType,
    List<Comment> comments  // Every comment of the file, sorted by start offset
) implements Node {
    public Program {
        body = Nodes.listOf(body);
        comments = Nodes.listOf(comments);
    }

    public Program(List<Node> body, String sourceType) {
        this(0, 0, body, sourceType, List.of());
    }

    @Override
    public String type() {
        return "Program";
    }
}
