package com.jsprinter.ast;

import java.util.List;

public record ImportDefaultSpecifier(
    int start,
    int end,
    Identifier local,  // The local binding name for the default import
    List<Comment> comments
) implements ModuleSpecifier {
    public ImportDefaultSpecifier {
        comments = Nodes.listOf(comments);
    }

    public ImportDefaultSpecifier(int start, int end, Identifier local) {
        this(start, end, local, List.of());
    }

    @Override
    public String type() {
        return "ImportDefaultSpecifier";
    }
}
