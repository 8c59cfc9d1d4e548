package com.jsprinter.ast;

import java.util.List;

public record ImportNamespaceSpecifier(
    int start,
    int end,
    Identifier local,  // The `ns` of `* as ns`
    List<Comment> comments
) implements ModuleSpecifier {
    public ImportNamespaceSpecifier {
        comments = Nodes.listOf(comments);
    }

    public ImportNamespaceSpecifier(int start, int end, Identifier local) {
        this(start, end, local, List.of());
    }

    @Override
    public String type() {
        return "ImportNamespaceSpecifier";
    }
}
