package com.jsprinter.ast;

import java.util.List;

/**
 * Any node the module printer does not model: the class, function, interface or
 * variable declaration wrapped by an export, a default-exported expression, a
 * decorator expression, a non-module statement of a program.
 *
 * <p>Only the node type, its span and the bits the export printer looks at are kept.</p>
 */
public record OpaqueNode(
    String type,
    int start,
    int end,
    List<Decorator> decorators, // Possibly written before `export`
    List<Comment> comments
) implements Node {
    public OpaqueNode {
        decorators = Nodes.listOf(decorators);
        comments = Nodes.listOf(comments);
    }

    public OpaqueNode(String type, int start, int end) {
        this(type, start, end, List.of(), List.of());
    }
}
