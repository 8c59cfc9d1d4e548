package com.jsprinter.print;

import com.jsprinter.ast.Node;

/**
 * A node appeared where the grammar does not allow it. Parsers never produce such
 * trees, so this signals a broken parser or a hand-built AST.
 */
public class UnexpectedNodeException extends RuntimeException {

    private final transient Node node;

    public UnexpectedNodeException(Node parent, Node node, String role) {
        super("Unexpected " + role + " node '" + node.type() + "' in " + parent.type()
            + " at offset " + node.start());
        this.node = node;
    }

    public Node getNode() {
        return node;
    }
}
