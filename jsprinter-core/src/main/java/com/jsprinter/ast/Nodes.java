package com.jsprinter.ast;

import java.util.List;

/**
 * Small helpers shared by the AST records and the printer.
 */
public final class Nodes {

    private Nodes() {
        // Utility class
    }

    /**
     * Immutable copy of a list; parsers omit empty arrays, so null becomes empty.
     */
    public static <T> List<T> listOf(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    public static boolean isNonEmpty(List<?> list) {
        return list != null && !list.isEmpty();
    }

    public static boolean hasComment(Node node) {
        return node != null && !node.comments().isEmpty();
    }

    public static boolean hasDanglingComment(Node node) {
        return node != null && node.comments().stream().anyMatch(Comment::isDangling);
    }

    /**
     * Both nodes cover exactly the same source range.
     */
    public static boolean hasSameLocation(Node a, Node b) {
        return a.start() == b.start() && a.end() == b.end();
    }
}
