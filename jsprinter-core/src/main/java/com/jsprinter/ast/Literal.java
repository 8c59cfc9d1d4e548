package com.jsprinter.ast;

import java.util.List;

/**
 * ESTree {@code Literal}; Babel's {@code StringLiteral} maps here too, with its raw
 * text under {@code extra.raw}.
 */
public record Literal(
    int start,
    int end,
    Object value,
    String raw,
    Extra extra,
    List<Comment> comments
) implements Node {
    public Literal {
        comments = Nodes.listOf(comments);
    }

    public Literal(int start, int end, Object value, String raw) {
        this(start, end, value, raw, null, List.of());
    }

    /**
     * The literal as written, preferring Babel's {@code extra.raw}.
     */
    public String rawText() {
        if (extra != null && extra.raw() != null) {
            return extra.raw();
        }
        return raw;
    }

    public boolean isString() {
        return value instanceof String;
    }

    @Override
    public String type() {
        return "Literal";
    }
}
