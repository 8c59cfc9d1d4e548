package com.jsprinter.ast;

/**
 * A source comment. {@code value} is the text without the delimiters.
 *
 * <p>Babel spells the types {@code CommentBlock}/{@code CommentLine}, ESTree parsers
 * {@code Block}/{@code Line}. A comment attached to a node that is neither leading
 * nor trailing is dangling.</p>
 */
public record Comment(
    String type,
    String value,
    int start,
    int end,
    boolean leading,
    boolean trailing
) {
    public Comment(String type, String value, int start, int end) {
        this(type, value, start, end, false, false);
    }

    public boolean isBlock() {
        return "Block".equals(type) || "CommentBlock".equals(type);
    }

    public boolean isDangling() {
        return !leading && !trailing;
    }
}
