package com.jsprinter.print;

import com.jsprinter.ast.Comment;
import com.jsprinter.ast.Node;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Read-only view of one file's original text and its comments.
 *
 * <p>Some printing decisions depend on tokens the AST does not record, such as
 * whether {@code from} was written in {@code import {} from "m"}. They are read back
 * from the text with comments blanked out, so that {@code import /* from *&#47; "m"}
 * does not look like it has a {@code from}.</p>
 *
 * <p>Build one per file and share it across declarations; it never changes.</p>
 */
public final class SourceWindow {

    private final String text;
    private final List<Comment> comments;

    public SourceWindow(String text, List<Comment> comments) {
        this.text = Objects.requireNonNull(text, "text");
        List<Comment> sorted = new ArrayList<>(comments == null ? List.of() : comments);
        sorted.sort(Comparator.comparingInt(Comment::start));
        this.comments = List.copyOf(sorted);
    }

    public SourceWindow(String text) {
        this(text, List.of());
    }

    public String text() {
        return text;
    }

    public List<Comment> comments() {
        return comments;
    }

    public String slice(int start, int end) {
        Objects.checkFromToIndex(start, end, text.length());
        return text.substring(start, end);
    }

    /**
     * The source text of a node.
     */
    public String text(Node node) {
        return slice(node.start(), node.end());
    }

    /**
     * {@code text[start, end)} with every character inside a comment replaced by a space.
     * The result always has length {@code end - start}.
     */
    public String maskedText(int start, int end) {
        Objects.checkFromToIndex(start, end, text.length());
        char[] chars = text.substring(start, end).toCharArray();

        for (int i = firstCommentEndingAtOrAfter(start); i < comments.size(); i++) {
            Comment comment = comments.get(i);
            // Sorted by start: nothing further can overlap the range
            if (comment.start() > end) {
                break;
            }
            if (comment.end() < start) {
                continue;
            }
            int from = Math.max(comment.start(), start);
            int to = Math.min(comment.end(), end);
            if (from < to) {
                Arrays.fill(chars, from - start, to - start, ' ');
            }
        }

        String masked = new String(chars);
        assert masked.length() == end - start
            : "masked text has length " + masked.length() + ", expected " + (end - start);
        return masked;
    }

    /**
     * Index of the first comment whose end is at or after {@code offset}. Comments do not
     * overlap, so their ends are sorted as well as their starts.
     */
    private int firstCommentEndingAtOrAfter(int offset) {
        int low = 0;
        int high = comments.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (comments.get(mid).end() < offset) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}
