package com.jsprinter.print;

import com.jsprinter.ast.Comment;
import com.jsprinter.ast.Node;
import com.jsprinter.doc.Doc;

import java.util.ArrayList;
import java.util.List;

import static com.jsprinter.doc.Docs.BREAK_PARENT;
import static com.jsprinter.doc.Docs.concat;
import static com.jsprinter.doc.Docs.hardline;
import static com.jsprinter.doc.Docs.join;
import static com.jsprinter.doc.Docs.lineSuffix;
import static com.jsprinter.doc.Docs.text;

/**
 * Prints comments already attached to nodes. Deciding where a comment attaches is the
 * parser side's job.
 */
public final class CommentPrinter {

    private CommentPrinter() {
        // Utility class
    }

    public static Doc printComment(Comment comment) {
        if (comment.isBlock()) {
            return text("/*" + comment.value() + "*/");
        }
        // A line comment runs to the end of the line: nothing may follow it there
        return concat(text(("//" + comment.value()).stripTrailing()), BREAK_PARENT);
    }

    public static Doc printDanglingComments(Node node) {
        List<Doc> parts = new ArrayList<>();
        for (Comment comment : node.comments()) {
            if (comment.isDangling()) {
                parts.add(printComment(comment));
            }
        }
        return join(hardline(), parts);
    }

    /**
     * A trailing line comment would swallow whatever is printed after it on the same line.
     */
    public static boolean needsHardlineAfterDanglingComment(Node node) {
        Comment last = null;
        for (Comment comment : node.comments()) {
            if (comment.isDangling()) {
                last = comment;
            }
        }
        return last != null && !last.isBlock();
    }

    /**
     * Wraps a printed node with its leading and trailing comments.
     */
    public static Doc printComments(Node node, Doc printed) {
        if (node.comments().isEmpty()) {
            return printed;
        }

        List<Doc> parts = new ArrayList<>();
        for (Comment comment : node.comments()) {
            if (comment.leading()) {
                parts.add(printComment(comment));
                parts.add(comment.isBlock() ? text(" ") : hardline());
            }
        }
        parts.add(printed);
        for (Comment comment : node.comments()) {
            if (comment.trailing()) {
                if (comment.isBlock()) {
                    parts.add(text(" "));
                    parts.add(printComment(comment));
                } else {
                    parts.add(lineSuffix(concat(text(" "), printComment(comment))));
                    parts.add(BREAK_PARENT);
                }
            }
        }
        return concat(parts);
    }
}
