package com.jsprinter.doc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for {@link Doc} values.
 */
public final class Docs {

    public static final Doc EMPTY = new Text("");
    public static final Doc BREAK_PARENT = new BreakParent();

    private static final Doc LINE = new Line(false, false, false);
    private static final Doc SOFTLINE = new Line(true, false, false);
    private static final Doc HARDLINE = new Concat(List.of(new Line(false, true, false), BREAK_PARENT));

    private Docs() {
        // Utility class
    }

    public static Doc text(String text) {
        return text.isEmpty() ? EMPTY : new Text(text);
    }

    public static Doc concat(Doc... parts) {
        return concat(Arrays.asList(parts));
    }

    public static Doc concat(List<Doc> parts) {
        return parts.size() == 1 ? parts.get(0) : new Concat(parts);
    }

    public static Doc group(Doc contents) {
        return new Group(contents, false);
    }

    public static Doc group(Doc contents, boolean shouldBreak) {
        return new Group(contents, shouldBreak);
    }

    public static Doc indent(Doc contents) {
        return new Indent(contents);
    }

    public static Doc ifBreak(Doc breakContents, Doc flatContents) {
        return new IfBreak(breakContents, flatContents);
    }

    public static Doc ifBreak(Doc breakContents) {
        return new IfBreak(breakContents, EMPTY);
    }

    public static Doc lineSuffix(Doc contents) {
        return new LineSuffix(contents);
    }

    /**
     * A space when flat, a newline when the enclosing group breaks.
     */
    public static Doc line() {
        return LINE;
    }

    /**
     * Nothing when flat, a newline when the enclosing group breaks.
     */
    public static Doc softline() {
        return SOFTLINE;
    }

    /**
     * An unconditional newline; breaks every enclosing group.
     */
    public static Doc hardline() {
        return HARDLINE;
    }

    public static Doc join(Doc separator, List<Doc> docs) {
        List<Doc> parts = new ArrayList<>();
        for (int i = 0; i < docs.size(); i++) {
            if (i > 0) {
                parts.add(separator);
            }
            parts.add(docs.get(i));
        }
        return new Concat(parts);
    }

    public static Doc join(String separator, List<Doc> docs) {
        return join(text(separator), docs);
    }
}
