package com.jsprinter.doc;

/**
 * A layout-intent document: what to print and where a line may break, without
 * deciding the breaks. A width-aware renderer turns it into text.
 */
public sealed interface Doc permits
    Text,
    Concat,
    Group,
    Indent,
    Line,
    IfBreak,
    LineSuffix,
    BreakParent {
}
