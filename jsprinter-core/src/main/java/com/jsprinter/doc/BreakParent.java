package com.jsprinter.doc;

/**
 * Forces every enclosing group to break.
 */
public record BreakParent() implements Doc {
}
