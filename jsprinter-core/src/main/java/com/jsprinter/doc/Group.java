package com.jsprinter.doc;

/**
 * Contents printed on one line if they fit, otherwise with every direct line broken.
 */
public record Group(Doc contents, boolean shouldBreak) implements Doc {
}
