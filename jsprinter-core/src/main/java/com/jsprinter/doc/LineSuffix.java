package com.jsprinter.doc;

/**
 * Contents deferred to just before the next line break, used for trailing line comments.
 */
public record LineSuffix(Doc contents) implements Doc {
}
