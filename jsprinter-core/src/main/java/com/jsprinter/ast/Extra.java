package com.jsprinter.ast;

/**
 * Parser-specific side data, as Babel stores it under {@code extra}.
 */
public record Extra(
    String raw,                     // Raw source of a literal
    boolean deprecatedAssertSyntax  // Set when attributes were written with the `assert` keyword
) {
}
