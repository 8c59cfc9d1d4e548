package com.jsprinter.print;

import java.util.Objects;

/**
 * Formatting options read by the module declaration printer.
 *
 * @param semi           print a semicolon at the end of each statement
 * @param bracketSpacing print spaces inside braces: {@code { a }} rather than {@code {a}}
 * @param trailingComma  trailing comma policy for broken specifier lists
 */
public record PrintOptions(boolean semi, boolean bracketSpacing, TrailingComma trailingComma) {

    public PrintOptions {
        Objects.requireNonNull(trailingComma, "trailingComma");
    }

    public static PrintOptions defaults() {
        return new PrintOptions(true, true, TrailingComma.ALL);
    }

    public PrintOptions withSemi(boolean semi) {
        return new PrintOptions(semi, bracketSpacing, trailingComma);
    }

    public PrintOptions withBracketSpacing(boolean bracketSpacing) {
        return new PrintOptions(semi, bracketSpacing, trailingComma);
    }

    public PrintOptions withTrailingComma(TrailingComma trailingComma) {
        return new PrintOptions(semi, bracketSpacing, trailingComma);
    }
}
