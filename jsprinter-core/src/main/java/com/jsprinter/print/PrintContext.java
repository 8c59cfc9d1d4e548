package com.jsprinter.print;

/**
 * Everything a module declaration is printed against: the file's text, the options,
 * and the callbacks into the surrounding printer.
 */
public record PrintContext(SourceWindow source, PrintOptions options, PrintHooks hooks) {
}
