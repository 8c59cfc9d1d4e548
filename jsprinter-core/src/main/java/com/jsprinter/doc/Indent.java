package com.jsprinter.doc;

public record Indent(Doc contents) implements Doc {
}
