package com.jsprinter.doc;

public record IfBreak(Doc breakContents, Doc flatContents) implements Doc {
}
