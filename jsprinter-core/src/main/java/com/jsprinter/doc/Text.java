package com.jsprinter.doc;

public record Text(String text) implements Doc {
}
