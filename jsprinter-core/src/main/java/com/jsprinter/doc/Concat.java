package com.jsprinter.doc;

import java.util.List;

public record Concat(List<Doc> parts) implements Doc {
    public Concat {
        parts = List.copyOf(parts);
    }
}
