package com.jsprinter.print;

/**
 * Keyword introducing an import attributes block.
 */
public enum AttributesKeyword {
    WITH("with"),
    ASSERT("assert");   // Import assertions, the deprecated predecessor

    private final String keyword;

    AttributesKeyword(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
