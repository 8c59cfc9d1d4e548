package com.jsprinter.print;

/**
 * Where trailing commas are printed in broken multi-line lists.
 */
public enum TrailingComma {
    NONE,
    ES5,
    ALL;

    /**
     * Whether this policy prints a trailing comma in a construct that needs at least {@code level}.
     */
    public boolean prints(TrailingComma level) {
        return switch (this) {
            case NONE -> false;
            case ES5 -> level == ES5;
            case ALL -> true;
        };
    }
}
