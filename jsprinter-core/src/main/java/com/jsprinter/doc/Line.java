package com.jsprinter.doc;

/**
 * A possible line break. Flat, a plain line prints a space and a soft line nothing;
 * a hard line always breaks.
 */
public record Line(boolean soft, boolean hard, boolean literal) implements Doc {
}
