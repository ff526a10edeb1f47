package com.subreq.code;

/**
 * General studies condition code groupings.
 */
public enum CodeGroup {
    /**
     * Common codes from the older general studies program.
     */
    MAROON,

    /**
     * Special designation codes, encoded with non-ASCII symbols so they never
     * collide with ordinary letters.
     */
    GOLD
}
