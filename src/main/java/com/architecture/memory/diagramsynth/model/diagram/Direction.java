package com.architecture.memory.diagramsynth.model.diagram;

import java.util.Locale;

/**
 * Flow direction of a flowchart. TD is accepted as an alias of TB.
 */
public enum Direction {
    TB,
    BT,
    LR,
    RL;

    public boolean isHorizontal() {
        return this == LR || this == RL;
    }

    public boolean isReversed() {
        return this == BT || this == RL;
    }

    /**
     * Get the direction from a header keyword, case-insensitive.
     * Returns null for anything that is not a known direction.
     */
    public static Direction fromKeyword(String keyword) {
        if (keyword == null) return null;
        String upper = keyword.trim().toUpperCase(Locale.ROOT);
        if (upper.equals("TD")) return TB;
        try {
            return valueOf(upper);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
