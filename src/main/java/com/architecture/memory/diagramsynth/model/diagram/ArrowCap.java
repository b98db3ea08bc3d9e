package com.architecture.memory.diagramsynth.model.diagram;

/**
 * Decoration drawn at either end of an edge.
 */
public enum ArrowCap {
    NONE,
    ARROW,
    FILLED_CIRCLE,
    DIAMOND_CROSS
}
