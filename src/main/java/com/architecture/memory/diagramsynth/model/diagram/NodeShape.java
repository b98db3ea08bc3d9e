package com.architecture.memory.diagramsynth.model.diagram;

/**
 * Visual shape of a diagram node.
 */
public enum NodeShape {
    RECTANGLE,
    ROUNDED_RECTANGLE,
    DIAMOND,
    CIRCLE,
    STADIUM,
    CYLINDER,
    PARALLELOGRAM,
    HEXAGON,
    TRAPEZOID
}
