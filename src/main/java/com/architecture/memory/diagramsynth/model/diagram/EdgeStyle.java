package com.architecture.memory.diagramsynth.model.diagram;

/**
 * Line style of an edge.
 */
public enum EdgeStyle {
    SOLID,
    DOTTED,
    THICK
}
