package com.architecture.memory.diagramsynth.config;

import lombok.Value;

/**
 * Size limits applied after parsing. Input size limits are fixed and live in the validator.
 */
@Value
public class DiagramLimits {

    public static final int DEFAULT_MAX_NODES = 500;

    int maxNodes;

    public static DiagramLimits defaults() {
        return new DiagramLimits(DEFAULT_MAX_NODES);
    }
}
