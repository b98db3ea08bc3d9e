package com.architecture.memory.diagramsynth.dto.diagram;

/**
 * Machine-readable codes for diagram validation and parse errors.
 */
public enum ErrorCode {
    EMPTY_DIAGRAM,
    MISSING_HEADER,
    NO_NODES,
    NO_PARTICIPANTS,
    INVALID_SYNTAX,
    INVALID_SHAPE,
    INVALID_EDGE,
    TOO_MANY_NODES,
    INPUT_TOO_LARGE,
    TOO_MANY_LINES,
    LINE_TOO_LONG
}
