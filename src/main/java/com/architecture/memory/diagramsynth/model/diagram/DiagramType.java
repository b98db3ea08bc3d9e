package com.architecture.memory.diagramsynth.model.diagram;

/**
 * Kind of diagram a parsed document describes.
 */
public enum DiagramType {
    FLOWCHART("flowchart"),
    SEQUENCE("sequence"),
    MINDMAP("mindmap");

    private final String value;

    DiagramType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
