package com.architecture.memory.diagramsynth.service.diagram.parser;

import com.architecture.memory.diagramsynth.model.diagram.NodeShape;
import lombok.Value;

/**
 * A node as written in flowchart text: its ID plus the label and shape its delimiters give.
 */
@Value
public class NodeReference {
    String id;
    String label;
    NodeShape shape;
}
