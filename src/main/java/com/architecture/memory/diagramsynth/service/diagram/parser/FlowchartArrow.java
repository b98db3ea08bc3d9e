package com.architecture.memory.diagramsynth.service.diagram.parser;

import com.architecture.memory.diagramsynth.model.diagram.ArrowCap;
import com.architecture.memory.diagramsynth.model.diagram.EdgeStyle;
import lombok.Value;

/**
 * A link operator between two node references, with the caption written on it if any.
 */
@Value
public class FlowchartArrow {
    EdgeStyle style;
    ArrowCap startCap;
    ArrowCap endCap;
    String label;

    FlowchartArrow withLabel(String caption) {
        return new FlowchartArrow(style, startCap, endCap, caption);
    }
}
