package com.architecture.memory.diagramsynth.model.diagram;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A node of the diagram IR. Flowchart boxes and sequence participants are both nodes;
 * participants additionally carry their left-to-right {@code order}.
 * Geometry is not stored here, see {@code LaidOutDiagram}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Node {

    private String id;
    private String label;
    private NodeShape shape;
    private String subgraphId;  // empty when the node is top-level
    private String color;       // explicit fill, null to use the palette

    @Builder.Default
    private int order = -1;     // participant column, -1 for flowchart nodes

    public boolean isParticipant() {
        return order >= 0;
    }
}
