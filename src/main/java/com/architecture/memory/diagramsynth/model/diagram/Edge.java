package com.architecture.memory.diagramsynth.model.diagram;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Directed connection between two node IDs. The IDs are not guaranteed to resolve.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Edge {

    private String id;
    private String fromId;
    private String toId;
    private String label;

    @Builder.Default
    private EdgeStyle style = EdgeStyle.SOLID;

    @Builder.Default
    private ArrowCap startCap = ArrowCap.NONE;

    @Builder.Default
    private ArrowCap endCap = ArrowCap.ARROW;

    // Sequence messages only
    private boolean activate;
    private boolean deactivate;
}
