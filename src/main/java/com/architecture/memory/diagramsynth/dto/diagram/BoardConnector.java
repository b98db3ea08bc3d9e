package com.architecture.memory.diagramsynth.dto.diagram;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A connector between two entries of {@link BoardOutput#getShapes()}, referenced by index.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoardConnector {

    private int startIndex;
    private int endIndex;
    private String caption;
    private String lineStyle;   // normal, dotted, thick
    private String routing;     // elbowed, straight
    private String startCap;
    private String endCap;
}
