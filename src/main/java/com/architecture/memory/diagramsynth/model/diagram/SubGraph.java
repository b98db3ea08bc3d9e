package com.architecture.memory.diagramsynth.model.diagram;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Named group of flowchart nodes. Member IDs may reference nodes that do not exist.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubGraph {

    private String id;
    private String label;
    private String parentId;    // empty for top-level subgraphs

    @Builder.Default
    private List<String> memberNodeIds = new ArrayList<>();
}
