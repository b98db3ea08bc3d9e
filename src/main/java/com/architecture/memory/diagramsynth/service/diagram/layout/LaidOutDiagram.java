package com.architecture.memory.diagramsynth.service.diagram.layout;

import com.architecture.memory.diagramsynth.model.diagram.Diagram;
import com.architecture.memory.diagramsynth.model.layout.Bounds;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed diagram together with the geometry the layout stage computed for it.
 * Only the layout engines in this package can create one; the parsed diagram is left untouched.
 */
@Getter
public class LaidOutDiagram {

    private final Diagram diagram;
    private final Map<String, Integer> layers;          // flowchart only
    private final Map<String, Bounds> nodeBounds;
    private final Map<String, Bounds> subgraphBounds;   // only subgraphs with a resolvable member
    private final List<Double> messageOffsets;          // sequence only, parallel to diagram edges
    private final double width;
    private final double height;
    private final double framePadding;
    private final double headerHeight;                  // sequence only, participant box height

    LaidOutDiagram(Diagram diagram,
                   Map<String, Integer> layers,
                   Map<String, Bounds> nodeBounds,
                   Map<String, Bounds> subgraphBounds,
                   List<Double> messageOffsets,
                   double width,
                   double height,
                   double framePadding,
                   double headerHeight) {
        this.diagram = diagram;
        this.layers = Collections.unmodifiableMap(layers);
        this.nodeBounds = Collections.unmodifiableMap(nodeBounds);
        this.subgraphBounds = Collections.unmodifiableMap(subgraphBounds);
        this.messageOffsets = Collections.unmodifiableList(messageOffsets);
        this.width = width;
        this.height = height;
        this.framePadding = framePadding;
        this.headerHeight = headerHeight;
    }

    public Optional<Bounds> boundsOf(String nodeId) {
        return Optional.ofNullable(nodeBounds.get(nodeId));
    }

    public int layerOf(String nodeId) {
        return layers.getOrDefault(nodeId, 0);
    }

    /**
     * Vertical timeline position of the sequence message at the given edge index.
     */
    public Optional<Double> messageOffset(int edgeIndex) {
        if (edgeIndex < 0 || edgeIndex >= messageOffsets.size()) {
            return Optional.empty();
        }
        return Optional.of(messageOffsets.get(edgeIndex));
    }
}
