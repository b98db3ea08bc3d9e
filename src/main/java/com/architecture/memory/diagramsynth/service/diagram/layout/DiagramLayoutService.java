package com.architecture.memory.diagramsynth.service.diagram.layout;

import com.architecture.memory.diagramsynth.model.diagram.Diagram;
import com.architecture.memory.diagramsynth.model.diagram.DiagramType;
import com.architecture.memory.diagramsynth.model.layout.LayoutConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Picks the layout engine for a diagram's type. Mind maps have no engine of their own and
 * are laid out as layered graphs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DiagramLayoutService {

    private final LayeredLayoutEngine layeredLayoutEngine;
    private final SequenceLayoutEngine sequenceLayoutEngine;

    public LaidOutDiagram layout(Diagram diagram, LayoutConfig config) {
        LayoutConfig effective = config != null ? config : LayoutConfig.defaults();
        log.debug("Laying out {} diagram with {} nodes", diagram.getType().getValue(), diagram.getNodes().size());
        if (diagram.getType() == DiagramType.SEQUENCE) {
            return sequenceLayoutEngine.layout(diagram, effective);
        }
        return layeredLayoutEngine.layout(diagram, effective);
    }
}
