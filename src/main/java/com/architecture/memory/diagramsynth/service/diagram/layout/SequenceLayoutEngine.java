package com.architecture.memory.diagramsynth.service.diagram.layout;

import com.architecture.memory.diagramsynth.model.diagram.Diagram;
import com.architecture.memory.diagramsynth.model.diagram.Node;
import com.architecture.memory.diagramsynth.model.diagram.NodeShape;
import com.architecture.memory.diagramsynth.model.layout.Bounds;
import com.architecture.memory.diagramsynth.model.layout.LayoutConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Positional model for sequence diagrams: participants in one row ordered by column,
 * messages stacked top to bottom in document order.
 */
@Service
@Slf4j
public class SequenceLayoutEngine {

    static final double ACTOR_SIZE = 50;
    static final double EMPTY_TIMELINE_HEIGHT = 50;

    public LaidOutDiagram layout(Diagram diagram, LayoutConfig config) {
        List<Node> participants = diagram.participantsInOrder();

        Map<String, Bounds> nodeBounds = new LinkedHashMap<>();
        for (int i = 0; i < participants.size(); i++) {
            Node participant = participants.get(i);
            double x = config.getStartX() + i * config.getParticipantSpacing();
            boolean actor = participant.getShape() == NodeShape.CIRCLE;
            double width = actor ? ACTOR_SIZE : config.getParticipantWidth();
            double height = actor ? ACTOR_SIZE : config.getParticipantHeight();
            nodeBounds.put(participant.getId(), new Bounds(x, config.getStartY(), width, height));
        }

        double firstMessageY = config.getStartY() + config.getParticipantHeight() + config.getMessageGap();
        List<Double> offsets = new ArrayList<>();
        for (int i = 0; i < diagram.getEdges().size(); i++) {
            offsets.add(firstMessageY + i * config.getMessageSpacing());
        }

        double width = participants.isEmpty()
                ? 0
                : (participants.size() - 1) * config.getParticipantSpacing() + config.getParticipantWidth();
        double height = offsets.isEmpty()
                ? config.getParticipantHeight() + EMPTY_TIMELINE_HEIGHT
                : offsets.get(offsets.size() - 1) - config.getStartY() + config.getMessageSpacing();

        log.debug("Laid out sequence diagram: {} participants, {} messages, {}x{}",
                participants.size(), offsets.size(), width, height);

        return new LaidOutDiagram(diagram, Map.of(), nodeBounds, Map.of(), offsets, width, height,
                config.getPadding(), config.getParticipantHeight());
    }
}
