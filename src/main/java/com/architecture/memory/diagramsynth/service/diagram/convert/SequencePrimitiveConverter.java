package com.architecture.memory.diagramsynth.service.diagram.convert;

import com.architecture.memory.diagramsynth.dto.diagram.BoardConnector;
import com.architecture.memory.diagramsynth.dto.diagram.BoardOutput;
import com.architecture.memory.diagramsynth.dto.diagram.BoardShape;
import com.architecture.memory.diagramsynth.model.diagram.Edge;
import com.architecture.memory.diagramsynth.model.diagram.Node;
import com.architecture.memory.diagramsynth.model.diagram.NodeShape;
import com.architecture.memory.diagramsynth.model.layout.Bounds;
import com.architecture.memory.diagramsynth.service.diagram.layout.LaidOutDiagram;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Draws a laid-out sequence diagram as participant boxes, lifelines and message connectors.
 *
 * Board connectors attach to shapes, not points, so every message gets two small anchor
 * circles on the lifelines at the message's height and the connector runs between them.
 */
@Component
@Slf4j
public class SequencePrimitiveConverter {

    static final String PARTICIPANT_COLOR = "#E3F2FD";
    static final String ACTOR_COLOR = "#FFF9C4";
    static final String LIFELINE_COLOR = "#90CAF9";
    static final double LIFELINE_WIDTH = 10;
    static final double ANCHOR_SIZE = 8;

    private static final double TITLE_ALLOWANCE = 30;
    private static final double MIN_LIFELINE_HEIGHT = 50;
    private static final double FALLBACK_LIFELINE_HEIGHT = 100;
    private static final double LIFELINE_OFFSET = 10;

    public BoardOutput convert(LaidOutDiagram laidOut) {
        BoardOutput output = BoardOutput.builder().build();
        List<Node> participants = laidOut.getDiagram().participantsInOrder();
        Map<String, Double> centerX = new HashMap<>();

        for (Node participant : participants) {
            Bounds bounds = laidOut.boundsOf(participant.getId()).orElse(null);
            if (bounds == null) {
                continue;
            }
            boolean actor = participant.getShape() == NodeShape.CIRCLE;
            output.addShape(BoardShape.builder()
                    .kind(actor ? "circle" : "rectangle")
                    .text(participant.getLabel())
                    .centerX(bounds.getCenterX())
                    .centerY(bounds.getCenterY())
                    .width(bounds.getWidth())
                    .height(bounds.getHeight())
                    .color(actor ? ACTOR_COLOR : PARTICIPANT_COLOR)
                    .build());
            centerX.put(participant.getId(), bounds.getCenterX());
        }

        double lifelineHeight = laidOut.getHeight() - laidOut.getHeaderHeight() - TITLE_ALLOWANCE;
        if (lifelineHeight < MIN_LIFELINE_HEIGHT) {
            lifelineHeight = FALLBACK_LIFELINE_HEIGHT;
        }
        for (Node participant : participants) {
            Bounds bounds = laidOut.boundsOf(participant.getId()).orElse(null);
            if (bounds == null) {
                continue;
            }
            output.addShape(BoardShape.builder()
                    .kind("rectangle")
                    .text("")
                    .centerX(bounds.getCenterX())
                    .centerY(bounds.getBottom() + lifelineHeight / 2 + LIFELINE_OFFSET)
                    .width(LIFELINE_WIDTH)
                    .height(lifelineHeight)
                    .color(LIFELINE_COLOR)
                    .build());
        }

        List<Edge> messages = laidOut.getDiagram().getEdges();
        for (int i = 0; i < messages.size(); i++) {
            Edge message = messages.get(i);
            Double fromX = centerX.get(message.getFromId());
            Double toX = centerX.get(message.getToId());
            if (fromX == null || toX == null || laidOut.messageOffset(i).isEmpty()) {
                log.debug("Skipping message {} with unknown participant", message.getId());
                continue;
            }
            double y = laidOut.messageOffset(i).get();

            int from = output.addShape(anchor(fromX, y));
            int to = output.addShape(anchor(toX, y));
            output.getConnectors().add(BoardConnector.builder()
                    .startIndex(from)
                    .endIndex(to)
                    .caption(message.getLabel())
                    .lineStyle(ShapeStyles.lineStyleOf(message.getStyle()))
                    .routing("straight")
                    .startCap(ShapeStyles.capOf(message.getStartCap()))
                    .endCap(ShapeStyles.capOf(message.getEndCap()))
                    .build());
        }
        return output;
    }

    private BoardShape anchor(double x, double y) {
        return BoardShape.builder()
                .kind("circle")
                .text("")
                .centerX(x)
                .centerY(y)
                .width(ANCHOR_SIZE)
                .height(ANCHOR_SIZE)
                .color(LIFELINE_COLOR)
                .build();
    }
}
