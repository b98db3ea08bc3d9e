package com.architecture.memory.diagramsynth.service.diagram.convert;

import com.architecture.memory.diagramsynth.dto.diagram.BoardConnector;
import com.architecture.memory.diagramsynth.dto.diagram.BoardFrame;
import com.architecture.memory.diagramsynth.dto.diagram.BoardOutput;
import com.architecture.memory.diagramsynth.dto.diagram.BoardShape;
import com.architecture.memory.diagramsynth.model.diagram.DiagramType;
import com.architecture.memory.diagramsynth.model.diagram.Edge;
import com.architecture.memory.diagramsynth.model.diagram.Node;
import com.architecture.memory.diagramsynth.model.diagram.NodeShape;
import com.architecture.memory.diagramsynth.model.diagram.SubGraph;
import com.architecture.memory.diagramsynth.model.layout.Bounds;
import com.architecture.memory.diagramsynth.service.diagram.layout.LaidOutDiagram;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Turns a laid-out diagram into board shapes, connectors and frames.
 * Sequence diagrams are handed to {@link SequencePrimitiveConverter}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BoardPrimitiveConverter {

    static final String FRAME_COLOR = "#F5F5F5";
    static final double TITLE_BAND = 30;

    private final SequencePrimitiveConverter sequenceConverter;

    public BoardOutput convert(LaidOutDiagram laidOut) {
        return convert(laidOut, false);
    }

    /**
     * @param useStencils draw flowchart nodes with flowchart stencil kinds and a border colour
     */
    public BoardOutput convert(LaidOutDiagram laidOut, boolean useStencils) {
        if (laidOut.getDiagram().getType() == DiagramType.SEQUENCE) {
            return sequenceConverter.convert(laidOut);
        }

        BoardOutput output = BoardOutput.builder().build();
        Map<String, Integer> shapeIndex = new HashMap<>();

        for (Node node : laidOut.getDiagram().getNodes().values()) {
            laidOut.boundsOf(node.getId()).ifPresent(bounds ->
                    shapeIndex.put(node.getId(), output.addShape(toShape(node, bounds, useStencils))));
        }

        for (Edge edge : laidOut.getDiagram().getEdges()) {
            Integer start = shapeIndex.get(edge.getFromId());
            Integer end = shapeIndex.get(edge.getToId());
            if (start == null || end == null) {
                log.debug("Dropping edge {} with unresolved endpoint", edge.getId());
                continue;
            }
            output.getConnectors().add(BoardConnector.builder()
                    .startIndex(start)
                    .endIndex(end)
                    .caption(edge.getLabel())
                    .lineStyle(ShapeStyles.lineStyleOf(edge.getStyle()))
                    .routing("elbowed")
                    .startCap(ShapeStyles.capOf(edge.getStartCap()))
                    .endCap(ShapeStyles.capOf(edge.getEndCap()))
                    .build());
        }

        double padding = laidOut.getFramePadding();
        for (SubGraph subgraph : laidOut.getDiagram().getSubgraphs().values()) {
            Bounds members = laidOut.getSubgraphBounds().get(subgraph.getId());
            if (members == null) {
                continue;
            }
            double width = members.getWidth() + 2 * padding;
            double height = members.getHeight() + 2 * padding + TITLE_BAND;
            output.getFrames().add(BoardFrame.builder()
                    .title(subgraph.getLabel())
                    .x(members.getX() - padding + width / 2)
                    .y(members.getY() - padding - TITLE_BAND + height / 2)
                    .width(width)
                    .height(height)
                    .color(FRAME_COLOR)
                    .build());
        }

        return output;
    }

    private BoardShape toShape(Node node, Bounds bounds, boolean useStencils) {
        NodeShape shape = node.getShape() != null ? node.getShape() : NodeShape.RECTANGLE;
        BoardShape.BoardShapeBuilder builder = BoardShape.builder()
                .text(node.getLabel())
                .centerX(bounds.getCenterX())
                .centerY(bounds.getCenterY())
                .width(bounds.getWidth())
                .height(bounds.getHeight());

        if (useStencils) {
            builder.kind(ShapeStyles.stencilKindOf(shape))
                    .color(ShapeStyles.stencilFillOf(shape))
                    .stencil(true)
                    .borderColor(ShapeStyles.stencilBorderOf(shape));
        } else {
            builder.kind(ShapeStyles.kindOf(shape))
                    .color(ShapeStyles.fillOf(shape));
        }

        if (node.getColor() != null && !node.getColor().isEmpty()) {
            builder.color(node.getColor());
        }
        return builder.build();
    }
}
