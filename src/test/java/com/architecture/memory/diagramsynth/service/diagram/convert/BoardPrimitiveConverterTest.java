package com.architecture.memory.diagramsynth.service.diagram.convert;

import com.architecture.memory.diagramsynth.dto.diagram.BoardConnector;
import com.architecture.memory.diagramsynth.dto.diagram.BoardFrame;
import com.architecture.memory.diagramsynth.dto.diagram.BoardOutput;
import com.architecture.memory.diagramsynth.dto.diagram.BoardShape;
import com.architecture.memory.diagramsynth.model.diagram.Diagram;
import com.architecture.memory.diagramsynth.model.diagram.DiagramType;
import com.architecture.memory.diagramsynth.model.diagram.Edge;
import com.architecture.memory.diagramsynth.model.diagram.Node;
import com.architecture.memory.diagramsynth.model.diagram.NodeShape;
import com.architecture.memory.diagramsynth.model.diagram.SubGraph;
import com.architecture.memory.diagramsynth.model.layout.LayoutConfig;
import com.architecture.memory.diagramsynth.service.diagram.layout.LaidOutDiagram;
import com.architecture.memory.diagramsynth.service.diagram.layout.LayeredLayoutEngine;
import com.architecture.memory.diagramsynth.service.diagram.parser.FlowchartParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BoardPrimitiveConverterTest {

    private final FlowchartParser parser = new FlowchartParser();
    private final LayeredLayoutEngine engine = new LayeredLayoutEngine();
    private final BoardPrimitiveConverter converter = new BoardPrimitiveConverter(new SequencePrimitiveConverter());

    @Test
    void nodes_becomeCentredShapesWithPaletteColours() {
        BoardOutput output = convert("flowchart TB\nA[Start] --> B{Ok?}\nB --> C((Done))");

        List<BoardShape> shapes = output.getShapes();
        assertThat(shapes).extracting(BoardShape::getKind).containsExactly("rectangle", "rhombus", "circle");
        assertThat(shapes).extracting(BoardShape::getColor).containsExactly("#E3F2FD", "#FFE066", "#B8E986");
        assertThat(shapes.get(0).getText()).isEqualTo("Start");
        assertThat(shapes.get(0).getCenterX()).isEqualTo(90);
        assertThat(shapes.get(0).getCenterY()).isEqualTo(35);
        assertThat(shapes.get(0).isStencil()).isFalse();
    }

    @Test
    void edges_becomeElbowedConnectorsByShapeIndex() {
        BoardOutput output = convert("flowchart TB\nA --> B\nB -.->|maybe| C\nC --- A");

        List<BoardConnector> connectors = output.getConnectors();
        assertThat(connectors).hasSize(3);
        assertThat(connectors.get(0)).satisfies(c -> {
            assertThat(c.getStartIndex()).isZero();
            assertThat(c.getEndIndex()).isEqualTo(1);
            assertThat(c.getRouting()).isEqualTo("elbowed");
            assertThat(c.getLineStyle()).isEqualTo("normal");
            assertThat(c.getStartCap()).isEqualTo("none");
            assertThat(c.getEndCap()).isEqualTo("arrow");
        });
        assertThat(connectors.get(1).getLineStyle()).isEqualTo("dotted");
        assertThat(connectors.get(1).getCaption()).isEqualTo("maybe");
        assertThat(connectors.get(2).getEndCap()).isEqualTo("none");
    }

    @Test
    void explicitColour_overridesPalette() {
        BoardOutput output = convert("flowchart TB\nA{Q} --> B\nstyle A fill:#123456");

        assertThat(output.getShapes().get(0).getColor()).isEqualTo("#123456");
        assertThat(output.getShapes().get(1).getColor()).isEqualTo("#E3F2FD");
    }

    @Test
    void stencilMode_usesFlowchartStencils() {
        Diagram diagram = parser.parse("flowchart TB\nA((Start)) --> B{Ok?}\nB --> C[(DB)]").getDiagram();

        BoardOutput output = converter.convert(engine.layout(diagram, LayoutConfig.defaults()), true);

        assertThat(output.getShapes()).extracting(BoardShape::getKind)
                .containsExactly("flow_chart_terminator", "flow_chart_decision", "flow_chart_database");
        assertThat(output.getShapes()).extracting(BoardShape::getBorderColor)
                .containsExactly("#4CAF50", "#FFC107", "#00BCD4");
        assertThat(output.getShapes()).allSatisfy(shape -> assertThat(shape.isStencil()).isTrue());
        assertThat(output.getShapes().get(1).getColor()).isEqualTo("#FFF9C4");
    }

    @Test
    void subgraph_becomesPaddedFrameWithTitleBand() {
        BoardOutput output = convert("flowchart TB\nsubgraph G[Grp]\nA-->B\nend\nC-->A");

        BoardFrame frame = output.getFrames().get(0);
        assertThat(output.getFrames()).hasSize(1);
        assertThat(frame.getTitle()).isEqualTo("Grp");
        assertThat(frame.getColor()).isEqualTo("#F5F5F5");
        assertThat(frame.getWidth()).isEqualTo(260);
        assertThat(frame.getHeight()).isEqualTo(370);
        assertThat(frame.getX()).isEqualTo(90);
        assertThat(frame.getY()).isEqualTo(305);

        double top = frame.getY() - frame.getHeight() / 2;
        double bottom = frame.getY() + frame.getHeight() / 2;
        BoardShape a = output.getShapes().get(0);
        BoardShape b = output.getShapes().get(1);
        BoardShape c = output.getShapes().get(2);
        assertThat(a.getCenterY() - a.getHeight() / 2).isGreaterThanOrEqualTo(top + 40 + 30);
        assertThat(b.getCenterY() + b.getHeight() / 2).isLessThanOrEqualTo(bottom - 40);
        assertThat(c.getCenterY() + c.getHeight() / 2).isLessThan(top);
    }

    @Test
    void danglingEdgesAndMembers_areDropped() {
        Diagram diagram = new Diagram(DiagramType.FLOWCHART);
        diagram.addNode(Node.builder().id("A").label("A").shape(NodeShape.HEXAGON).subgraphId("").build());
        diagram.addEdge(Edge.builder().id("e1").fromId("A").toId("Ghost").build());
        diagram.addSubGraph(SubGraph.builder().id("Lost").label("Lost").parentId("")
                .memberNodeIds(new ArrayList<>(List.of("Ghost"))).build());

        BoardOutput output = converter.convert(engine.layout(diagram, LayoutConfig.defaults()));

        assertThat(output.getShapes()).singleElement().extracting(BoardShape::getColor).isEqualTo("#FFCCBC");
        assertThat(output.getConnectors()).isEmpty();
        assertThat(output.getFrames()).isEmpty();
    }

    @Test
    void selfLoop_keepsItsConnector() {
        BoardOutput output = convert("flowchart TB\nA --> A");

        assertThat(output.getConnectors()).singleElement().satisfies(c -> {
            assertThat(c.getStartIndex()).isZero();
            assertThat(c.getEndIndex()).isZero();
        });
    }

    private BoardOutput convert(String input) {
        Diagram diagram = parser.parse(input).getDiagram();
        LaidOutDiagram laidOut = engine.layout(diagram, LayoutConfig.defaults());
        return converter.convert(laidOut);
    }
}
