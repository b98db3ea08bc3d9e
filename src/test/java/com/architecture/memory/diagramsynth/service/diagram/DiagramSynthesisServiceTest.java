package com.architecture.memory.diagramsynth.service.diagram;

import com.architecture.memory.diagramsynth.config.DiagramLimits;
import com.architecture.memory.diagramsynth.dto.diagram.BoardFrame;
import com.architecture.memory.diagramsynth.dto.diagram.BoardShape;
import com.architecture.memory.diagramsynth.dto.diagram.DiagramError;
import com.architecture.memory.diagramsynth.dto.diagram.ErrorCode;
import com.architecture.memory.diagramsynth.model.diagram.DiagramType;
import com.architecture.memory.diagramsynth.model.layout.LayoutConfig;
import com.architecture.memory.diagramsynth.service.diagram.convert.BoardPrimitiveConverter;
import com.architecture.memory.diagramsynth.service.diagram.convert.SequencePrimitiveConverter;
import com.architecture.memory.diagramsynth.service.diagram.layout.DiagramLayoutService;
import com.architecture.memory.diagramsynth.service.diagram.layout.LayeredLayoutEngine;
import com.architecture.memory.diagramsynth.service.diagram.layout.SequenceLayoutEngine;
import com.architecture.memory.diagramsynth.service.diagram.parser.FlowchartParser;
import com.architecture.memory.diagramsynth.service.diagram.parser.MermaidParser;
import com.architecture.memory.diagramsynth.service.diagram.parser.SequenceParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end runs of the pipeline with real components.
 */
class DiagramSynthesisServiceTest {

    private final DiagramSynthesisService service = service(DiagramLimits.defaults());

    @Test
    void flowchart_endToEnd() {
        SynthesisResult result = service.synthesize("flowchart TB\nA[Start] --> B[End]");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getDiagramType()).isEqualTo(DiagramType.FLOWCHART);
        assertThat(result.getNodesCount()).isEqualTo(2);
        assertThat(result.getConnectorsCount()).isEqualTo(1);
        assertThat(result.getFramesCount()).isZero();
        assertThat(result.getWidth()).isEqualTo(180);
        assertThat(result.getHeight()).isEqualTo(260);
        assertThat(result.getMessage()).isEqualTo("Created diagram with 2 nodes, 1 connectors");

        BoardShape start = result.getOutput().getShapes().get(0);
        BoardShape end = result.getOutput().getShapes().get(1);
        assertThat(start.getCenterY()).isLessThan(end.getCenterY());
    }

    @Test
    void sequence_endToEnd() {
        SynthesisResult result = service.synthesize("sequenceDiagram\nAlice->>Bob: Hi\nBob-->>Alice: Hello");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getDiagramType()).isEqualTo(DiagramType.SEQUENCE);
        assertThat(result.getOutput().getShapes()).hasSize(8);
        assertThat(result.getOutput().getConnectors()).hasSize(2);
        assertThat(result.getMessage()).isEqualTo("Created diagram with 2 nodes, 2 connectors");
    }

    @Test
    void subgraph_endToEnd() {
        SynthesisResult result = service.synthesize("flowchart TB\nsubgraph G[Grp]\nA-->B\nend\nC-->A");

        BoardFrame frame = result.getOutput().getFrames().get(0);
        assertThat(frame.getTitle()).isEqualTo("Grp");
        assertThat(result.getMessage()).isEqualTo("Created diagram with 3 nodes, 2 connectors, 1 frames");
    }

    @Test
    void emptyInput_stopsAtValidation() {
        SynthesisResult result = service.synthesize("");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().getCode()).isEqualTo(ErrorCode.EMPTY_DIAGRAM);
        assertThat(result.getOutput()).isNull();
        assertThat(result.getMessage()).startsWith("diagram input is empty");
    }

    @Test
    void headerOnly_stopsAtParse() {
        SynthesisResult result = service.synthesize("flowchart TB");

        assertThat(result.error()).get().extracting(DiagramError::getCode).isEqualTo(ErrorCode.NO_NODES);
    }

    @Test
    void nodeLimit_isEnforcedAfterParse() {
        DiagramSynthesisService limited = service(new DiagramLimits(2));

        SynthesisResult result = limited.synthesize("flowchart TB\nA --> B --> C");

        assertThat(result.getError().getCode()).isEqualTo(ErrorCode.TOO_MANY_NODES);
        assertThat(result.getError().getMessage()).isEqualTo("diagram has 3 nodes, exceeding limit of 2");
    }

    @Test
    void warnings_areReportedWithSuccess() {
        SynthesisResult result = service.synthesize("flowchart TB\nA --> B\n!!!");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getWarnings()).singleElement()
                .extracting(DiagramError::getCode).isEqualTo(ErrorCode.INVALID_SYNTAX);
    }

    @Test
    void stencils_arePassedToConverter() {
        LayoutConfig config = service.layoutFor(null, null, null);

        SynthesisResult result = service.synthesize("flowchart TB\nA{Ok?}", config, true);

        assertThat(result.getOutput().getShapes().get(0).getKind()).isEqualTo("flow_chart_decision");
    }

    @Test
    void layoutFor_mergesNonZeroOverrides() {
        LayoutConfig merged = service.layoutFor(100.0, 0.0, 240.0);

        assertThat(merged.getStartX()).isEqualTo(100);
        assertThat(merged.getStartY()).isZero();
        assertThat(merged.getNodeWidth()).isEqualTo(240);
        assertThat(merged.getNodeHeight()).isEqualTo(70);

        assertThat(service.layoutFor(null, null, -5.0).getNodeWidth()).isEqualTo(180);
    }

    @Test
    void overriddenOrigin_movesShapes() {
        SynthesisResult result = service.synthesize("flowchart TB\nA", service.layoutFor(1000.0, 500.0, null), false);

        BoardShape shape = result.getOutput().getShapes().get(0);
        assertThat(shape.getCenterX()).isEqualTo(1090);
        assertThat(shape.getCenterY()).isEqualTo(535);
    }

    @Test
    void validate_coversInputGatesAndParse() {
        assertThat(service.validate("flowchart TB\nA --> B")).isEmpty();
        assertThat(service.validate("A -> B")).get()
                .extracting(DiagramError::getCode).isEqualTo(ErrorCode.MISSING_HEADER);
        assertThat(service.validate("sequenceDiagram")).get()
                .extracting(DiagramError::getCode).isEqualTo(ErrorCode.NO_PARTICIPANTS);
    }

    private static DiagramSynthesisService service(DiagramLimits limits) {
        return new DiagramSynthesisService(
                new DiagramInputValidator(),
                new MermaidParser(new FlowchartParser(), new SequenceParser()),
                new DiagramLayoutService(new LayeredLayoutEngine(), new SequenceLayoutEngine()),
                new BoardPrimitiveConverter(new SequencePrimitiveConverter()),
                LayoutConfig.defaults(),
                limits);
    }
}
