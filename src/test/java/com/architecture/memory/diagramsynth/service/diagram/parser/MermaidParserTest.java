package com.architecture.memory.diagramsynth.service.diagram.parser;

import com.architecture.memory.diagramsynth.dto.diagram.ErrorCode;
import com.architecture.memory.diagramsynth.model.diagram.DiagramType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MermaidParserTest {

    private final MermaidParser parser = new MermaidParser(new FlowchartParser(), new SequenceParser());

    @Test
    void blankInput_isEmptyDiagram() {
        assertThat(parser.parse("").getError().getCode()).isEqualTo(ErrorCode.EMPTY_DIAGRAM);
        assertThat(parser.parse(" \n ").getError().getCode()).isEqualTo(ErrorCode.EMPTY_DIAGRAM);
        assertThat(parser.parse(null).getError().getCode()).isEqualTo(ErrorCode.EMPTY_DIAGRAM);
    }

    @Test
    void dispatchesOnFirstStatement() {
        assertThat(parser.parse("%% c\n\nsequenceDiagram\nA->>B: x").getDiagram().getType())
                .isEqualTo(DiagramType.SEQUENCE);
        assertThat(parser.parse("SEQUENCEDIAGRAM\nA->>B: x").getDiagram().getType())
                .isEqualTo(DiagramType.SEQUENCE);
        assertThat(parser.parse("flowchart TB\nA --> B").getDiagram().getType())
                .isEqualTo(DiagramType.FLOWCHART);
    }

    @Test
    void headerWithTrailingText_isNotSequence() {
        assertThat(MermaidParser.isSequenceDiagram("sequenceDiagram extra\nA->>B: x")).isFalse();
        assertThat(MermaidParser.isSequenceDiagram("  sequenceDiagram  \nA->>B: x")).isTrue();
    }

    @Test
    void flowchartHeaderOnly_hasNoNodes() {
        assertThat(parser.parse("flowchart TB").getError().getCode()).isEqualTo(ErrorCode.NO_NODES);
    }
}
