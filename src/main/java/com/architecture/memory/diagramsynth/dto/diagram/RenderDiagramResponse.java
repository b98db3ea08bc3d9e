package com.architecture.memory.diagramsynth.dto.diagram;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenderDiagramResponse {

    private List<BoardShape> shapes;
    private List<BoardConnector> connectors;
    private List<BoardFrame> frames;

    private String diagramType;     // flowchart, sequence
    private double diagramWidth;
    private double diagramHeight;

    private int nodesCount;
    private int connectorsCount;
    private int framesCount;

    private List<DiagramError> warnings;
    private String message;         // "Created diagram with 3 nodes, 2 connectors"
}
