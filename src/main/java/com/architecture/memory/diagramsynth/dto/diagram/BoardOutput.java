package com.architecture.memory.diagramsynth.dto.diagram;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything a board client needs to draw one diagram.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoardOutput {

    @Builder.Default
    private List<BoardShape> shapes = new ArrayList<>();

    @Builder.Default
    private List<BoardConnector> connectors = new ArrayList<>();

    @Builder.Default
    private List<BoardFrame> frames = new ArrayList<>();

    /**
     * Append a shape and return its index for connectors to reference.
     */
    public int addShape(BoardShape shape) {
        shapes.add(shape);
        return shapes.size() - 1;
    }
}
