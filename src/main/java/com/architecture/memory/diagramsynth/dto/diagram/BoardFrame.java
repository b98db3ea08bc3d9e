package com.architecture.memory.diagramsynth.dto.diagram;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A titled frame drawn around a subgraph. {@code x}/{@code y} is the frame's center.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoardFrame {

    private String title;
    private double x;
    private double y;
    private double width;
    private double height;
    private String color;
}
