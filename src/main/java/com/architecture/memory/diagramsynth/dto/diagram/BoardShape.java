package com.architecture.memory.diagramsynth.dto.diagram;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A shape for the board client to draw. Position is the shape's center.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoardShape {

    private String kind;        // rectangle, rhombus, circle, flow_chart_process, ...
    private String text;
    private double centerX;
    private double centerY;
    private double width;
    private double height;
    private String color;
    private boolean stencil;    // flowchart stencil kind
    private String borderColor; // stencil shapes only
}
