package com.architecture.memory.diagramsynth.service.diagram.convert;

import com.architecture.memory.diagramsynth.model.diagram.ArrowCap;
import com.architecture.memory.diagramsynth.model.diagram.EdgeStyle;
import com.architecture.memory.diagramsynth.model.diagram.NodeShape;

/**
 * Lookup tables from IR enums to the board client's shape, cap and line vocabulary.
 */
final class ShapeStyles {

    static final String DEFAULT_FILL = "#E3F2FD";

    private ShapeStyles() {
    }

    static String kindOf(NodeShape shape) {
        return switch (shape) {
            case RECTANGLE -> "rectangle";
            case ROUNDED_RECTANGLE -> "round_rectangle";
            case DIAMOND -> "rhombus";
            case CIRCLE -> "circle";
            case STADIUM -> "pill";
            case CYLINDER -> "can";
            case PARALLELOGRAM -> "parallelogram";
            case HEXAGON -> "hexagon";
            case TRAPEZOID -> "trapezoid";
        };
    }

    static String fillOf(NodeShape shape) {
        return switch (shape) {
            case DIAMOND -> "#FFE066";          // decisions
            case CIRCLE -> "#B8E986";           // start / end
            case STADIUM -> "#B3E5FC";
            case PARALLELOGRAM -> "#E1BEE7";    // input / output
            case HEXAGON -> "#FFCCBC";
            default -> DEFAULT_FILL;
        };
    }

    static String stencilKindOf(NodeShape shape) {
        return switch (shape) {
            case CIRCLE, STADIUM -> "flow_chart_terminator";
            case DIAMOND -> "flow_chart_decision";
            case RECTANGLE, ROUNDED_RECTANGLE -> "flow_chart_process";
            case PARALLELOGRAM -> "flow_chart_input_output";
            case HEXAGON -> "flow_chart_preparation";
            case CYLINDER -> "flow_chart_database";
            case TRAPEZOID -> "flow_chart_manual_operation";
        };
    }

    static String stencilFillOf(NodeShape shape) {
        return switch (shape) {
            case CIRCLE, STADIUM -> "#C8E6C9";
            case DIAMOND -> "#FFF9C4";
            case RECTANGLE, ROUNDED_RECTANGLE -> "#BBDEFB";
            case PARALLELOGRAM -> "#E1BEE7";
            case HEXAGON -> "#FFE0B2";
            case CYLINDER -> "#B3E5FC";
            case TRAPEZOID -> "#FFCCBC";
        };
    }

    static String stencilBorderOf(NodeShape shape) {
        return switch (shape) {
            case CIRCLE, STADIUM -> "#4CAF50";
            case DIAMOND -> "#FFC107";
            case RECTANGLE, ROUNDED_RECTANGLE -> "#2196F3";
            case PARALLELOGRAM -> "#9C27B0";
            case HEXAGON -> "#FF9800";
            case CYLINDER -> "#00BCD4";
            case TRAPEZOID -> "#FF5722";
        };
    }

    static String capOf(ArrowCap cap) {
        if (cap == null) {
            return "none";
        }
        return switch (cap) {
            case NONE -> "none";
            case ARROW -> "arrow";
            case FILLED_CIRCLE -> "filled_circle";
            case DIAMOND_CROSS -> "diamond";
        };
    }

    static String lineStyleOf(EdgeStyle style) {
        if (style == null) {
            return "normal";
        }
        return switch (style) {
            case SOLID -> "normal";
            case DOTTED -> "dotted";
            case THICK -> "thick";
        };
    }
}
