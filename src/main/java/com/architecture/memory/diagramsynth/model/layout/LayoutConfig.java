package com.architecture.memory.diagramsynth.model.layout;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sizes, gaps and origin used by the layout stage.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LayoutConfig {

    // Flowchart
    @Builder.Default
    private double nodeWidth = 180;
    @Builder.Default
    private double nodeHeight = 70;
    @Builder.Default
    private double nodeSpacingX = 80;   // gap between nodes of one layer
    @Builder.Default
    private double nodeSpacingY = 120;  // gap between layers
    @Builder.Default
    private double startX = 0;
    @Builder.Default
    private double startY = 0;
    @Builder.Default
    private double padding = 40;        // frame padding around subgraph members

    // Sequence
    @Builder.Default
    private double participantWidth = 120;
    @Builder.Default
    private double participantHeight = 50;
    @Builder.Default
    private double participantSpacing = 180;
    @Builder.Default
    private double messageSpacing = 60;
    @Builder.Default
    private double messageGap = 30;     // between participant boxes and the first message

    public static LayoutConfig defaults() {
        return LayoutConfig.builder().build();
    }
}
