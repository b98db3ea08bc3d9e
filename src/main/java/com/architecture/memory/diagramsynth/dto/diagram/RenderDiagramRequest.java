package com.architecture.memory.diagramsynth.dto.diagram;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenderDiagramRequest {

    @NotBlank(message = "Diagram text is required")
    private String diagram;

    private Double startX;
    private Double startY;

    @PositiveOrZero(message = "Node width must not be negative")
    private Double nodeWidth;

    private boolean useStencils;
}
