package com.architecture.memory.diagramsynth.dto.diagram;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResponse {

    private boolean valid;
    private DiagramError error;     // null when valid

    public static ValidationResponse ok() {
        return new ValidationResponse(true, null);
    }

    public static ValidationResponse invalid(DiagramError error) {
        return new ValidationResponse(false, error);
    }
}
