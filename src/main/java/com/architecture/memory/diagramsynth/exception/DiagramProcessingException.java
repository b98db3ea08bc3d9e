package com.architecture.memory.diagramsynth.exception;

import com.architecture.memory.diagramsynth.dto.diagram.DiagramError;
import lombok.Getter;

/**
 * Thrown at the REST boundary when diagram text cannot be turned into board primitives.
 */
@Getter
public class DiagramProcessingException extends RuntimeException {

    private final DiagramError error;

    public DiagramProcessingException(DiagramError error) {
        super(error.describe());
        this.error = error;
    }
}
