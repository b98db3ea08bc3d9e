package com.architecture.memory.diagramsynth.service.diagram.parser;

import com.architecture.memory.diagramsynth.dto.diagram.DiagramError;
import com.architecture.memory.diagramsynth.model.diagram.Diagram;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a parse: exactly one of a diagram or an error.
 */
public final class ParseResult {

    private final Diagram diagram;
    private final DiagramError error;

    private ParseResult(Diagram diagram, DiagramError error) {
        this.diagram = diagram;
        this.error = error;
    }

    public static ParseResult success(Diagram diagram) {
        return new ParseResult(Objects.requireNonNull(diagram, "diagram"), null);
    }

    public static ParseResult failure(DiagramError error) {
        return new ParseResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return diagram != null;
    }

    public Optional<DiagramError> error() {
        return Optional.ofNullable(error);
    }

    /**
     * The parsed diagram, for callers that already checked {@link #isSuccess()}.
     */
    public Diagram getDiagram() {
        if (diagram == null) {
            throw new IllegalStateException("Parse failed: " + error.describe());
        }
        return diagram;
    }

    public DiagramError getError() {
        if (error == null) {
            throw new IllegalStateException("Parse succeeded, there is no error");
        }
        return error;
    }
}
