package com.architecture.memory.diagramsynth.service.diagram;

import com.architecture.memory.diagramsynth.dto.diagram.BoardOutput;
import com.architecture.memory.diagramsynth.dto.diagram.DiagramError;
import com.architecture.memory.diagramsynth.model.diagram.DiagramType;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one pass through the pipeline: board primitives plus summary figures, or the
 * first error that stopped it.
 */
@Getter
public final class SynthesisResult {

    private final DiagramError error;
    private final BoardOutput output;
    private final DiagramType diagramType;
    private final double width;
    private final double height;
    private final int nodesCount;
    private final List<DiagramError> warnings;

    private SynthesisResult(DiagramError error, BoardOutput output, DiagramType diagramType,
                            double width, double height, int nodesCount, List<DiagramError> warnings) {
        this.error = error;
        this.output = output;
        this.diagramType = diagramType;
        this.width = width;
        this.height = height;
        this.nodesCount = nodesCount;
        this.warnings = warnings;
    }

    public static SynthesisResult success(BoardOutput output, DiagramType diagramType, double width, double height,
                                          int nodesCount, List<DiagramError> warnings) {
        return new SynthesisResult(null, output, diagramType, width, height, nodesCount, List.copyOf(warnings));
    }

    public static SynthesisResult failure(DiagramError error) {
        return new SynthesisResult(error, null, null, 0, 0, 0, List.of());
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<DiagramError> error() {
        return Optional.ofNullable(error);
    }

    public int getConnectorsCount() {
        return output == null ? 0 : output.getConnectors().size();
    }

    public int getFramesCount() {
        return output == null ? 0 : output.getFrames().size();
    }

    /**
     * Human-readable summary, e.g. "Created diagram with 3 nodes, 2 connectors".
     * Zero counts are left out.
     */
    public String getMessage() {
        if (!isSuccess()) {
            return error.describe();
        }
        List<String> parts = new ArrayList<>();
        if (nodesCount > 0) {
            parts.add(nodesCount + " nodes");
        }
        if (getConnectorsCount() > 0) {
            parts.add(getConnectorsCount() + " connectors");
        }
        if (getFramesCount() > 0) {
            parts.add(getFramesCount() + " frames");
        }
        return parts.isEmpty() ? "Created diagram" : "Created diagram with " + String.join(", ", parts);
    }
}
