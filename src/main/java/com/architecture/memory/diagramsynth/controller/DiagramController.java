package com.architecture.memory.diagramsynth.controller;

import com.architecture.memory.diagramsynth.dto.diagram.DiagramError;
import com.architecture.memory.diagramsynth.dto.diagram.RenderDiagramRequest;
import com.architecture.memory.diagramsynth.dto.diagram.RenderDiagramResponse;
import com.architecture.memory.diagramsynth.dto.diagram.ValidationResponse;
import com.architecture.memory.diagramsynth.exception.DiagramProcessingException;
import com.architecture.memory.diagramsynth.model.layout.LayoutConfig;
import com.architecture.memory.diagramsynth.service.diagram.DiagramSynthesisService;
import com.architecture.memory.diagramsynth.service.diagram.SynthesisResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * REST endpoints for turning diagram text into board primitives.
 */
@RestController
@RequestMapping("/api/diagrams")
@RequiredArgsConstructor
@Slf4j
public class DiagramController {

    private final DiagramSynthesisService synthesisService;

    /**
     * Parse, lay out and convert a diagram.
     * Returns shapes, connectors and frames ready for a board client.
     */
    @PostMapping("/render")
    public ResponseEntity<RenderDiagramResponse> render(@Valid @RequestBody RenderDiagramRequest request) {
        log.info("Rendering diagram ({} chars, stencils: {})", request.getDiagram().length(), request.isUseStencils());

        LayoutConfig config = synthesisService.layoutFor(request.getStartX(), request.getStartY(), request.getNodeWidth());
        SynthesisResult result = synthesisService.synthesize(request.getDiagram(), config, request.isUseStencils());
        if (!result.isSuccess()) {
            throw new DiagramProcessingException(result.getError());
        }

        RenderDiagramResponse response = RenderDiagramResponse.builder()
                .shapes(result.getOutput().getShapes())
                .connectors(result.getOutput().getConnectors())
                .frames(result.getOutput().getFrames())
                .diagramType(result.getDiagramType().getValue())
                .diagramWidth(result.getWidth())
                .diagramHeight(result.getHeight())
                .nodesCount(result.getNodesCount())
                .connectorsCount(result.getConnectorsCount())
                .framesCount(result.getFramesCount())
                .warnings(result.getWarnings())
                .message(result.getMessage())
                .build();
        return ResponseEntity.ok(response);
    }

    /**
     * Check diagram text without rendering it. Invalid text is a normal 200 response with
     * {@code valid=false}.
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidationResponse> validate(@Valid @RequestBody RenderDiagramRequest request) {
        Optional<DiagramError> error = synthesisService.validate(request.getDiagram());
        log.info("Validated diagram: {}", error.map(e -> e.getCode().name()).orElse("ok"));
        return ResponseEntity.ok(error.map(ValidationResponse::invalid).orElseGet(ValidationResponse::ok));
    }
}
