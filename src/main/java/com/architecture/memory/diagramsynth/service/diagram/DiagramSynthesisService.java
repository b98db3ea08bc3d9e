package com.architecture.memory.diagramsynth.service.diagram;

import com.architecture.memory.diagramsynth.config.DiagramLimits;
import com.architecture.memory.diagramsynth.dto.diagram.BoardOutput;
import com.architecture.memory.diagramsynth.dto.diagram.DiagramError;
import com.architecture.memory.diagramsynth.model.diagram.Diagram;
import com.architecture.memory.diagramsynth.model.layout.LayoutConfig;
import com.architecture.memory.diagramsynth.service.diagram.convert.BoardPrimitiveConverter;
import com.architecture.memory.diagramsynth.service.diagram.layout.DiagramLayoutService;
import com.architecture.memory.diagramsynth.service.diagram.layout.LaidOutDiagram;
import com.architecture.memory.diagramsynth.service.diagram.parser.MermaidParser;
import com.architecture.memory.diagramsynth.service.diagram.parser.ParseResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Runs diagram text through the whole pipeline: validate, parse, node limit, layout, convert.
 * Each stage stops the run with a {@link DiagramError} instead of throwing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DiagramSynthesisService {

    private final DiagramInputValidator validator;
    private final MermaidParser parser;
    private final DiagramLayoutService layoutService;
    private final BoardPrimitiveConverter converter;
    private final LayoutConfig defaultLayoutConfig;
    private final DiagramLimits limits;

    public SynthesisResult synthesize(String input) {
        return synthesize(input, defaultLayoutConfig, false);
    }

    public SynthesisResult synthesize(String input, LayoutConfig config, boolean useStencils) {
        log.info("Synthesizing diagram ({} chars, stencils: {})", input == null ? 0 : input.length(), useStencils);

        Optional<DiagramError> invalid = validator.validate(input);
        if (invalid.isPresent()) {
            log.info("Diagram rejected by validation: {}", invalid.get().getCode());
            return SynthesisResult.failure(invalid.get());
        }

        ParseResult parsed = parser.parse(input.strip());
        if (!parsed.isSuccess()) {
            log.info("Diagram rejected by parser: {}", parsed.getError().getCode());
            return SynthesisResult.failure(parsed.getError());
        }
        Diagram diagram = parsed.getDiagram();

        int nodeCount = diagram.getNodes().size();
        if (nodeCount > limits.getMaxNodes()) {
            log.info("Diagram has {} nodes, limit is {}", nodeCount, limits.getMaxNodes());
            return SynthesisResult.failure(DiagramError.tooManyNodes(nodeCount, limits.getMaxNodes()));
        }

        LaidOutDiagram laidOut = layoutService.layout(diagram, config != null ? config : defaultLayoutConfig);
        BoardOutput output = converter.convert(laidOut, useStencils);

        log.info("Synthesized {} diagram: {} nodes, {} shapes, {} connectors, {} frames, {} warnings",
                diagram.getType().getValue(), nodeCount, output.getShapes().size(),
                output.getConnectors().size(), output.getFrames().size(), diagram.getWarnings().size());

        return SynthesisResult.success(output, diagram.getType(), laidOut.getWidth(), laidOut.getHeight(),
                nodeCount, diagram.getWarnings());
    }

    /**
     * Check diagram text without laying it out. Covers both the input gates and the parse.
     */
    public Optional<DiagramError> validate(String input) {
        Optional<DiagramError> invalid = validator.validate(input);
        if (invalid.isPresent()) {
            return invalid;
        }
        return parser.parse(input.strip()).error();
    }

    /**
     * The default layout with per-request overrides applied. Null or zero overrides keep the
     * default; node width only applies when positive.
     */
    public LayoutConfig layoutFor(Double startX, Double startY, Double nodeWidth) {
        LayoutConfig.LayoutConfigBuilder builder = defaultLayoutConfig.toBuilder();
        if (startX != null && startX != 0) {
            builder.startX(startX);
        }
        if (startY != null && startY != 0) {
            builder.startY(startY);
        }
        if (nodeWidth != null && nodeWidth > 0) {
            builder.nodeWidth(nodeWidth);
        }
        return builder.build();
    }
}
