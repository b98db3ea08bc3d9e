package com.architecture.memory.diagramsynth.service.diagram.parser;

import com.architecture.memory.diagramsynth.dto.diagram.DiagramError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Single entry point for diagram text. Picks the grammar from the first statement:
 * exactly {@code sequenceDiagram} selects the sequence grammar, anything else the flowchart one.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MermaidParser {

    private final FlowchartParser flowchartParser;
    private final SequenceParser sequenceParser;

    public ParseResult parse(String input) {
        if (input == null || input.isBlank()) {
            return ParseResult.failure(DiagramError.emptyDiagram());
        }
        if (isSequenceDiagram(input)) {
            log.debug("Dispatching to sequence grammar");
            return sequenceParser.parse(input);
        }
        log.debug("Dispatching to flowchart grammar");
        return flowchartParser.parse(input);
    }

    /**
     * Whether the first non-blank, non-comment line is a {@code sequenceDiagram} header.
     */
    public static boolean isSequenceDiagram(String input) {
        for (String raw : input.split("\n")) {
            String line = raw.trim().toLowerCase(Locale.ROOT);
            if (line.isEmpty() || line.startsWith("%%")) {
                continue;
            }
            return line.equals("sequencediagram");
        }
        return false;
    }
}
