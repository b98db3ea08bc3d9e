package com.architecture.memory.diagramsynth.service.diagram;

import com.architecture.memory.diagramsynth.dto.diagram.DiagramError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * Size, line and header gates applied to raw diagram text before any pattern matching runs.
 * The limits bound the worst-case cost of the parsers on adversarial input.
 */
@Service
@Slf4j
public class DiagramInputValidator {

    /**
     * Validate raw diagram text.
     *
     * @return empty when the text may be parsed, otherwise the first failed gate
     */
    public Optional<DiagramError> validate(String input) {
        if (input == null) {
            return Optional.of(DiagramError.emptyDiagram());
        }
        if (input.getBytes(StandardCharsets.UTF_8).length > DiagramError.MAX_INPUT_BYTES) {
            return Optional.of(DiagramError.inputTooLarge());
        }

        String trimmed = input.strip();
        if (trimmed.isEmpty()) {
            return Optional.of(DiagramError.emptyDiagram());
        }

        String[] lines = trimmed.split("\n", -1);
        if (lines.length > DiagramError.MAX_LINES) {
            return Optional.of(DiagramError.tooManyLines(lines.length));
        }

        for (int i = 0; i < lines.length; i++) {
            if (lines[i].length() > DiagramError.MAX_LINE_LENGTH) {
                return Optional.of(DiagramError.lineTooLong(i + 1, lines[i].length()));
            }
        }

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty() || line.startsWith("%%")) {
                continue;
            }
            if (isHeader(line)) {
                return Optional.empty();
            }

            log.debug("Rejecting diagram without header, first statement at line {}", i + 1);
            DiagramError error = DiagramError.missingHeader().withLine(i + 1).withInput(line);
            String hint = typeHint(input);
            if (!hint.isEmpty()) {
                error = error.withSuggestion(error.getSuggestion() + ". " + hint);
            }
            return Optional.of(error);
        }

        // Only comments: the parser reports the missing content
        return Optional.empty();
    }

    /**
     * Whether a trimmed line opens a flowchart or a sequence diagram.
     */
    public static boolean isHeader(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        return lower.startsWith("flowchart")
                || lower.startsWith("graph")
                || lower.equals("sequencediagram");
    }

    /**
     * Look for common header and arrow mistakes in raw text. Returns an empty string when
     * nothing recognisable is found.
     */
    public static String typeHint(String input) {
        if (input == null) return "";
        String text = input.strip().toLowerCase(Locale.ROOT);

        if (text.contains("->") && !text.contains("-->")) {
            if (text.contains("sequencediagram")) {
                return "Sequence diagrams use '->>': A->>B: message";
            }
            return "Flowcharts use '-->': A --> B";
        }

        if (text.contains("participant") && !text.startsWith("sequencediagram")) {
            return "Sequence diagrams must start with 'sequenceDiagram'";
        }

        if (text.contains("subgraph") && !text.startsWith("flowchart") && !text.startsWith("graph")) {
            return "Flowcharts with subgraphs must start with 'flowchart TB' or 'graph TD'";
        }

        return "";
    }
}
