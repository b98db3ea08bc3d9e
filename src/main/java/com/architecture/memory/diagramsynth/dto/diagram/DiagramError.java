package com.architecture.memory.diagramsynth.dto.diagram;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * A structured diagram error: returned as a value by the validator and the parsers,
 * never thrown inside the pipeline.
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class DiagramError {

    public static final int MAX_INPUT_SNIPPET = 50;
    public static final int MAX_INPUT_BYTES = 50 * 1024;
    public static final int MAX_LINES = 500;
    public static final int MAX_LINE_LENGTH = 2000;

    private static final String SHAPE_HELP = "Use valid shapes: [text] for rectangle, (text) for rounded, "
            + "{text} for diamond, ((text)) for circle, {{text}} for hexagon";

    ErrorCode code;
    String message;
    String suggestion;
    int line;       // 1-based, 0 when unknown
    String input;   // offending snippet, truncated

    /**
     * Human readable form: message, line when known, then the suggestion.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(message);
        if (line > 0) {
            sb.append(" (line ").append(line).append(')');
        }
        if (suggestion != null && !suggestion.isEmpty()) {
            sb.append(". ").append(suggestion);
        }
        return sb.toString();
    }

    public DiagramError withLine(int lineNumber) {
        return toBuilder().line(lineNumber).build();
    }

    public DiagramError withInput(String text) {
        return toBuilder().input(truncate(text)).build();
    }

    public DiagramError withSuggestion(String text) {
        return toBuilder().suggestion(text).build();
    }

    static String truncate(String text) {
        if (text == null || text.length() <= MAX_INPUT_SNIPPET) {
            return text;
        }
        return text.substring(0, MAX_INPUT_SNIPPET - 3) + "...";
    }

    private static DiagramError of(ErrorCode code, String message, String suggestion) {
        return DiagramError.builder().code(code).message(message).suggestion(suggestion).build();
    }

    // ========================= FACTORIES =========================

    public static DiagramError emptyDiagram() {
        return of(ErrorCode.EMPTY_DIAGRAM, "diagram input is empty",
                "Provide Mermaid diagram code starting with 'flowchart TB' or 'sequenceDiagram'");
    }

    public static DiagramError missingHeader() {
        return of(ErrorCode.MISSING_HEADER, "diagram must start with a valid header",
                "Use 'flowchart TB', 'flowchart LR', 'graph TD', or 'sequenceDiagram'");
    }

    public static DiagramError missingSequenceHeader() {
        return of(ErrorCode.MISSING_HEADER, "not a sequence diagram: missing 'sequenceDiagram' header",
                "Start your sequence diagram with 'sequenceDiagram' on the first line");
    }

    public static DiagramError noNodes() {
        return of(ErrorCode.NO_NODES, "no nodes found in diagram",
                "Add node definitions like 'A[Label]' or edges like 'A --> B'. "
                        + "Example: flowchart TB\\n    A[Start] --> B[End]");
    }

    public static DiagramError noParticipants() {
        return of(ErrorCode.NO_PARTICIPANTS, "no participants found in sequence diagram",
                "Add participants using 'participant A' or messages like 'A->>B: Hello'");
    }

    public static DiagramError tooManyNodes(int count, int limit) {
        return of(ErrorCode.TOO_MANY_NODES,
                String.format("diagram has %d nodes, exceeding limit of %d", count, limit),
                "Split the diagram into smaller subgraphs or reduce the number of nodes");
    }

    public static DiagramError inputTooLarge() {
        return of(ErrorCode.INPUT_TOO_LARGE,
                String.format("diagram input exceeds maximum size of %d bytes", MAX_INPUT_BYTES),
                "Reduce diagram size or split into multiple smaller diagrams");
    }

    public static DiagramError tooManyLines(int count) {
        return of(ErrorCode.TOO_MANY_LINES,
                String.format("diagram has %d lines, exceeding limit of %d", count, MAX_LINES),
                "Reduce the number of lines or split into multiple diagrams");
    }

    public static DiagramError lineTooLong(int lineNumber, int length) {
        return of(ErrorCode.LINE_TOO_LONG,
                String.format("line %d has %d characters, exceeding limit of %d", lineNumber, length, MAX_LINE_LENGTH),
                "Split long labels or node names into shorter segments")
                .withLine(lineNumber);
    }

    public static DiagramError invalidShape(int lineNumber, String token) {
        return of(ErrorCode.INVALID_SHAPE, "unrecognized node shape: " + truncate(token), SHAPE_HELP)
                .toBuilder().line(lineNumber).input(truncate(token)).build();
    }

    public static DiagramError invalidEdge(int lineNumber, String content) {
        return of(ErrorCode.INVALID_EDGE, "edge has an endpoint that is not a node reference",
                "Write edges as 'A --> B' where both ends are node IDs, optionally with shapes")
                .toBuilder().line(lineNumber).input(truncate(content)).build();
    }

    public static DiagramError syntaxError(int lineNumber, String content, String reason) {
        return of(ErrorCode.INVALID_SYNTAX, "syntax error: " + reason,
                "Check Mermaid syntax at https://mermaid.js.org/syntax/flowchart.html")
                .toBuilder().line(lineNumber).input(truncate(content)).build();
    }
}
