package com.architecture.memory.diagramsynth.service.diagram.parser;

import com.architecture.memory.diagramsynth.model.diagram.ArrowCap;
import com.architecture.memory.diagramsynth.model.diagram.EdgeStyle;
import com.architecture.memory.diagramsynth.model.diagram.NodeShape;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits flowchart statements into node references and link operators.
 *
 * Link operators are only recognised outside shape delimiters and quotes, so a label such as
 * {@code A[a --> b]} stays one node reference.
 *
 * Supported operators:
 * - {@code -->} solid with arrow, {@code ---} solid without caps
 * - {@code -.->} dotted with arrow, {@code -.-} dotted without caps
 * - {@code ==>} thick with arrow, {@code ===} thick without caps
 * - {@code -- text -->} solid with arrow and caption
 * Any operator may be followed by {@code |caption|}.
 */
public final class FlowchartTokenizer {

    private static final Pattern NODE_ID = Pattern.compile("^([A-Za-z0-9_]+)");

    // Checked in order: longer delimiters first
    private static final List<Delimiter> DELIMITERS = List.of(
            new Delimiter("((", "))", NodeShape.CIRCLE),
            new Delimiter("{{", "}}", NodeShape.HEXAGON),
            new Delimiter("([", "])", NodeShape.STADIUM),
            new Delimiter("[(", ")]", NodeShape.CYLINDER),
            new Delimiter("[/", "/]", NodeShape.PARALLELOGRAM),
            new Delimiter("[\\", "\\]", NodeShape.TRAPEZOID),
            new Delimiter("{", "}", NodeShape.DIAMOND),
            new Delimiter("(", ")", NodeShape.STADIUM),
            new Delimiter("[", "]", NodeShape.RECTANGLE),
            new Delimiter(">", "]", NodeShape.PARALLELOGRAM)
    );

    private FlowchartTokenizer() {
    }

    /**
     * Split a statement on link operators.
     *
     * @return the chain, or empty when the statement contains no link operator
     */
    public static Optional<EdgeChain> splitChain(String statement) {
        List<String> segments = new ArrayList<>();
        List<FlowchartArrow> arrows = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        int depth = 0;
        char quote = 0;
        int i = 0;
        int n = statement.length();

        while (i < n) {
            char c = statement.charAt(i);

            if (quote != 0) {
                current.append(c);
                if (c == quote) quote = 0;
                i++;
                continue;
            }
            if (c == '"') {
                quote = c;
                current.append(c);
                i++;
                continue;
            }
            if (c == '[' || c == '(' || c == '{') {
                depth++;
            } else if (c == ']' || c == ')' || c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0) {
                ArrowMatch match = matchArrow(statement, i);
                if (match != null) {
                    segments.add(current.toString().trim());
                    current.setLength(0);
                    i = match.end;

                    FlowchartArrow arrow = match.arrow;
                    int j = skipSpaces(statement, i);
                    if (j < n && statement.charAt(j) == '|') {
                        int close = statement.indexOf('|', j + 1);
                        if (close > j) {
                            arrow = arrow.withLabel(statement.substring(j + 1, close).trim());
                            i = close + 1;
                        }
                    }
                    arrows.add(arrow);
                    continue;
                }
                if (c == '>') {
                    // asymmetric node shape: A>text]
                    depth++;
                }
            }
            current.append(c);
            i++;
        }

        if (arrows.isEmpty()) {
            return Optional.empty();
        }
        segments.add(current.toString().trim());
        return Optional.of(new EdgeChain(segments, arrows));
    }

    /**
     * Parse a single node reference such as {@code A}, {@code A[Label]} or {@code B{Decision?}}.
     *
     * @return empty when the text is not a well-formed node reference
     */
    public static Optional<NodeReference> parseNode(String text) {
        if (text == null) return Optional.empty();
        String trimmed = text.trim();
        Matcher idMatcher = NODE_ID.matcher(trimmed);
        if (!idMatcher.find()) {
            return Optional.empty();
        }

        String id = idMatcher.group(1);
        String rest = trimmed.substring(id.length()).stripLeading();
        if (rest.isEmpty()) {
            return Optional.of(new NodeReference(id, id, NodeShape.RECTANGLE));
        }

        for (Delimiter delimiter : DELIMITERS) {
            if (rest.length() >= delimiter.open.length() + delimiter.close.length()
                    && rest.startsWith(delimiter.open)
                    && rest.endsWith(delimiter.close)) {
                String label = unquote(rest.substring(delimiter.open.length(),
                        rest.length() - delimiter.close.length()));
                if (label.isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(new NodeReference(id, label, delimiter.shape));
            }
        }
        return Optional.empty();
    }

    static String unquote(String text) {
        String value = text.trim();
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1).trim();
            }
        }
        return value;
    }

    private static ArrowMatch matchArrow(String s, int i) {
        if (s.startsWith("-.-", i)) {
            int end = i + 3;
            if (end < s.length() && s.charAt(end) == '>') {
                return new ArrowMatch(arrow(EdgeStyle.DOTTED, ArrowCap.ARROW), end + 1);
            }
            return new ArrowMatch(arrow(EdgeStyle.DOTTED, ArrowCap.NONE), end);
        }

        if (s.startsWith("==", i)) {
            int end = runEnd(s, i, '=');
            if (end < s.length() && s.charAt(end) == '>') {
                return new ArrowMatch(arrow(EdgeStyle.THICK, ArrowCap.ARROW), end + 1);
            }
            if (end - i >= 3) {
                return new ArrowMatch(arrow(EdgeStyle.THICK, ArrowCap.NONE), end);
            }
            return null;
        }

        if (s.startsWith("--", i)) {
            int end = runEnd(s, i, '-');
            if (end < s.length() && s.charAt(end) == '>') {
                return new ArrowMatch(arrow(EdgeStyle.SOLID, ArrowCap.ARROW), end + 1);
            }
            if (end - i >= 3) {
                return new ArrowMatch(arrow(EdgeStyle.SOLID, ArrowCap.NONE), end);
            }
            // A -- caption --> B
            int close = s.indexOf("-->", end);
            if (close > end) {
                String caption = unquote(s.substring(end, close));
                if (!caption.isEmpty()) {
                    return new ArrowMatch(new FlowchartArrow(EdgeStyle.SOLID, ArrowCap.NONE, ArrowCap.ARROW, caption),
                            close + 3);
                }
            }
        }
        return null;
    }

    private static FlowchartArrow arrow(EdgeStyle style, ArrowCap endCap) {
        return new FlowchartArrow(style, ArrowCap.NONE, endCap, null);
    }

    private static int runEnd(String s, int start, char c) {
        int end = start;
        while (end < s.length() && s.charAt(end) == c) end++;
        return end;
    }

    private static int skipSpaces(String s, int start) {
        int i = start;
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
        return i;
    }

    /**
     * Node segments separated by link operators; {@code segments.size() == arrows.size() + 1}.
     */
    @Value
    public static class EdgeChain {
        List<String> segments;
        List<FlowchartArrow> arrows;
    }

    private static final class ArrowMatch {
        private final FlowchartArrow arrow;
        private final int end;

        private ArrowMatch(FlowchartArrow arrow, int end) {
            this.arrow = arrow;
            this.end = end;
        }
    }

    private static final class Delimiter {
        private final String open;
        private final String close;
        private final NodeShape shape;

        private Delimiter(String open, String close, NodeShape shape) {
            this.open = open;
            this.close = close;
            this.shape = shape;
        }
    }
}
