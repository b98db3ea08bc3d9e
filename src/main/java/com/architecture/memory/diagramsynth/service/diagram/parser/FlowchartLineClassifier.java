package com.architecture.memory.diagramsynth.service.diagram.parser;

import java.util.regex.Pattern;

/**
 * Decides what kind of statement a trimmed flowchart line is, before any tokenizing.
 */
public final class FlowchartLineClassifier {

    public enum LineKind {
        BLANK,
        COMMENT,
        HEADER,
        SUBGRAPH_START,
        SUBGRAPH_END,
        STYLE,
        IGNORED_DIRECTIVE,  // classDef, class, click, linkStyle, direction
        EDGE_CHAIN,
        NODE
    }

    private static final Pattern HEADER = Pattern.compile("(?i)^(flowchart|graph)(\\s+.*)?$");
    private static final Pattern SUBGRAPH_START = Pattern.compile("(?i)^subgraph(\\s+.*)?$");
    private static final Pattern SUBGRAPH_END = Pattern.compile("(?i)^end$");
    private static final Pattern STYLE = Pattern.compile("(?i)^style\\s+\\S+\\s+.+$");
    private static final Pattern DIRECTIVE = Pattern.compile("(?i)^(classDef|class|click|linkStyle|direction)\\s+.*$");

    private FlowchartLineClassifier() {
    }

    /**
     * Classify a line that has already been trimmed and stripped of a trailing semicolon.
     */
    public static LineKind classify(String line) {
        if (line.isEmpty()) return LineKind.BLANK;
        if (line.startsWith("%%")) return LineKind.COMMENT;
        if (HEADER.matcher(line).matches()) return LineKind.HEADER;
        if (SUBGRAPH_START.matcher(line).matches()) return LineKind.SUBGRAPH_START;
        if (SUBGRAPH_END.matcher(line).matches()) return LineKind.SUBGRAPH_END;
        if (STYLE.matcher(line).matches()) return LineKind.STYLE;
        if (DIRECTIVE.matcher(line).matches()) return LineKind.IGNORED_DIRECTIVE;
        if (FlowchartTokenizer.splitChain(line).isPresent()) return LineKind.EDGE_CHAIN;
        return LineKind.NODE;
    }

    /**
     * Trim a raw line and drop one trailing statement separator.
     */
    public static String normalize(String rawLine) {
        String line = rawLine.trim();
        if (line.endsWith(";")) {
            line = line.substring(0, line.length() - 1).trim();
        }
        return line;
    }

    static String keywordArgument(String line) {
        int space = indexOfWhitespace(line);
        return space < 0 ? "" : line.substring(space).trim();
    }

    static int indexOfWhitespace(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) return i;
        }
        return -1;
    }
}
