package com.architecture.memory.diagramsynth.service.diagram.parser;

import com.architecture.memory.diagramsynth.model.diagram.ArrowCap;
import com.architecture.memory.diagramsynth.model.diagram.EdgeStyle;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * A message statement of a sequence diagram: {@code <from><arrow>[+|-]<to>: <text>}.
 */
@Value
public class SequenceMessage {

    public enum Kind {
        SYNC(EdgeStyle.SOLID, ArrowCap.ARROW),
        ASYNC(EdgeStyle.DOTTED, ArrowCap.ARROW),
        ASYNC_OPEN(EdgeStyle.DOTTED, ArrowCap.ARROW),
        CROSS(EdgeStyle.SOLID, ArrowCap.DIAMOND_CROSS);

        private final EdgeStyle style;
        private final ArrowCap endCap;

        Kind(EdgeStyle style, ArrowCap endCap) {
            this.style = style;
            this.endCap = endCap;
        }

        public EdgeStyle getStyle() {
            return style;
        }

        public ArrowCap getEndCap() {
            return endCap;
        }
    }

    private static final class ArrowToken {
        private final String text;
        private final Kind kind;

        private ArrowToken(String text, Kind kind) {
            this.text = text;
            this.kind = kind;
        }
    }

    // Longest operators first so that "-->>" is not read as "-->" followed by ">"
    private static final List<ArrowToken> ARROWS = List.of(
            new ArrowToken("-->>", Kind.ASYNC),
            new ArrowToken("->>", Kind.SYNC),
            new ArrowToken("--)", Kind.ASYNC_OPEN),
            new ArrowToken("--x", Kind.CROSS),
            new ArrowToken("-->", Kind.ASYNC),
            new ArrowToken("-)", Kind.ASYNC_OPEN),
            new ArrowToken("-x", Kind.CROSS),
            new ArrowToken("->", Kind.SYNC)
    );

    String from;
    String to;
    String text;
    Kind kind;
    boolean activate;
    boolean deactivate;

    /**
     * Tokenize a trimmed line as a message.
     *
     * @return empty when the line is not a message statement
     */
    public static Optional<SequenceMessage> parse(String line) {
        int colon = line.indexOf(':');
        if (colon < 0) {
            return Optional.empty();
        }
        String head = line.substring(0, colon);
        String text = line.substring(colon + 1).trim();

        for (int i = head.indexOf('-'); i > 0; i = head.indexOf('-', i + 1)) {
            String from = head.substring(0, i).trim();
            if (from.isEmpty() || containsWhitespace(from)) {
                return Optional.empty();
            }
            for (ArrowToken arrow : ARROWS) {
                if (!head.startsWith(arrow.text, i)) {
                    continue;
                }
                String rest = head.substring(i + arrow.text.length());
                boolean activate = rest.startsWith("+");
                boolean deactivate = rest.startsWith("-");
                if (activate || deactivate) {
                    rest = rest.substring(1);
                }
                String to = rest.trim();
                if (to.isEmpty() || containsWhitespace(to)) {
                    return Optional.empty();
                }
                return Optional.of(new SequenceMessage(from, to, text, arrow.kind, activate, deactivate));
            }
        }
        return Optional.empty();
    }

    private static boolean containsWhitespace(String value) {
        return FlowchartLineClassifier.indexOfWhitespace(value) >= 0;
    }
}
