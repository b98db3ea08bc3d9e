package com.architecture.memory.diagramsynth.service.diagram.parser;

import com.architecture.memory.diagramsynth.dto.diagram.DiagramError;
import com.architecture.memory.diagramsynth.model.diagram.ArrowCap;
import com.architecture.memory.diagramsynth.model.diagram.Diagram;
import com.architecture.memory.diagramsynth.model.diagram.DiagramType;
import com.architecture.memory.diagramsynth.model.diagram.Direction;
import com.architecture.memory.diagramsynth.model.diagram.Edge;
import com.architecture.memory.diagramsynth.model.diagram.Node;
import com.architecture.memory.diagramsynth.model.diagram.NodeShape;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented sequence diagram grammar.
 *
 * Participants get a column order by declaration or first appearance. Messages become edges in
 * document order. Notes, activations and block statements (loop, alt, opt, ...) are recognised
 * and dropped: block contents are flattened into the same message timeline.
 */
@Service
@Slf4j
public class SequenceParser {

    private static final Pattern HEADER = Pattern.compile("(?i)^sequenceDiagram$");
    private static final Pattern PARTICIPANT = Pattern.compile(
            "(?i)^(participant|actor)\\s+(\\S+?)(?:\\s+as\\s+(.+?))?$");
    private static final Pattern NOTE = Pattern.compile("(?i)^note\\b.*$");
    private static final Pattern ACTIVATION = Pattern.compile("(?i)^(activate|deactivate)\\s+\\S+$");
    private static final Pattern BLOCK_START = Pattern.compile("(?i)^(loop|rect|opt|alt|par|critical)\\b.*$");
    private static final Pattern BLOCK_BRANCH = Pattern.compile("(?i)^(else|and|option)\\b.*$");
    private static final Pattern BLOCK_END = Pattern.compile("(?i)^end$");
    private static final Pattern IGNORED = Pattern.compile("(?i)^(autonumber|title)\\b.*$");

    public ParseResult parse(String input) {
        Diagram diagram = new Diagram(DiagramType.SEQUENCE);
        diagram.setDirection(Direction.LR);

        Deque<String> blockStack = new ArrayDeque<>();
        boolean foundHeader = false;
        int nextOrder = 0;
        int messageIndex = 0;

        String[] lines = input == null ? new String[0] : input.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].trim();

            if (line.isEmpty() || line.startsWith("%%")) {
                continue;
            }
            if (HEADER.matcher(line).matches()) {
                foundHeader = true;
                continue;
            }

            Matcher participant = PARTICIPANT.matcher(line);
            if (participant.matches()) {
                boolean actor = participant.group(1).toLowerCase(Locale.ROOT).equals("actor");
                String id = participant.group(2);
                String label = participant.group(3) != null ? FlowchartTokenizer.unquote(participant.group(3)) : id;
                if (declare(diagram, id, label, actor, nextOrder)) {
                    nextOrder++;
                }
                continue;
            }

            if (NOTE.matcher(line).matches() || ACTIVATION.matcher(line).matches() || IGNORED.matcher(line).matches()) {
                continue;
            }

            Optional<SequenceMessage> parsed = SequenceMessage.parse(line);
            if (parsed.isPresent()) {
                SequenceMessage message = parsed.get();
                if (declare(diagram, message.getFrom(), message.getFrom(), false, nextOrder)) {
                    nextOrder++;
                }
                if (declare(diagram, message.getTo(), message.getTo(), false, nextOrder)) {
                    nextOrder++;
                }
                diagram.addEdge(Edge.builder()
                        .id("msg_" + messageIndex++)
                        .fromId(message.getFrom())
                        .toId(message.getTo())
                        .label(message.getText())
                        .style(message.getKind().getStyle())
                        .startCap(ArrowCap.NONE)
                        .endCap(message.getKind().getEndCap())
                        .activate(message.isActivate())
                        .deactivate(message.isDeactivate())
                        .build());
                continue;
            }

            if (BLOCK_START.matcher(line).matches()) {
                blockStack.push(line.split("\\s+")[0].toLowerCase(Locale.ROOT));
                continue;
            }
            if (BLOCK_BRANCH.matcher(line).matches()) {
                continue;
            }
            if (BLOCK_END.matcher(line).matches()) {
                if (!blockStack.isEmpty()) {
                    blockStack.pop();
                }
                continue;
            }

            log.debug("Skipping unrecognized sequence line {}", lineNumber);
            diagram.addWarning(DiagramError.syntaxError(lineNumber, line, "unrecognized sequence statement"));
        }

        if (!foundHeader) {
            return ParseResult.failure(DiagramError.missingSequenceHeader());
        }
        if (diagram.getNodes().isEmpty()) {
            return ParseResult.failure(DiagramError.noParticipants());
        }
        if (!blockStack.isEmpty()) {
            log.debug("Sequence diagram ended with {} unclosed blocks", blockStack.size());
        }

        log.debug("Parsed sequence diagram: {} participants, {} messages",
                diagram.getNodes().size(), diagram.getEdges().size());
        return ParseResult.success(diagram);
    }

    /**
     * Register a participant unless it is already known.
     *
     * @return true if a new participant took the given order
     */
    private boolean declare(Diagram diagram, String id, String label, boolean actor, int order) {
        return diagram.addNode(Node.builder()
                .id(id)
                .label(label)
                .shape(actor ? NodeShape.CIRCLE : NodeShape.RECTANGLE)
                .subgraphId("")
                .order(order)
                .build());
    }
}
