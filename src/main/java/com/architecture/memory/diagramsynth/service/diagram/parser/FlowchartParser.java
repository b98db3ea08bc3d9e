package com.architecture.memory.diagramsynth.service.diagram.parser;

import com.architecture.memory.diagramsynth.dto.diagram.DiagramError;
import com.architecture.memory.diagramsynth.model.diagram.Diagram;
import com.architecture.memory.diagramsynth.model.diagram.DiagramType;
import com.architecture.memory.diagramsynth.model.diagram.Direction;
import com.architecture.memory.diagramsynth.model.diagram.Edge;
import com.architecture.memory.diagramsynth.model.diagram.Node;
import com.architecture.memory.diagramsynth.model.diagram.SubGraph;
import com.architecture.memory.diagramsynth.service.diagram.parser.FlowchartTokenizer.EdgeChain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Line-oriented flowchart grammar.
 *
 * Parsing is tolerant: statements that cannot be understood are skipped and recorded as
 * warnings on the diagram instead of failing the whole document. Only a document without any
 * node fails.
 */
@Service
@Slf4j
public class FlowchartParser {

    private static final Pattern LEADING_NODE_ID = Pattern.compile("^[A-Za-z0-9_]+\\s*[\\[({>].*$");

    public ParseResult parse(String input) {
        Diagram diagram = new Diagram(DiagramType.FLOWCHART);
        Deque<String> subgraphStack = new ArrayDeque<>();
        Map<String, String> fills = new LinkedHashMap<>();
        String currentSubgraph = "";

        String[] lines = input == null ? new String[0] : input.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = FlowchartLineClassifier.normalize(lines[i]);

            switch (FlowchartLineClassifier.classify(line)) {
                case BLANK, COMMENT, IGNORED_DIRECTIVE -> {
                    // nothing to record
                }
                case HEADER -> applyHeader(diagram, line, lineNumber);
                case SUBGRAPH_START -> {
                    String id = openSubgraph(diagram, line, currentSubgraph);
                    subgraphStack.push(currentSubgraph);
                    currentSubgraph = id;
                }
                case SUBGRAPH_END -> currentSubgraph = subgraphStack.isEmpty() ? "" : subgraphStack.pop();
                case STYLE -> collectFill(line, fills);
                case EDGE_CHAIN -> parseChain(diagram, line, lineNumber, currentSubgraph);
                case NODE -> parseNodeStatement(diagram, line, lineNumber, currentSubgraph);
            }
        }

        if (diagram.getNodes().isEmpty()) {
            log.debug("Flowchart produced no nodes from {} lines", lines.length);
            return ParseResult.failure(DiagramError.noNodes());
        }

        fills.forEach((id, color) -> diagram.findNode(id).ifPresent(node -> node.setColor(color)));

        log.debug("Parsed flowchart: {} nodes, {} edges, {} subgraphs, {} warnings",
                diagram.getNodes().size(), diagram.getEdges().size(),
                diagram.getSubgraphs().size(), diagram.getWarnings().size());
        return ParseResult.success(diagram);
    }

    private void applyHeader(Diagram diagram, String line, int lineNumber) {
        String argument = FlowchartLineClassifier.keywordArgument(line);
        if (argument.isEmpty()) {
            diagram.setDirection(Direction.TB);
            return;
        }
        String keyword = argument.split("\\s+")[0];
        Direction direction = Direction.fromKeyword(keyword);
        if (direction == null) {
            diagram.addWarning(DiagramError.syntaxError(lineNumber, line, "unknown direction '" + keyword + "'"));
            direction = Direction.TB;
        }
        diagram.setDirection(direction);
    }

    /**
     * Register the subgraph a {@code subgraph} line opens and return its ID.
     */
    private String openSubgraph(Diagram diagram, String line, String parentId) {
        String argument = FlowchartLineClassifier.keywordArgument(line);
        String id;
        String label;

        if (argument.isEmpty()) {
            id = "subgraph_" + (diagram.getSubgraphs().size() + 1);
            label = "";
        } else if (argument.startsWith("\"") || argument.startsWith("'")) {
            label = FlowchartTokenizer.unquote(argument);
            id = label.replaceAll("\\s+", "_");
        } else {
            int end = 0;
            while (end < argument.length()
                    && !Character.isWhitespace(argument.charAt(end))
                    && argument.charAt(end) != '[') {
                end++;
            }
            id = argument.substring(0, end);
            String remainder = argument.substring(end).trim();
            if (remainder.startsWith("[") && remainder.endsWith("]")) {
                label = FlowchartTokenizer.unquote(remainder.substring(1, remainder.length() - 1));
            } else if (!remainder.isEmpty()) {
                label = FlowchartTokenizer.unquote(remainder);
            } else {
                label = id;
            }
        }

        diagram.addSubGraph(SubGraph.builder()
                .id(id)
                .label(label)
                .parentId(parentId)
                .build());
        return id;
    }

    private void collectFill(String line, Map<String, String> fills) {
        String argument = FlowchartLineClassifier.keywordArgument(line);
        int split = FlowchartLineClassifier.indexOfWhitespace(argument);
        String nodeId = argument.substring(0, split);
        for (String property : argument.substring(split).trim().split(",")) {
            String[] keyValue = property.split(":", 2);
            if (keyValue.length == 2 && keyValue[0].trim().toLowerCase(Locale.ROOT).equals("fill")) {
                fills.put(nodeId, keyValue[1].trim());
            }
        }
    }

    private void parseChain(Diagram diagram, String line, int lineNumber, String subgraph) {
        Optional<EdgeChain> parsed = FlowchartTokenizer.splitChain(line);
        if (parsed.isEmpty()) {
            return;
        }
        EdgeChain chain = parsed.get();
        List<String> segments = chain.getSegments();
        String previousId = null;

        for (int k = 0; k < segments.size(); k++) {
            String segment = segments.get(k);
            Optional<NodeReference> reference = FlowchartTokenizer.parseNode(segment);
            if (reference.isEmpty()) {
                diagram.addWarning(LEADING_NODE_ID.matcher(segment).matches()
                        ? DiagramError.invalidShape(lineNumber, segment)
                        : DiagramError.invalidEdge(lineNumber, line));
                previousId = null;
                continue;
            }

            NodeReference node = reference.get();
            attachNode(diagram, node, subgraph);

            if (previousId != null) {
                FlowchartArrow arrow = chain.getArrows().get(k - 1);
                diagram.addEdge(Edge.builder()
                        .id(String.format("edge_%d_%s_%s", diagram.getEdges().size(), previousId, node.getId()))
                        .fromId(previousId)
                        .toId(node.getId())
                        .label(arrow.getLabel())
                        .style(arrow.getStyle())
                        .startCap(arrow.getStartCap())
                        .endCap(arrow.getEndCap())
                        .build());
            }
            previousId = node.getId();
        }
    }

    private void parseNodeStatement(Diagram diagram, String line, int lineNumber, String subgraph) {
        Optional<NodeReference> reference = FlowchartTokenizer.parseNode(line);
        if (reference.isPresent()) {
            attachNode(diagram, reference.get(), subgraph);
            return;
        }

        log.debug("Skipping unrecognized flowchart line {}", lineNumber);
        diagram.addWarning(LEADING_NODE_ID.matcher(line).matches()
                ? DiagramError.invalidShape(lineNumber, line)
                : DiagramError.syntaxError(lineNumber, line, "unrecognized statement"));
    }

    /**
     * Create the node on first sight and file it under the open subgraph. Later
     * definitions of the same ID are ignored.
     */
    private void attachNode(Diagram diagram, NodeReference reference, String subgraph) {
        Node node = Node.builder()
                .id(reference.getId())
                .label(reference.getLabel())
                .shape(reference.getShape())
                .subgraphId(subgraph)
                .build();

        if (diagram.addNode(node) && !subgraph.isEmpty()) {
            diagram.findSubGraph(subgraph).ifPresent(sg -> sg.getMemberNodeIds().add(node.getId()));
        }
    }
}
