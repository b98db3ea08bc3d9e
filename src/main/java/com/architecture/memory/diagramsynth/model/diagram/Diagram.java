package com.architecture.memory.diagramsynth.model.diagram;

import com.architecture.memory.diagramsynth.dto.diagram.DiagramError;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Root of the diagram IR produced by the parsers.
 *
 * Nodes and subgraphs are keyed by ID and kept in declaration order. Edges and subgraph
 * members store plain IDs, so a reference to an undeclared node is just a failed lookup.
 * Instances are built by one parser call and are not safe for concurrent mutation.
 */
@Getter
public class Diagram {

    private final DiagramType type;

    @Setter
    private Direction direction = Direction.TB;

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Map<String, SubGraph> subgraphs = new LinkedHashMap<>();
    private final List<DiagramError> warnings = new ArrayList<>();

    public Diagram(DiagramType type) {
        this.type = type;
    }

    /**
     * Register a node unless one with the same ID exists. The first definition wins.
     *
     * @return true if the node was added
     */
    public boolean addNode(Node node) {
        return nodes.putIfAbsent(node.getId(), node) == null;
    }

    public Optional<Node> findNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean hasNode(String id) {
        return id != null && nodes.containsKey(id);
    }

    public void addEdge(Edge edge) {
        edges.add(edge);
    }

    public void addSubGraph(SubGraph subGraph) {
        subgraphs.putIfAbsent(subGraph.getId(), subGraph);
    }

    public Optional<SubGraph> findSubGraph(String id) {
        return Optional.ofNullable(subgraphs.get(id));
    }

    public void addWarning(DiagramError warning) {
        warnings.add(warning);
    }

    public Map<String, Node> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public Map<String, SubGraph> getSubgraphs() {
        return Collections.unmodifiableMap(subgraphs);
    }

    public List<DiagramError> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * Edges whose both endpoints resolve to declared nodes.
     */
    public List<Edge> resolvedEdges() {
        List<Edge> resolved = new ArrayList<>();
        for (Edge edge : edges) {
            if (hasNode(edge.getFromId()) && hasNode(edge.getToId())) {
                resolved.add(edge);
            }
        }
        return resolved;
    }

    /**
     * Participants sorted by column order. Empty for flowcharts.
     */
    public List<Node> participantsInOrder() {
        List<Node> participants = new ArrayList<>();
        for (Node node : nodes.values()) {
            if (node.isParticipant()) participants.add(node);
        }
        participants.sort((a, b) -> Integer.compare(a.getOrder(), b.getOrder()));
        return participants;
    }
}
