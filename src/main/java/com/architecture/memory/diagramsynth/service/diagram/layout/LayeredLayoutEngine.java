package com.architecture.memory.diagramsynth.service.diagram.layout;

import com.architecture.memory.diagramsynth.model.diagram.Diagram;
import com.architecture.memory.diagramsynth.model.diagram.Direction;
import com.architecture.memory.diagramsynth.model.diagram.Edge;
import com.architecture.memory.diagramsynth.model.diagram.SubGraph;
import com.architecture.memory.diagramsynth.model.layout.Bounds;
import com.architecture.memory.diagramsynth.model.layout.LayoutConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Layered graph drawing for flowcharts.
 *
 * Stages:
 * 1. Longest-path layering by BFS from the roots (in-degree 0, or the first node when every
 *    node has a predecessor). A node's layer never exceeds {@code nodeCount - 1}, which keeps
 *    cyclic input finite.
 * 2. Barycenter crossing reduction: four rounds of a forward sweep (mean predecessor position)
 *    followed by a backward sweep (mean successor position).
 * 3. Coordinates: layers are stacked along the flow axis, each layer centred against the widest.
 * 4. Bounds of the whole drawing and of every subgraph.
 *
 * Deterministic for a given diagram because nodes are visited in declaration order and
 * re-sorting is stable.
 */
@Service
@Slf4j
public class LayeredLayoutEngine {

    private static final int CROSSING_REDUCTION_ROUNDS = 4;

    public LaidOutDiagram layout(Diagram diagram, LayoutConfig config) {
        if (diagram.getNodes().isEmpty()) {
            return new LaidOutDiagram(diagram, Map.of(), Map.of(), Map.of(), List.of(), 0, 0, config.getPadding(), 0);
        }

        Adjacency adjacency = buildAdjacency(diagram);
        Map<String, Integer> layerOfNode = assignLayers(diagram, adjacency);
        TreeMap<Integer, List<String>> layers = groupByLayer(layerOfNode);

        orderLayers(layers, adjacency);

        Map<String, Bounds> nodeBounds = positionNodes(diagram.getDirection(), layers, config);
        Map<String, Bounds> subgraphBounds = computeSubgraphBounds(diagram, nodeBounds);

        Bounds total = null;
        for (Bounds bounds : nodeBounds.values()) {
            total = total == null ? bounds : total.union(bounds);
        }

        log.debug("Laid out flowchart: {} nodes in {} layers, {}x{}",
                nodeBounds.size(), layers.size(), total.getWidth(), total.getHeight());

        return new LaidOutDiagram(diagram, layerOfNode, nodeBounds, subgraphBounds, List.of(),
                total.getWidth(), total.getHeight(), config.getPadding(), 0);
    }

    // ========================= LAYERING =========================

    /**
     * Forward and backward adjacency over edges whose endpoints both resolve. Self-loops do not
     * take part in layering or ordering.
     */
    Adjacency buildAdjacency(Diagram diagram) {
        Adjacency adjacency = new Adjacency();
        for (String id : diagram.getNodes().keySet()) {
            adjacency.outgoing.put(id, new ArrayList<>());
            adjacency.incoming.put(id, new ArrayList<>());
        }
        for (Edge edge : diagram.resolvedEdges()) {
            if (edge.getFromId().equals(edge.getToId())) {
                continue;
            }
            adjacency.outgoing.get(edge.getFromId()).add(edge.getToId());
            adjacency.incoming.get(edge.getToId()).add(edge.getFromId());
        }
        return adjacency;
    }

    Map<String, Integer> assignLayers(Diagram diagram, Adjacency adjacency) {
        List<String> roots = new ArrayList<>();
        for (String id : diagram.getNodes().keySet()) {
            if (adjacency.incoming.get(id).isEmpty()) {
                roots.add(id);
            }
        }
        if (roots.isEmpty()) {
            roots.add(diagram.getNodes().keySet().iterator().next());
        }

        int maxLayer = diagram.getNodes().size() - 1;
        Map<String, Integer> layerOfNode = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String root : roots) {
            layerOfNode.put(root, 0);
            queue.add(root);
        }

        while (!queue.isEmpty()) {
            String id = queue.poll();
            int next = layerOfNode.get(id) + 1;
            if (next > maxLayer) {
                continue;
            }
            for (String successor : adjacency.outgoing.get(id)) {
                Integer existing = layerOfNode.get(successor);
                if (existing == null || existing < next) {
                    layerOfNode.put(successor, next);
                    queue.add(successor);
                }
            }
        }

        // Nodes no root reaches
        Map<String, Integer> ordered = new LinkedHashMap<>();
        for (String id : diagram.getNodes().keySet()) {
            ordered.put(id, layerOfNode.getOrDefault(id, 0));
        }
        return ordered;
    }

    private TreeMap<Integer, List<String>> groupByLayer(Map<String, Integer> layerOfNode) {
        TreeMap<Integer, List<String>> layers = new TreeMap<>();
        layerOfNode.forEach((id, layer) -> layers.computeIfAbsent(layer, k -> new ArrayList<>()).add(id));
        return layers;
    }

    // ========================= CROSSING REDUCTION =========================

    void orderLayers(TreeMap<Integer, List<String>> layers, Adjacency adjacency) {
        List<List<String>> ordered = new ArrayList<>(layers.values());
        Map<String, Double> position = new HashMap<>();
        for (List<String> layer : ordered) {
            renumber(layer, position);
        }

        for (int round = 0; round < CROSSING_REDUCTION_ROUNDS; round++) {
            for (int i = 1; i < ordered.size(); i++) {
                sweep(ordered.get(i), adjacency.incoming, position);
            }
            for (int i = ordered.size() - 2; i >= 0; i--) {
                sweep(ordered.get(i), adjacency.outgoing, position);
            }
        }
    }

    private void sweep(List<String> layer, Map<String, List<String>> neighbours, Map<String, Double> position) {
        for (String id : layer) {
            List<String> adjacent = neighbours.get(id);
            if (adjacent.isEmpty()) {
                continue;
            }
            double sum = 0;
            for (String other : adjacent) {
                sum += position.get(other);
            }
            position.put(id, sum / adjacent.size());
        }
        layer.sort(Comparator.comparingDouble(position::get));
        renumber(layer, position);
    }

    private void renumber(List<String> layer, Map<String, Double> position) {
        for (int i = 0; i < layer.size(); i++) {
            position.put(layer.get(i), (double) i);
        }
    }

    // ========================= COORDINATES =========================

    private Map<String, Bounds> positionNodes(Direction direction,
                                              TreeMap<Integer, List<String>> layers,
                                              LayoutConfig config) {
        boolean horizontal = direction.isHorizontal();
        boolean reversed = direction.isReversed();

        int widestLayer = 0;
        for (List<String> layer : layers.values()) {
            widestLayer = Math.max(widestLayer, layer.size());
        }

        double withinStride = horizontal
                ? config.getNodeHeight() + config.getNodeSpacingX()
                : config.getNodeWidth() + config.getNodeSpacingX();
        double layerStride = horizontal
                ? config.getNodeWidth() + config.getNodeSpacingY()
                : config.getNodeHeight() + config.getNodeSpacingY();

        Map<String, Bounds> bounds = new LinkedHashMap<>();
        int layerCount = layers.size();
        int index = 0;
        for (List<String> layer : layers.values()) {
            int layerIndex = reversed ? layerCount - 1 - index : index;
            double offset = (widestLayer - layer.size()) * withinStride / 2;

            for (int i = 0; i < layer.size(); i++) {
                double along = offset + i * withinStride;
                double across = layerIndex * layerStride;
                double x = config.getStartX() + (horizontal ? across : along);
                double y = config.getStartY() + (horizontal ? along : across);
                bounds.put(layer.get(i), new Bounds(x, y, config.getNodeWidth(), config.getNodeHeight()));
            }
            index++;
        }
        return bounds;
    }

    /**
     * Bounding box of each subgraph's resolvable members, including the members of nested
     * subgraphs. Subgraphs where nothing resolves are left out.
     */
    private Map<String, Bounds> computeSubgraphBounds(Diagram diagram, Map<String, Bounds> nodeBounds) {
        Map<String, List<String>> children = new HashMap<>();
        for (SubGraph subgraph : diagram.getSubgraphs().values()) {
            String parent = subgraph.getParentId();
            if (parent != null && !parent.isEmpty()) {
                children.computeIfAbsent(parent, k -> new ArrayList<>()).add(subgraph.getId());
            }
        }

        Map<String, Bounds> result = new LinkedHashMap<>();
        for (SubGraph subgraph : diagram.getSubgraphs().values()) {
            Bounds union = null;
            Set<String> visited = new HashSet<>();
            Deque<String> pending = new ArrayDeque<>();
            pending.add(subgraph.getId());

            while (!pending.isEmpty()) {
                String id = pending.poll();
                if (!visited.add(id)) {
                    continue;
                }
                SubGraph current = diagram.getSubgraphs().get(id);
                if (current == null) {
                    continue;
                }
                for (String member : current.getMemberNodeIds()) {
                    Bounds memberBounds = nodeBounds.get(member);
                    if (memberBounds != null) {
                        union = union == null ? memberBounds : union.union(memberBounds);
                    }
                }
                pending.addAll(children.getOrDefault(id, List.of()));
            }

            if (union != null) {
                result.put(subgraph.getId(), union);
            }
        }
        return result;
    }

    static final class Adjacency {
        final Map<String, List<String>> outgoing = new LinkedHashMap<>();
        final Map<String, List<String>> incoming = new LinkedHashMap<>();
    }
}
