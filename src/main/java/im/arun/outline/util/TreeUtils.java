package im.arun.outline.util;

import im.arun.outline.model.Node;
import im.arun.outline.model.StructuralMeta;
import im.arun.outline.model.StructureKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Lookup, copy-on-write update and comparison helpers over node forests.
 */
public class TreeUtils {

    /**
     * A node together with where it sits in the forest.
     */
    @Value
    public static class NodeContext {
        Node node;
        Node parent;          // null for roots
        List<Node> siblings;  // the list that contains node
        int index;
    }

    /**
     * Pre-order summary of one node, for structural comparison.
     */
    @Value
    public static class FlatNode {
        String id;
        String text;
        String note;
        StructureKind kind;
        Integer level;
        Integer indentSpaces;
        String variant;
    }

    /**
     * Bidirectional mapping between 1-based source lines and node ids.
     */
    @Data
    @AllArgsConstructor
    public static class LineMapping {
        private Map<Integer, String> lineToNode;
        private Map<String, Integer> nodeToLine;
    }

    /**
     * Structural role summary of a single node.
     */
    @Value
    public static class StructureInfo {
        String type;
        int level;
        String originalMarker;
        boolean convertible;
    }

    public static StructureInfo describe(Node node) {
        StructuralMeta meta = node.getStructuralMeta();
        if (meta == null || meta.getKind() == null) {
            return new StructureInfo(node.isTableNode() ? "table" : "unknown", 0, "", false);
        }
        return new StructureInfo(
            meta.getKind().getWireName(),
            meta.getLevel(),
            meta.getOriginalMarker() != null ? meta.getOriginalMarker() : "",
            !meta.isPreface()
        );
    }

    public static Optional<NodeContext> findWithContext(List<Node> roots, String nodeId) {
        return findWithContext(roots, null, nodeId);
    }

    private static Optional<NodeContext> findWithContext(List<Node> nodes, Node parent, String nodeId) {
        if (nodes == null) {
            return Optional.empty();
        }
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            if (Objects.equals(node.getId(), nodeId)) {
                return Optional.of(new NodeContext(node, parent, nodes, i));
            }
            Optional<NodeContext> found = findWithContext(node.getChildren(), node, nodeId);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    public static Optional<Node> findById(List<Node> roots, String nodeId) {
        return findWithContext(roots, nodeId).map(NodeContext::getNode);
    }

    /**
     * First descendant of {@code node} (not the node itself) matching {@code predicate}, pre-order.
     */
    public static Optional<Node> findDescendant(Node node, Predicate<Node> predicate) {
        for (Node child : node.childrenOrEmpty()) {
            if (predicate.test(child)) {
                return Optional.of(child);
            }
            Optional<Node> found = findDescendant(child, predicate);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Replace the node with {@code nodeId} by {@code update.apply(node)}, copying only the
     * nodes on the path to it. Returns {@code nodes} itself when the id is absent.
     */
    public static List<Node> updateNode(List<Node> nodes, String nodeId, UnaryOperator<Node> update) {
        if (nodes == null) {
            return null;
        }
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            Node replacement = null;

            if (Objects.equals(node.getId(), nodeId)) {
                replacement = update.apply(node);
            } else if (node.hasChildren()) {
                List<Node> newChildren = updateNode(node.getChildren(), nodeId, update);
                if (newChildren != node.getChildren()) {
                    replacement = node.copy();
                    replacement.setChildren(newChildren);
                }
            }

            if (replacement != null) {
                List<Node> copy = new ArrayList<>(nodes);
                copy.set(i, replacement);
                return copy;
            }
        }
        return nodes;
    }

    public static List<FlatNode> flatten(List<Node> nodes) {
        List<FlatNode> flat = new ArrayList<>();
        flattenInto(nodes, flat);
        return flat;
    }

    private static void flattenInto(List<Node> nodes, List<FlatNode> flat) {
        if (nodes == null) {
            return;
        }
        for (Node n : nodes) {
            StructuralMeta meta = n.getStructuralMeta();
            flat.add(new FlatNode(
                n.getId(),
                n.getText() != null ? n.getText() : "",
                n.getNote(),
                meta != null ? meta.getKind() : null,
                meta != null ? meta.getLevel() : null,
                meta != null ? meta.getIndentSpaces() : null,
                n.getKind() != null ? n.getKind().getWireName() : null
            ));
            flattenInto(n.getChildren(), flat);
        }
    }

    /**
     * True when both flattened forests have the same shape: same length and, position by
     * position, the same kind, level and variant (and indent for list items). Text is ignored.
     */
    public static boolean isSameStructure(List<FlatNode> prev, List<FlatNode> next) {
        if (prev.size() != next.size()) {
            return false;
        }
        for (int i = 0; i < prev.size(); i++) {
            FlatNode a = prev.get(i);
            FlatNode b = next.get(i);
            if (a.getKind() != b.getKind()
                || !Objects.equals(a.getLevel(), b.getLevel())
                || !Objects.equals(a.getVariant(), b.getVariant())) {
                return false;
            }
            if (a.getKind() != null && a.getKind().isList()) {
                int ia = a.getIndentSpaces() != null ? a.getIndentSpaces() : 0;
                int ib = b.getIndentSpaces() != null ? b.getIndentSpaces() : 0;
                if (ia != ib) {
                    return false;
                }
            }
        }
        return true;
    }

    public static LineMapping buildLineMapping(List<Node> roots) {
        Map<Integer, String> lineToNode = new TreeMap<>();
        Map<String, Integer> nodeToLine = new LinkedHashMap<>();
        walkLines(roots, lineToNode, nodeToLine);
        return new LineMapping(lineToNode, nodeToLine);
    }

    private static void walkLines(List<Node> nodes, Map<Integer, String> lineToNode, Map<String, Integer> nodeToLine) {
        if (nodes == null) {
            return;
        }
        for (Node n : nodes) {
            StructuralMeta meta = n.getStructuralMeta();
            if (meta != null && meta.getSourceLine() >= 0 && n.getId() != null) {
                int line = meta.getSourceLine() + 1;
                lineToNode.put(line, n.getId());
                nodeToLine.put(n.getId(), line);
            }
            walkLines(n.getChildren(), lineToNode, nodeToLine);
        }
    }

    /**
     * Node on {@code line} (1-based), else the node on the nearest mapped line above it.
     */
    public static Optional<String> findNodeIdByLine(Map<Integer, String> lineToNode, int line) {
        if (lineToNode.containsKey(line)) {
            return Optional.of(lineToNode.get(line));
        }
        int bestLine = 0;
        for (Integer mapped : lineToNode.keySet()) {
            if (mapped <= line && mapped > bestLine) {
                bestLine = mapped;
            }
        }
        return bestLine > 0 ? Optional.of(lineToNode.get(bestLine)) : Optional.empty();
    }

    public static int countNodes(List<Node> nodes) {
        if (nodes == null) {
            return 0;
        }
        int count = 0;
        for (Node n : nodes) {
            count += 1 + countNodes(n.getChildren());
        }
        return count;
    }

    public static List<Node> emptyIfNull(List<Node> nodes) {
        return nodes != null ? nodes : Collections.emptyList();
    }
}
