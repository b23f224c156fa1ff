package im.arun.outline.merge;

import im.arun.outline.config.ConverterConfig;
import im.arun.outline.model.Node;
import im.arun.outline.model.NodeKind;
import im.arun.outline.tree.NodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconciles a freshly parsed sibling list against the nodes already in memory.
 * <p>
 * Each parsed node claims the first unclaimed existing sibling with identical text,
 * else the unclaimed existing sibling at the same index, else becomes a new node.
 * A claimed node keeps its id, cosmetics, note and table payload while text and
 * structural role come from the parse. Neither input list nor any node reachable from it is modified.
 */
public class LayoutPreservingMerge {
    private static final Logger logger = LoggerFactory.getLogger(LayoutPreservingMerge.class);

    private final ConverterConfig config;
    private final NodeFactory nodeFactory;

    public LayoutPreservingMerge(ConverterConfig config) {
        this(config, new NodeFactory(config));
    }

    public LayoutPreservingMerge(ConverterConfig config, NodeFactory nodeFactory) {
        this.config = config;
        this.nodeFactory = nodeFactory;
    }

    public List<Node> merge(List<Node> existing, List<Node> parsed, Node parent) {
        return merge(existing, parsed, parent, 0);
    }

    private List<Node> merge(List<Node> existing, List<Node> parsed, Node parent, int depth) {
        List<Node> existingNodes = existing != null ? existing : List.of();
        List<Node> parsedNodes = parsed != null ? parsed : List.of();

        if (depth > config.getMaxTreeDepth()) {
            logger.warn("Merge depth exceeded {}, keeping parsed subtree as-is", config.getMaxTreeDepth());
            return new ArrayList<>(parsedNodes);
        }

        SiblingClaims claims = new SiblingClaims(existingNodes);
        List<Node> result = new ArrayList<>(parsedNodes.size());

        for (int i = 0; i < parsedNodes.size(); i++) {
            Node p = parsedNodes.get(i);
            Node matched = claims.claimByText(p.getText());
            if (matched == null) {
                matched = claims.claimByIndex(i);
            }

            if (matched != null) {
                result.add(createMergedNode(p, matched, depth));
            } else {
                result.add(createNewNodeFromParsed(p, parent, i, depth));
            }
        }

        return result;
    }

    private Node createMergedNode(Node parsed, Node matched, int depth) {
        Node merged = clonePreservingLayout(parsed, matched);
        merged.setChildren(merge(matched.getChildren(), parsed.getChildren(), merged, depth + 1));
        return merged;
    }

    private Node createNewNodeFromParsed(Node parsed, Node parent, int index, int depth) {
        String lineEnding = parsed.getLineEnding() != null
            ? parsed.getLineEnding()
            : (parent != null ? parent.getLineEnding() : null);
        Node base = nodeFactory.createNode(parsed.getText(), lineEnding);

        if (parent != null) {
            base.setX(parent.getX() + config.getNewNodeOffset());
            base.setY(parent.getY() + index * config.getNewNodeOffset());
        }
        base.setNote(parsed.getNote());
        base.setStructuralMeta(parsed.getStructuralMeta());
        base.setKind(parsed.getKind());
        base.setTableData(parsed.getTableData());
        base.setCollapsed(parsed.getCollapsed());
        base.setChildren(merge(List.of(), parsed.getChildren(), base, depth + 1));
        return base;
    }

    /**
     * Identity and cosmetics from {@code source}, content and structure from {@code target}.
     */
    private Node clonePreservingLayout(Node target, Node source) {
        Node cloned = new Node();
        cloned.setId(source.getId());
        cloned.setText(target.getText());
        cloned.setX(source.getX());
        cloned.setY(source.getY());

        cloned.setFontSize(source.getFontSize());
        cloned.setFontFamily(source.getFontFamily());
        cloned.setFontWeight(source.getFontWeight());
        cloned.setFontStyle(source.getFontStyle());
        cloned.setColor(source.getColor());
        cloned.setCollapsed(source.getCollapsed());
        cloned.setNote(source.getNote());
        cloned.setLineEnding(target.getLineEnding() != null ? target.getLineEnding() : source.getLineEnding());

        cloned.setStructuralMeta(target.getStructuralMeta());
        cloned.setKind(target.getKind());
        if (target.getKind() == NodeKind.TABLE) {
            cloned.setTableData(source.getTableData() != null ? source.getTableData() : target.getTableData());
        }
        return cloned;
    }

    /**
     * Claim bookkeeping over one existing sibling list.
     */
    private static final class SiblingClaims {
        private final List<Node> existing;
        private final Map<String, List<Integer>> textIndex = new HashMap<>();
        private final Set<Integer> used = new HashSet<>();

        SiblingClaims(List<Node> existing) {
            this.existing = existing;
            for (int i = 0; i < existing.size(); i++) {
                textIndex.computeIfAbsent(existing.get(i).getText(), k -> new ArrayList<>()).add(i);
            }
        }

        Node claimByText(String text) {
            List<Integer> candidates = textIndex.get(text);
            if (candidates == null) {
                return null;
            }
            for (Integer idx : candidates) {
                if (used.add(idx)) {
                    return existing.get(idx);
                }
            }
            return null;
        }

        Node claimByIndex(int idx) {
            if (idx < 0 || idx >= existing.size() || !used.add(idx)) {
                return null;
            }
            return existing.get(idx);
        }
    }
}
