package im.arun.outline.mutation;

import im.arun.outline.error.ConversionError;
import im.arun.outline.error.ConversionException;
import im.arun.outline.model.Forest;
import im.arun.outline.model.Node;
import im.arun.outline.model.StructuralMeta;
import im.arun.outline.model.StructureKind;
import im.arun.outline.util.TreeUtils;
import im.arun.outline.util.TreeUtils.NodeContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Tree rewrites driven by the UI: type, list style, indent, numbering and text changes.
 * <p>
 * Every operation returns a new forest and leaves its argument untouched; only the nodes
 * on the path to the change are copied. Out-of-range levels and indents are clamped.
 */
public class StructuralMutator {
    private static final Logger logger = LoggerFactory.getLogger(StructuralMutator.class);

    private static final int MIN_HEADING_LEVEL = 1;
    private static final int MAX_HEADING_LEVEL = 6;
    private static final int INDENT_STEP = 2;

    private static final Pattern HEADING_MARKER = Pattern.compile("^#+\\s+");
    private static final Pattern BULLET_MARKER = Pattern.compile("^\\s*[-*+]\\s+");
    private static final Pattern NUMBER_MARKER = Pattern.compile("^\\s*\\d+\\.\\s+");

    /**
     * Turn a node into a heading or a list item.
     *
     * @throws ConversionException when the change would break heading/list ordering;
     *                             the forest is not modified in that case
     */
    public Forest changeNodeType(Forest forest, String nodeId, StructureKind newType) throws ConversionException {
        if (newType == null || newType == StructureKind.PREFACE) {
            throw new IllegalArgumentException("Target type must be a heading or a list kind: " + newType);
        }

        NodeContext context = TreeUtils.findWithContext(forest.getRoots(), nodeId)
            .orElseThrow(() -> new ConversionException(ConversionError.NODE_NOT_FOUND, nodeId, null, newType));
        Node target = context.getNode();

        if (target.isTableNode() || target.isPrefaceNode()) {
            throw new ConversionException(ConversionError.UNSUPPORTED_NODE, nodeId, null, newType);
        }

        // Nodes without meta were created in the UI and have no ordering to protect
        if (target.getStructuralMeta() != null) {
            if (newType.isList()) {
                checkConvertibleToList(context, newType);
            } else {
                checkConvertibleToHeading(context, newType);
            }
        }

        Node parent = context.getParent();
        List<Node> roots = TreeUtils.updateNode(forest.getRoots(), nodeId, node -> retype(node, parent, newType));
        logger.debug("Changed node {} to {}", nodeId, newType);
        return forest.withRoots(roots);
    }

    private void checkConvertibleToList(NodeContext context, StructureKind newType) throws ConversionException {
        Node target = context.getNode();
        Optional<Node> headingDescendant = TreeUtils.findDescendant(target, Node::isHeadingNode);
        if (headingDescendant.isPresent()) {
            throw new ConversionException(ConversionError.ILLEGAL_DESCENDANT,
                target.getId(), headingDescendant.get().getId(), newType);
        }

        // Earlier siblings only: later ones cannot be affected
        List<Node> siblings = context.getSiblings();
        for (int i = 0; i < context.getIndex(); i++) {
            if (siblings.get(i).isHeadingNode()) {
                throw new ConversionException(ConversionError.ILLEGAL_SIBLING,
                    target.getId(), siblings.get(i).getId(), newType);
            }
        }
    }

    private void checkConvertibleToHeading(NodeContext context, StructureKind newType) throws ConversionException {
        Node target = context.getNode();
        List<Node> siblings = context.getSiblings();
        for (int i = context.getIndex() + 1; i < siblings.size(); i++) {
            if (siblings.get(i).isListNode()) {
                throw new ConversionException(ConversionError.ILLEGAL_SIBLING,
                    target.getId(), siblings.get(i).getId(), newType);
            }
        }

        Node parent = context.getParent();
        if (parent != null && parent.isListNode()) {
            throw new ConversionException(ConversionError.ILLEGAL_PARENT,
                target.getId(), parent.getId(), newType);
        }
    }

    private Node retype(Node node, Node parent, StructureKind newType) {
        StructuralMeta current = node.getStructuralMeta() != null
            ? node.getStructuralMeta()
            : StructuralMeta.builder()
                .kind(StructureKind.HEADING)
                .level(MIN_HEADING_LEVEL)
                .originalMarker("#")
                .indentSpaces(0)
                .sourceLine(0)
                .build();

        StructuralMeta newMeta;
        if (newType == StructureKind.HEADING) {
            int level;
            if (parent != null && parent.isHeadingNode()) {
                level = Math.min(parent.getStructuralMeta().getLevel() + 1, MAX_HEADING_LEVEL);
            } else {
                level = clamp(current.getLevel(), MIN_HEADING_LEVEL, MAX_HEADING_LEVEL);
            }
            newMeta = StructuralMeta.builder()
                .kind(StructureKind.HEADING)
                .level(level)
                .originalMarker("#".repeat(level))
                .indentSpaces(0)
                .sourceLine(current.getSourceLine())
                .build();
        } else {
            int level = 1;
            if (parent != null && parent.isListNode()) {
                level = Math.max(parent.getStructuralMeta().getLevel() + 1, 1);
            }
            newMeta = StructuralMeta.builder()
                .kind(newType)
                .level(level)
                .originalMarker(newType == StructureKind.ORDERED_LIST ? "1." : "-")
                .indentSpaces((level - 1) * INDENT_STEP)
                .sourceLine(current.getSourceLine())
                .build();
        }

        Node updated = node.copy();
        updated.setText(stripMarkers(node.getText()));
        updated.setStructuralMeta(newMeta);

        // Child items follow the new position so that the text re-parses into the same tree
        int childIndent = newMeta.isHeading() ? 0 : newMeta.indentOrZero() + INDENT_STEP;
        int childLevel = newMeta.isHeading() ? 1 : newMeta.getLevel() + 1;
        updated.setChildren(reindentListChildren(updated.getChildren(), childIndent, childLevel));
        return updated;
    }

    /**
     * Switch a list item between bulleted and numbered. Non-list nodes are left as they are.
     */
    public Forest changeListStyle(Forest forest, String nodeId, ListStyle newStyle) {
        List<Node> roots = TreeUtils.updateNode(forest.getRoots(), nodeId, node -> {
            if (!node.isListNode()) {
                logger.debug("Node {} is not a list item, list style unchanged", nodeId);
                return node;
            }
            StructuralMeta meta = node.getStructuralMeta().toBuilder()
                .kind(newStyle.getKind())
                .originalMarker(newStyle.getDefaultMarker())
                .checkbox(newStyle == ListStyle.UNORDERED && node.getStructuralMeta().isCheckbox())
                .checked(newStyle == ListStyle.UNORDERED && node.getStructuralMeta().isChecked())
                .build();
            Node updated = node.copy();
            updated.setStructuralMeta(meta);
            return updated;
        });
        return forest.withRoots(roots);
    }

    /**
     * Heading level or list indentation one step deeper or shallower.
     * Headings stay within 1..6, list indentation never goes below zero.
     */
    public Forest changeIndent(Forest forest, String nodeId, IndentDirection direction) {
        List<Node> roots = TreeUtils.updateNode(forest.getRoots(), nodeId, node -> {
            StructuralMeta meta = node.getStructuralMeta();
            if (meta == null || meta.isPreface()) {
                return node;
            }
            Node updated = node.copy();

            if (meta.isHeading()) {
                int level = meta.getLevel();
                if (direction == IndentDirection.INCREASE && level < MAX_HEADING_LEVEL) {
                    level++;
                } else if (direction == IndentDirection.DECREASE && level > MIN_HEADING_LEVEL) {
                    level--;
                }
                level = clamp(level, MIN_HEADING_LEVEL, MAX_HEADING_LEVEL);
                updated.setStructuralMeta(meta.toBuilder()
                    .level(level)
                    .originalMarker("#".repeat(level))
                    .build());
                return updated;
            }

            int indent = meta.indentOrZero();
            int level = meta.getLevel();
            if (direction == IndentDirection.INCREASE) {
                indent += INDENT_STEP;
                level++;
            } else if (indent >= INDENT_STEP) {
                indent -= INDENT_STEP;
                level--;
            }
            updated.setStructuralMeta(meta.toBuilder()
                .indentSpaces(indent)
                .level(Math.max(level, 1))
                .build());
            updated.setChildren(reindentListChildren(updated.getChildren(), indent + INDENT_STEP, Math.max(level, 1) + 1));
            return updated;
        });
        return forest.withRoots(roots);
    }

    /**
     * Number every run of consecutive numbered siblings 1, 2, 3, ...; anything else between
     * two numbered items restarts the count.
     */
    public Forest renumberOrderedLists(Forest forest) {
        return forest.withRoots(renumber(forest.getRoots()));
    }

    private List<Node> renumber(List<Node> nodes) {
        List<Node> result = new ArrayList<>();
        int counter = 1;

        for (Node node : TreeUtils.emptyIfNull(nodes)) {
            Node updated = node.copy();
            StructuralMeta meta = node.getStructuralMeta();

            if (meta != null && meta.getKind() == StructureKind.ORDERED_LIST) {
                updated.setStructuralMeta(meta.withOriginalMarker(counter + "."));
                counter++;
            } else {
                counter = 1;
            }

            updated.setChildren(renumber(node.getChildren()));
            result.add(updated);
        }
        return result;
    }

    public Forest updateNodeText(Forest forest, String nodeId, String newText) {
        List<Node> roots = TreeUtils.updateNode(forest.getRoots(), nodeId, node -> {
            Node updated = node.copy();
            updated.setText(newText);
            return updated;
        });
        return forest.withRoots(roots);
    }

    /**
     * Copies of {@code children} with every list item placed at {@code indent}, and their
     * own list children one step further in, recursively. Other nodes are kept as they are.
     */
    private List<Node> reindentListChildren(List<Node> children, int indent, int level) {
        List<Node> result = new ArrayList<>();
        for (Node child : TreeUtils.emptyIfNull(children)) {
            if (!child.isListNode()) {
                result.add(child);
                continue;
            }
            Node moved = child.copy();
            moved.setStructuralMeta(child.getStructuralMeta().toBuilder()
                .indentSpaces(indent)
                .level(level)
                .build());
            moved.setChildren(reindentListChildren(child.getChildren(), indent + INDENT_STEP, level + 1));
            result.add(moved);
        }
        return result;
    }

    static String stripMarkers(String text) {
        if (text == null) {
            return "";
        }
        String stripped = HEADING_MARKER.matcher(text).replaceFirst("");
        stripped = BULLET_MARKER.matcher(stripped).replaceFirst("");
        return NUMBER_MARKER.matcher(stripped).replaceFirst("");
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
