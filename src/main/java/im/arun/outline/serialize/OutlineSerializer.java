package im.arun.outline.serialize;

import im.arun.outline.lexer.LineEndings;
import im.arun.outline.model.Forest;
import im.arun.outline.model.Node;
import im.arun.outline.model.NodeKind;
import im.arun.outline.model.StructuralMeta;
import im.arun.outline.util.TraceLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Writes a node forest back to structured text.
 * <p>
 * Walks depth-first with an explicit stack, so forests of any depth serialize.
 * Never throws for a well-formed forest.
 */
public class OutlineSerializer {
    private static final Logger logger = LoggerFactory.getLogger(OutlineSerializer.class);
    private static final Pattern ORDERED_MARKER = Pattern.compile("^\\d+\\.$");

    private static final class Frame {
        final Node node;
        final boolean parentIsHeading;
        final int parentLevel;

        Frame(Node node, boolean parentIsHeading, int parentLevel) {
            this.node = node;
            this.parentIsHeading = parentIsHeading;
            this.parentLevel = parentLevel;
        }
    }

    public String serialize(Forest forest) {
        return serialize(forest, null);
    }

    public String serialize(Forest forest, TraceLog trace) {
        if (forest == null || forest.isEmpty()) {
            return "";
        }
        String lineEnding = resolveLineEnding(forest.getRoots(), forest.getLineEnding());
        List<String> lines = render(forest.getRoots());

        TraceLog.info(trace, "Serialized forest", Map.of(
            "roots", forest.getRoots().size(),
            "lines", lines.size()
        ));
        return String.join(lineEnding, lines);
    }

    public String serialize(List<Node> roots) {
        if (roots == null || roots.isEmpty()) {
            return "";
        }
        return String.join(resolveLineEnding(roots, null), render(roots));
    }

    /**
     * Text of a single subtree, rendered as if {@code node} were a root.
     */
    public String serializeNode(Node node) {
        if (node == null) {
            return "";
        }
        return serialize(List.of(node));
    }

    private List<String> render(List<Node> roots) {
        List<String> lines = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        pushChildren(stack, roots, false, 0);

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            Node node = frame.node;
            if (node == null) {
                continue;
            }

            NodeKind kind = node.getKind() != null ? node.getKind() : NodeKind.PLAIN;
            switch (kind) {
                case TABLE:
                    addLines(lines, node.getText());
                    addLines(lines, node.getNote());
                    pushChildren(stack, node.childrenOrEmpty(), false, frame.parentLevel + 1);
                    break;
                case PLAIN:
                default:
                    renderPlain(node, frame, lines, stack);
                    break;
            }
        }
        return lines;
    }

    private void renderPlain(Node node, Frame frame, List<String> lines, Deque<Frame> stack) {
        StructuralMeta meta = node.getStructuralMeta();
        String text = node.getText() != null ? node.getText() : "";

        if (meta == null || meta.getKind() == null) {
            lines.add(text);
            addLines(lines, node.getNote());
            pushChildren(stack, node.childrenOrEmpty(), false, frame.parentLevel + 1);
            return;
        }

        switch (meta.getKind()) {
            case PREFACE:
                // The preface is its note; its own text is always empty
                addLines(lines, node.getNote());
                pushChildren(stack, node.childrenOrEmpty(), false, 0);
                return;
            case HEADING:
                lines.add("#".repeat(clamp(meta.getLevel(), 1, 6)) + " " + text);
                break;
            case UNORDERED_LIST:
                lines.add(indent(meta, frame) + "- " + checkboxPrefix(meta) + text);
                break;
            case ORDERED_LIST:
                lines.add(indent(meta, frame) + orderedMarker(meta) + " " + text);
                break;
            default:
                lines.add(text);
                break;
        }

        addLines(lines, node.getNote());

        boolean heading = meta.isHeading();
        int childParentLevel = heading ? 0 : meta.indentOrZero() / 2 + 1;
        pushChildren(stack, node.childrenOrEmpty(), heading, childParentLevel);
    }

    private static void pushChildren(Deque<Frame> stack, List<Node> children, boolean parentIsHeading, int parentLevel) {
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(new Frame(children.get(i), parentIsHeading, parentLevel));
        }
    }

    private static String indent(StructuralMeta meta, Frame frame) {
        // Items directly under a heading always start at column 0
        int spaces = frame.parentIsHeading ? 0 : meta.indentOrZero();
        return " ".repeat(Math.max(spaces, 0));
    }

    private static String checkboxPrefix(StructuralMeta meta) {
        if (!meta.isCheckbox()) {
            return "";
        }
        return meta.isChecked() ? "[x] " : "[ ] ";
    }

    private static String orderedMarker(StructuralMeta meta) {
        String marker = meta.getOriginalMarker();
        if (marker != null && ORDERED_MARKER.matcher(marker).matches()) {
            return marker;
        }
        return "1.";
    }

    private static void addLines(List<String> lines, String block) {
        if (block != null) {
            lines.addAll(LineEndings.splitLines(block));
        }
    }

    private static String resolveLineEnding(List<Node> roots, String fallback) {
        String first = roots.get(0) != null ? roots.get(0).getLineEnding() : null;
        if (first != null && !first.isEmpty()) {
            return first;
        }
        if (fallback != null && !fallback.isEmpty()) {
            return fallback;
        }
        logger.debug("No line ending recorded, using LF");
        return LineEndings.DEFAULT;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
