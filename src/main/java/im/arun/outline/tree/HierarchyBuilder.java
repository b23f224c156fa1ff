package im.arun.outline.tree;

import im.arun.outline.config.ConverterConfig;
import im.arun.outline.lexer.LexResult;
import im.arun.outline.model.Forest;
import im.arun.outline.model.Node;
import im.arun.outline.model.ParseOptions;
import im.arun.outline.model.StructuralMeta;
import im.arun.outline.model.StructureElement;
import im.arun.outline.model.StructureKind;
import im.arun.outline.table.TableExtract;
import im.arun.outline.table.TableExtractor;
import im.arun.outline.util.TraceLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the node forest from the lexer's flat element list.
 * <p>
 * Headings nest by level, list items nest by indentation, and a new heading always
 * closes every open list. Tables found in an element's trailing text become sibling
 * table nodes placed right after that element.
 */
public class HierarchyBuilder {
    private static final Logger logger = LoggerFactory.getLogger(HierarchyBuilder.class);

    private final ConverterConfig config;
    private final TableExtractor tableExtractor;
    private final NodeFactory nodeFactory;

    public HierarchyBuilder(ConverterConfig config) {
        this(config, new TableExtractor(), new NodeFactory(config));
    }

    public HierarchyBuilder(ConverterConfig config, TableExtractor tableExtractor, NodeFactory nodeFactory) {
        this.config = config;
        this.tableExtractor = tableExtractor;
        this.nodeFactory = nodeFactory;
    }

    private static final class HeadingEntry {
        final Node node;
        final int level;

        HeadingEntry(Node node, int level) {
            this.node = node;
            this.level = level;
        }
    }

    private static final class ListEntry {
        final Node node;
        final int indentSpaces;

        ListEntry(Node node, int indentSpaces) {
            this.node = node;
            this.indentSpaces = indentSpaces;
        }
    }

    public Forest build(LexResult lexResult, ParseOptions options) {
        ParseOptions effective = options != null ? options : ParseOptions.defaults();
        TraceLog trace = effective.getTrace();
        String lineEnding = lexResult.getLineEnding();

        List<Node> roots = new ArrayList<>();
        Deque<HeadingEntry> headingStack = new ArrayDeque<>();
        Deque<ListEntry> listStack = new ArrayDeque<>();
        Node currentHeading = null;

        Map<String, Integer> headingLevelByText = new LinkedHashMap<>();
        Map<Node, Integer> headingDepths = new IdentityHashMap<>();
        boolean prefaceSeen = false;

        for (StructureElement element : lexResult.getElements()) {
            if (element.getKind() == StructureKind.PREFACE) {
                if (prefaceSeen) {
                    logger.warn("Ignoring second preface element at line {}", element.getSourceLine());
                    continue;
                }
                prefaceSeen = true;
                Node preface = nodeFactory.createNode("", lineEnding);
                preface.setNote(element.getText());
                preface.setStructuralMeta(StructuralMeta.builder()
                    .kind(StructureKind.PREFACE)
                    .level(0)
                    .originalMarker("")
                    .sourceLine(element.getSourceLine())
                    .build());
                // Preface always renders first, whenever it arrives
                roots.add(0, preface);
                attachTables(preface, roots, lineEnding, trace);
                continue;
            }

            Node node = createStructuralNode(element, lineEnding);
            List<Node> container;

            if (element.getKind() == StructureKind.HEADING) {
                while (!headingStack.isEmpty() && headingStack.peek().level >= element.getLevel()) {
                    headingStack.pop();
                }
                listStack.clear();

                container = headingStack.isEmpty() ? roots : headingStack.peek().node.getChildren();
                container.add(node);

                headingStack.push(new HeadingEntry(node, element.getLevel()));
                currentHeading = node;
                headingDepths.put(node, headingStack.size());
                headingLevelByText.putIfAbsent(element.getText(), element.getLevel());
            } else {
                int indent = element.getIndentSpaces() != null ? element.getIndentSpaces() : 0;
                while (!listStack.isEmpty() && listStack.peek().indentSpaces >= indent) {
                    listStack.pop();
                }
                while (listStack.size() >= config.getMaxNestingDepth()) {
                    logger.warn("List nesting deeper than {} at line {}, attaching as sibling",
                        config.getMaxNestingDepth(), element.getSourceLine());
                    listStack.pop();
                }

                if (!listStack.isEmpty()) {
                    container = listStack.peek().node.getChildren();
                } else if (currentHeading != null) {
                    container = currentHeading.getChildren();
                } else {
                    container = roots;
                }
                container.add(node);

                listStack.push(new ListEntry(node, indent));
            }

            attachTables(node, container, lineEnding, trace);
        }

        long structuralCount = lexResult.structuralCount();
        int collapseDepth = effective.getAutoCollapseDepth() != null
            ? effective.getAutoCollapseDepth()
            : config.getAutoCollapseDepth();
        if (structuralCount > config.getAutoCollapseThreshold()) {
            applyAutoCollapse(headingDepths, collapseDepth, trace);
        }

        TraceLog.info(trace, "Built node hierarchy", Map.of(
            "roots", roots.size(),
            "structural", structuralCount
        ));

        Forest forest = new Forest(roots);
        forest.setLineEnding(lineEnding);
        forest.setHeadingLevelByText(headingLevelByText);
        forest.setLayoutHints(effective.getLayoutHints());
        return forest;
    }

    private Node createStructuralNode(StructureElement element, String lineEnding) {
        Node node = nodeFactory.createNode(element.getText(), lineEnding);
        node.setNote(element.getTrailingContent());
        node.setStructuralMeta(StructuralMeta.builder()
            .kind(element.getKind())
            .level(element.getLevel())
            .originalMarker(element.getOriginalMarker())
            .indentSpaces(element.getIndentSpaces())
            .sourceLine(element.getSourceLine())
            .checkbox(element.isCheckbox())
            .checked(element.isChecked())
            .build());
        return node;
    }

    /**
     * Split tables out of {@code owner}'s note into sibling table nodes inserted right after it.
     * Text between two tables stays with the earlier table node.
     */
    private void attachTables(Node owner, List<Node> container, String lineEnding, TraceLog trace) {
        int insertAt = indexOfIdentity(container, owner) + 1;
        Node holder = owner;
        int extracted = 0;

        while (extracted < config.getMaxTablesPerNote()) {
            Optional<TableExtract> table = tableExtractor.extractFirstTable(holder.getNote(), lineEnding);
            if (table.isEmpty()) {
                break;
            }
            TableExtract extract = table.get();
            holder.setNote(extract.getBefore());

            Node tableNode = nodeFactory.createTableNode(extract, lineEnding);
            tableNode.setNote(extract.getAfter());
            container.add(insertAt++, tableNode);

            holder = tableNode;
            extracted++;
        }

        if (extracted > 0) {
            TraceLog.info(trace, "Split tables into sibling nodes", Map.of(
                "owner", owner.getText(),
                "tables", extracted
            ));
        }
        if (extracted >= config.getMaxTablesPerNote()) {
            logger.warn("Stopped splitting tables after {} in one note", extracted);
        }
    }

    private void applyAutoCollapse(Map<Node, Integer> headingDepths, int collapseDepth, TraceLog trace) {
        int collapsed = 0;
        for (Map.Entry<Node, Integer> entry : headingDepths.entrySet()) {
            Node heading = entry.getKey();
            if (entry.getValue() >= collapseDepth && heading.hasChildren()) {
                heading.setCollapsed(true);
                collapsed++;
            }
        }
        TraceLog.info(trace, "Auto-collapsed deep headings", Map.of(
            "collapse_depth", collapseDepth,
            "collapsed", collapsed
        ));
    }

    private static int indexOfIdentity(List<Node> nodes, Node target) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            if (nodes.get(i) == target) {
                return i;
            }
        }
        return nodes.size() - 1;
    }
}
