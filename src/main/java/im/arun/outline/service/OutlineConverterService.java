package im.arun.outline.service;

import im.arun.outline.config.ConverterConfig;
import im.arun.outline.error.ConversionException;
import im.arun.outline.error.StructureError;
import im.arun.outline.error.StructureException;
import im.arun.outline.lexer.LexResult;
import im.arun.outline.lexer.StructureLexer;
import im.arun.outline.merge.LayoutPreservingMerge;
import im.arun.outline.model.Forest;
import im.arun.outline.model.Node;
import im.arun.outline.model.ParseOptions;
import im.arun.outline.model.StructureKind;
import im.arun.outline.mutation.IndentDirection;
import im.arun.outline.mutation.ListStyle;
import im.arun.outline.mutation.StructuralMutator;
import im.arun.outline.serialize.OutlineSerializer;
import im.arun.outline.table.TableExtractor;
import im.arun.outline.tree.HierarchyBuilder;
import im.arun.outline.tree.NodeFactory;
import im.arun.outline.util.TraceLog;
import im.arun.outline.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Entry point for the converter: parse, serialize, merge and structural edits.
 * Stateless apart from configuration, so one instance may serve concurrent callers.
 */
public class OutlineConverterService {
    private static final Logger logger = LoggerFactory.getLogger(OutlineConverterService.class);

    private final ConverterConfig config;
    private final StructureLexer lexer;
    private final HierarchyBuilder hierarchyBuilder;
    private final OutlineSerializer serializer;
    private final LayoutPreservingMerge merge;
    private final StructuralMutator mutator;

    public OutlineConverterService() {
        this(new ConverterConfig());
    }

    public OutlineConverterService(ConverterConfig config) {
        this.config = config;
        NodeFactory nodeFactory = new NodeFactory(config);
        this.lexer = new StructureLexer();
        this.hierarchyBuilder = new HierarchyBuilder(config, new TableExtractor(), nodeFactory);
        this.serializer = new OutlineSerializer();
        this.merge = new LayoutPreservingMerge(config, nodeFactory);
        this.mutator = new StructuralMutator();
    }

    public Forest parse(String text) throws StructureException {
        return parse(text, ParseOptions.defaults());
    }

    /**
     * Parse structured text into a forest.
     *
     * @throws StructureException when the text contains no heading and no list item
     */
    public Forest parse(String text, ParseOptions options) throws StructureException {
        ParseOptions effective = options != null ? options : ParseOptions.defaults();
        TraceLog trace = effective.getTrace();
        TraceLog.info(trace, "Starting parse", Map.of("length", text != null ? text.length() : 0));

        LexResult lexResult = lexer.lex(text, trace);
        if (lexResult.structuralCount() == 0) {
            TraceLog.warn(trace, "No structural elements", Map.of("lines", lexResult.getLineCount()));
            throw new StructureException(StructureError.NO_STRUCTURAL_ELEMENTS,
                "No heading or list item found in " + lexResult.getLineCount() + " lines");
        }

        Forest forest = hierarchyBuilder.build(lexResult, effective);
        logger.debug("Parsed {} elements into {} roots", lexResult.getElements().size(), forest.getRoots().size());
        return forest;
    }

    public String serialize(Forest forest) {
        return serializer.serialize(forest);
    }

    public String serializeNode(Node node) {
        return serializer.serializeNode(node);
    }

    public List<Node> mergePreservingLayout(List<Node> existing, List<Node> parsed, Node parent) {
        return merge.merge(existing, parsed, parent);
    }

    /**
     * Re-parse changed text and carry identity and layout over from {@code existing}.
     */
    public Forest reconcile(Forest existing, String text, ParseOptions options) throws StructureException {
        Forest parsed = parse(text, options);
        List<Node> existingRoots = existing != null ? existing.getRoots() : List.of();
        List<Node> merged = merge.merge(existingRoots, parsed.getRoots(), null);

        TraceLog.info(options != null ? options.getTrace() : null, "Reconciled with existing forest", Map.of(
            "existing_nodes", TreeUtils.countNodes(existingRoots),
            "merged_nodes", TreeUtils.countNodes(merged)
        ));
        return parsed.withRoots(merged);
    }

    public Forest changeNodeType(Forest forest, String nodeId, StructureKind newType) throws ConversionException {
        return mutator.changeNodeType(forest, nodeId, newType);
    }

    public Forest changeListStyle(Forest forest, String nodeId, ListStyle newStyle) {
        return mutator.changeListStyle(forest, nodeId, newStyle);
    }

    public Forest changeIndent(Forest forest, String nodeId, IndentDirection direction) {
        return mutator.changeIndent(forest, nodeId, direction);
    }

    public Forest renumberOrderedLists(Forest forest) {
        return mutator.renumberOrderedLists(forest);
    }

    public Forest updateNodeText(Forest forest, String nodeId, String newText) {
        return mutator.updateNodeText(forest, nodeId, newText);
    }

    /**
     * Whether a re-parse kept the same shape, ignoring text. Lets callers skip a full
     * merge when only content changed.
     */
    public boolean isSameStructure(Forest previous, Forest next) {
        return TreeUtils.isSameStructure(
            TreeUtils.flatten(previous.getRoots()),
            TreeUtils.flatten(next.getRoots()));
    }

    public TreeUtils.LineMapping buildLineMapping(Forest forest) {
        return TreeUtils.buildLineMapping(forest.getRoots());
    }

    public TreeUtils.StructureInfo describeNode(Node node) {
        return TreeUtils.describe(node);
    }

    public ConverterConfig getConfig() {
        return config;
    }
}
