package im.arun.outline.tree;

import im.arun.outline.config.ConverterConfig;
import im.arun.outline.lexer.LineEndings;
import im.arun.outline.model.Node;
import im.arun.outline.model.NodeKind;
import im.arun.outline.model.TableData;
import im.arun.outline.table.TableExtract;

import java.util.UUID;

/**
 * Creates nodes with fresh ids and default cosmetics.
 */
public class NodeFactory {
    private final ConverterConfig config;

    public NodeFactory(ConverterConfig config) {
        this.config = config;
    }

    public static String newId() {
        return "node_" + UUID.randomUUID();
    }

    public Node createNode(String text, String lineEnding) {
        Node node = new Node();
        node.setId(newId());
        node.setText(text);
        node.setFontSize(config.getDefaultFontSize());
        node.setFontWeight(config.getDefaultFontWeight());
        node.setLineEnding(lineEnding != null ? lineEnding : LineEndings.DEFAULT);
        return node;
    }

    /**
     * Table node holding the raw block as text. Table nodes never carry structural meta.
     */
    public Node createTableNode(TableExtract extract, String lineEnding) {
        Node node = createNode(extract.getTableBlock(), lineEnding);
        node.setKind(NodeKind.TABLE);
        node.setTableData(TableData.builder()
            .headers(extract.getHeaders())
            .rows(extract.getRows())
            .build());
        return node;
    }
}
