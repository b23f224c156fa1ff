package im.arun.outline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A node of the outline forest.
 * Structural content (text, note, meta, variant) comes from the parser; the cosmetic
 * fields belong to the layout/UI layer and are carried through untouched.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Node {

    @JsonProperty("id")
    private String id;

    @JsonProperty("text")
    private String text;

    @JsonProperty("children")
    private List<Node> children = new ArrayList<>();

    @JsonProperty("note")
    private String note;

    @JsonProperty("structural_meta")
    private StructuralMeta structuralMeta;

    @JsonProperty("kind")
    private NodeKind kind = NodeKind.PLAIN;

    @JsonProperty("table_data")
    private TableData tableData;

    // Cosmetic fields
    @JsonProperty("x")
    private double x;

    @JsonProperty("y")
    private double y;

    @JsonProperty("font_size")
    private Integer fontSize;

    @JsonProperty("font_weight")
    private String fontWeight;

    @JsonProperty("font_family")
    private String fontFamily;

    @JsonProperty("font_style")
    private String fontStyle;

    @JsonProperty("color")
    private String color;

    @JsonProperty("collapsed")
    private Boolean collapsed;

    @JsonProperty("line_ending")
    private String lineEnding;

    /**
     * Shallow copy: same field values, fresh children list holding the same child references.
     */
    public Node copy() {
        Node copy = new Node();
        copy.id = id;
        copy.text = text;
        copy.children = new ArrayList<>(children != null ? children : List.of());
        copy.note = note;
        copy.structuralMeta = structuralMeta;
        copy.kind = kind;
        copy.tableData = tableData;
        copy.x = x;
        copy.y = y;
        copy.fontSize = fontSize;
        copy.fontWeight = fontWeight;
        copy.fontFamily = fontFamily;
        copy.fontStyle = fontStyle;
        copy.color = color;
        copy.collapsed = collapsed;
        copy.lineEnding = lineEnding;
        return copy;
    }

    @JsonIgnore
    public List<Node> childrenOrEmpty() {
        return children != null ? children : List.of();
    }

    @JsonIgnore
    public boolean hasChildren() {
        return children != null && !children.isEmpty();
    }

    @JsonIgnore
    public boolean isTableNode() {
        return kind == NodeKind.TABLE;
    }

    @JsonIgnore
    public boolean isHeadingNode() {
        return structuralMeta != null && structuralMeta.isHeading();
    }

    @JsonIgnore
    public boolean isListNode() {
        return structuralMeta != null && structuralMeta.isList();
    }

    @JsonIgnore
    public boolean isPrefaceNode() {
        return structuralMeta != null && structuralMeta.isPreface();
    }
}
