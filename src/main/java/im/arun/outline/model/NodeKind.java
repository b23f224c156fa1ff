package im.arun.outline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Variant tag of a node. A {@link #TABLE} node stores the raw table block as its text
 * and carries {@link TableData} instead of structural metadata.
 */
public enum NodeKind {
    PLAIN("plain"),
    TABLE("table");

    private final String wireName;

    NodeKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static NodeKind fromWireName(String value) {
        return "table".equalsIgnoreCase(value) ? TABLE : PLAIN;
    }
}
