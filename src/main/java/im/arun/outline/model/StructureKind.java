package im.arun.outline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Structural role of an element or node in the text document.
 */
public enum StructureKind {
    HEADING("heading"),
    UNORDERED_LIST("unordered-list"),
    ORDERED_LIST("ordered-list"),
    PREFACE("preface");

    private final String wireName;

    StructureKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isList() {
        return this == UNORDERED_LIST || this == ORDERED_LIST;
    }

    @JsonCreator
    public static StructureKind fromWireName(String value) {
        for (StructureKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown structure kind: " + value);
    }
}
