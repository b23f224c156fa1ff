package im.arun.outline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Structural role a node had in the source text (or was assigned later).
 * Immutable so that merged and mutated forests can share it safely.
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StructuralMeta {

    @JsonProperty("kind")
    StructureKind kind;

    @JsonProperty("level")
    int level;

    @JsonProperty("original_marker")
    String originalMarker;

    @JsonProperty("indent_spaces")
    Integer indentSpaces;

    @JsonProperty("source_line")
    int sourceLine;

    @JsonProperty("is_checkbox")
    boolean checkbox;

    @JsonProperty("is_checked")
    boolean checked;

    @JsonIgnore
    public int indentOrZero() {
        return indentSpaces != null ? indentSpaces : 0;
    }

    @JsonIgnore
    public boolean isHeading() {
        return kind == StructureKind.HEADING;
    }

    @JsonIgnore
    public boolean isList() {
        return kind != null && kind.isList();
    }

    @JsonIgnore
    public boolean isPreface() {
        return kind == StructureKind.PREFACE;
    }
}
