package im.arun.outline.model;

import lombok.Builder;
import lombok.Value;

/**
 * One structural element recognized by the lexer, with the raw lines that follow it.
 */
@Value
@Builder
public class StructureElement {
    StructureKind kind;
    int level;
    String text;
    String trailingContent;  // null when no line follows the element
    String originalMarker;
    Integer indentSpaces;    // list items only
    int sourceLine;
    boolean checkbox;
    boolean checked;
}
