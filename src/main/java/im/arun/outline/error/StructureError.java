package im.arun.outline.error;

public enum StructureError {
    /** The document holds no heading and no list item. */
    NO_STRUCTURAL_ELEMENTS
}
