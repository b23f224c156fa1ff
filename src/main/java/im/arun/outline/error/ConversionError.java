package im.arun.outline.error;

/**
 * Reasons a node type change is rejected.
 */
public enum ConversionError {
    /** Converting to a list item while the node has a heading descendant. */
    ILLEGAL_DESCENDANT,
    /** A heading among earlier siblings (to list) or a list item among later siblings (to heading). */
    ILLEGAL_SIBLING,
    /** Converting to a heading while the parent is a list item. */
    ILLEGAL_PARENT,
    /** Table and preface nodes have no convertible structural role. */
    UNSUPPORTED_NODE,
    NODE_NOT_FOUND
}
