package im.arun.outline.error;

/**
 * User-facing wording for conversion and structure errors.
 */
public final class ConversionMessages {

    private ConversionMessages() {}

    public static String describe(ConversionException e) {
        switch (e.getError()) {
            case ILLEGAL_DESCENDANT:
                return "Cannot convert to a list item: the node contains a heading.";
            case ILLEGAL_SIBLING:
                return e.getRequestedKind() != null && e.getRequestedKind().isList()
                    ? "Cannot convert to a list item: a heading comes before it at the same level."
                    : "Cannot convert to a heading: a list item follows it at the same level.";
            case ILLEGAL_PARENT:
                return "Cannot convert to a heading: the parent node is a list item.";
            case UNSUPPORTED_NODE:
                return "Tables and preface text cannot change type.";
            case NODE_NOT_FOUND:
                return "The node no longer exists.";
            default:
                return e.getMessage();
        }
    }

    public static String describe(StructureException e) {
        if (e.getError() == StructureError.NO_STRUCTURAL_ELEMENTS) {
            return "No structure found. The document needs at least one heading or list item.";
        }
        return e.getMessage();
    }
}
