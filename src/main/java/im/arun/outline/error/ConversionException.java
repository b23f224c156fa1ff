package im.arun.outline.error;

import im.arun.outline.model.StructureKind;

/**
 * A structural mutation was refused before anything was changed.
 */
public class ConversionException extends Exception {
    private final ConversionError error;
    private final String nodeId;
    private final String offendingNodeId;
    private final StructureKind requestedKind;

    public ConversionException(ConversionError error, String nodeId, String offendingNodeId, StructureKind requestedKind) {
        super(error + " converting node " + nodeId + " to " + requestedKind
            + (offendingNodeId != null ? " (conflicts with " + offendingNodeId + ")" : ""));
        this.error = error;
        this.nodeId = nodeId;
        this.offendingNodeId = offendingNodeId;
        this.requestedKind = requestedKind;
    }

    public ConversionError getError() {
        return error;
    }

    public String getNodeId() {
        return nodeId;
    }

    /**
     * The descendant, sibling or parent that blocks the change, when there is one.
     */
    public String getOffendingNodeId() {
        return offendingNodeId;
    }

    public StructureKind getRequestedKind() {
        return requestedKind;
    }
}
