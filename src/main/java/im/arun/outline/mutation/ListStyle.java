package im.arun.outline.mutation;

import im.arun.outline.model.StructureKind;

public enum ListStyle {
    UNORDERED(StructureKind.UNORDERED_LIST, "-"),
    ORDERED(StructureKind.ORDERED_LIST, "1.");

    private final StructureKind kind;
    private final String defaultMarker;

    ListStyle(StructureKind kind, String defaultMarker) {
        this.kind = kind;
        this.defaultMarker = defaultMarker;
    }

    public StructureKind getKind() {
        return kind;
    }

    public String getDefaultMarker() {
        return defaultMarker;
    }
}
