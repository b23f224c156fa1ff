package im.arun.outline.mutation;

public enum IndentDirection {
    INCREASE,
    DECREASE
}
