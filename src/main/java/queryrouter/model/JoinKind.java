package queryrouter.model;

/**
 * Join flavours a {@link PlanNode} of kind {@link PlanNodeKind#JOIN} can carry.
 */
public enum JoinKind {
    INNER,
    LEFT,
    RIGHT,
    FULL
}
