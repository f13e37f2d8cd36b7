package queryrouter.model;

/**
 * Discriminant of a logical plan node.
 */
public enum PlanNodeKind {
    SCAN("Scan"),
    JOIN("Join"),
    AGGREGATION("Aggregation"),
    SORT("Sort"),
    LIMIT("Limit");

    private final String displayName;

    PlanNodeKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Number of children a node of this kind must have.
     */
    public int arity() {
        return this == SCAN ? 0 : 1;
    }
}
