package queryrouter.model;

import io.micronaut.core.annotation.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable node of a logical query plan.
 * A SCAN is always a leaf; every other kind wraps exactly one inner plan.
 */
public final class PlanNode {

    private final PlanNodeKind kind;
    private final JoinKind joinKind;
    private final List<PlanNode> children;
    private final Map<String, String> attributes;

    private PlanNode(
            PlanNodeKind kind,
            @Nullable JoinKind joinKind,
            List<PlanNode> children,
            @Nullable Map<String, String> attributes) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (children.size() != kind.arity()) {
            throw new IllegalArgumentException(
                    kind.displayName() + " node requires " + kind.arity() + " child(ren), got " + children.size());
        }
        if ((kind == PlanNodeKind.JOIN) != (joinKind != null)) {
            throw new IllegalArgumentException("Join kind is required for JOIN nodes only");
        }
        this.joinKind = joinKind;
        this.children = List.copyOf(children);
        this.attributes = attributes == null || attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Creates a table scan leaf.
     *
     * @param attributes scan details such as {@code table} and {@code filter}
     * @return a SCAN node
     */
    public static PlanNode scan(@Nullable Map<String, String> attributes) {
        return new PlanNode(PlanNodeKind.SCAN, null, List.of(), attributes);
    }

    public static PlanNode join(JoinKind joinKind, PlanNode input, @Nullable Map<String, String> attributes) {
        Objects.requireNonNull(joinKind, "joinKind");
        return new PlanNode(PlanNodeKind.JOIN, joinKind, List.of(input), attributes);
    }

    public static PlanNode aggregation(PlanNode input, @Nullable Map<String, String> attributes) {
        return new PlanNode(PlanNodeKind.AGGREGATION, null, List.of(input), attributes);
    }

    public static PlanNode sort(PlanNode input, @Nullable Map<String, String> attributes) {
        return new PlanNode(PlanNodeKind.SORT, null, List.of(input), attributes);
    }

    public static PlanNode limit(PlanNode input, @Nullable Map<String, String> attributes) {
        return new PlanNode(PlanNodeKind.LIMIT, null, List.of(input), attributes);
    }

    /**
     * Returns a copy of this node with one attribute added or replaced.
     * Children are shared, which is safe because every node is immutable.
     */
    public PlanNode withAttribute(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(attributes);
        copy.put(key, value);
        return new PlanNode(kind, joinKind, children, copy);
    }

    public PlanNodeKind getKind() {
        return kind;
    }

    /**
     * @return the join flavour, or {@code null} when this is not a JOIN node
     */
    @Nullable
    public JoinKind getJoinKind() {
        return joinKind;
    }

    public List<PlanNode> getChildren() {
        return children;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    @Nullable
    public String getAttribute(String key) {
        return attributes.get(key);
    }

    /**
     * Whether this node or any node below it has the given kind.
     */
    public boolean contains(PlanNodeKind candidate) {
        if (kind == candidate) {
            return true;
        }
        for (PlanNode child : children) {
            if (child.contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PlanNode other)) {
            return false;
        }
        return kind == other.kind
                && joinKind == other.joinKind
                && children.equals(other.children)
                && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, joinKind, children, attributes);
    }

    @Override
    public String toString() {
        return "PlanNode{" +
                "kind=" + kind +
                (joinKind != null ? ", joinKind=" + joinKind : "") +
                ", attributes=" + attributes +
                ", children=" + children +
                '}';
    }
}
