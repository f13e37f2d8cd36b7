package queryrouter.planner;

import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import queryrouter.classifier.QueryClassifier;
import queryrouter.model.PlanNode;
import queryrouter.sql.QueryFeatures;
import queryrouter.sql.SqlText;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a logical plan tree from SQL text using the same structural cues as
 * the classifier. Never touches an engine.
 *
 * The tree starts at a SCAN leaf and is wrapped, innermost first, in JOIN,
 * AGGREGATION, SORT and LIMIT nodes as the statement calls for them.
 * Stateless and thread-safe.
 */
@Singleton
public class QueryPlanner {

    /**
     * Root attribute holding the statement text the plan was built from.
     */
    public static final String SQL_ATTRIBUTE = "sql";

    /**
     * Root attribute holding the classifier's decision for the statement.
     */
    public static final String QUERY_TYPE_ATTRIBUTE = "queryType";

    private static final String CLAUSE_END = "\\s*;|$)";

    private static final Pattern FROM_TABLE =
            Pattern.compile("\\bFROM\\s+([^\\s,;()]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHERE =
            Pattern.compile("\\bWHERE\\s+(.+?)(?=\\s+(?:GROUP BY|HAVING|ORDER BY|LIMIT|OFFSET)\\b|" + CLAUSE_END,
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern JOIN_TABLE =
            Pattern.compile("\\bJOIN\\s+([^\\s,;()]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern JOIN_CONDITION =
            Pattern.compile("\\bON\\s+(.+?)(?=\\s+(?:(?:INNER|LEFT|RIGHT|FULL|CROSS|NATURAL)\\s+(?:OUTER\\s+)?)?JOIN\\b"
                            + "|\\s+(?:WHERE|GROUP BY|HAVING|ORDER BY|LIMIT|OFFSET)\\b|" + CLAUSE_END,
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern GROUP_BY =
            Pattern.compile("\\bGROUP BY\\s+(.+?)(?=\\s+(?:HAVING|ORDER BY|LIMIT|OFFSET)\\b|" + CLAUSE_END,
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern AGGREGATE =
            Pattern.compile("\\b(?:" + QueryFeatures.AGGREGATE_FUNCTIONS + ") ?\\([^()]*\\)",
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern ORDER_BY =
            Pattern.compile("\\bORDER BY\\s+(.+?)(?=\\s+(?:LIMIT|OFFSET|FETCH)\\b|\\)|" + CLAUSE_END,
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern LIMIT =
            Pattern.compile("\\bLIMIT\\s+(\\d+)(?:\\s*,\\s*(\\d+))?", Pattern.CASE_INSENSITIVE);
    private static final Pattern OFFSET =
            Pattern.compile("\\bOFFSET\\s+(\\d+)", Pattern.CASE_INSENSITIVE);

    private final QueryClassifier classifier;

    public QueryPlanner() {
        this(new QueryClassifier());
    }

    @Inject
    public QueryPlanner(QueryClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Builds the plan for a statement. Total over every input the classifier accepts.
     *
     * @param query raw statement text
     * @return the root of a freshly built, immutable plan tree
     */
    public PlanNode plan(@Nullable String query) {
        QueryFeatures features = QueryFeatures.detect(query);
        String text = SqlText.collapse(query);

        Map<String, String> scan = new LinkedHashMap<>();
        putIfFound(scan, "table", FROM_TABLE, text);
        putIfFound(scan, "filter", WHERE, text);
        PlanNode plan = PlanNode.scan(scan);

        if (features.join()) {
            Map<String, String> join = new LinkedHashMap<>();
            putIfFound(join, "table", JOIN_TABLE, text);
            putIfFound(join, "condition", JOIN_CONDITION, text);
            plan = PlanNode.join(features.joinKind(), plan, join);
        }

        if (features.aggregation()) {
            Map<String, String> aggregation = new LinkedHashMap<>();
            List<String> calls = findAll(AGGREGATE, text);
            if (!calls.isEmpty()) {
                aggregation.put("aggregates", String.join(", ", calls));
            }
            putIfFound(aggregation, "groupBy", GROUP_BY, text);
            plan = PlanNode.aggregation(plan, aggregation);
        }

        if (features.ordering()) {
            Map<String, String> sort = new LinkedHashMap<>();
            putIfFound(sort, "orderBy", ORDER_BY, text);
            plan = PlanNode.sort(plan, sort);
        }

        if (features.limit()) {
            plan = PlanNode.limit(plan, limitAttributes(SqlText.topLevel(text)));
        }

        if (!text.isEmpty()) {
            plan = plan.withAttribute(SQL_ATTRIBUTE, query.trim())
                    .withAttribute(QUERY_TYPE_ATTRIBUTE, classifier.classify(features).name());
        }
        return plan;
    }

    /**
     * Renders a plan as indented text, one line per node, with each child two
     * spaces deeper than its parent.
     *
     * @param plan   the plan to render, may be null
     * @param indent prefix for the root line
     * @return a non-empty rendering
     */
    public String explainPlan(@Nullable PlanNode plan, String indent) {
        if (plan == null) {
            return indent + "Empty plan";
        }

        StringBuilder result = new StringBuilder();
        result.append(indent).append(describe(plan)).append('\n');
        for (PlanNode child : plan.getChildren()) {
            result.append(explainPlan(child, indent + "  "));
        }
        return result.toString();
    }

    /**
     * One-line description of a single node.
     */
    static String describe(PlanNode node) {
        Map<String, String> attrs = node.getAttributes();
        return switch (node.getKind()) {
            case SCAN -> {
                StringBuilder line = new StringBuilder("Scan");
                if (attrs.containsKey("table")) {
                    line.append('(').append(attrs.get("table")).append(')');
                }
                if (attrs.containsKey("filter")) {
                    line.append(" WHERE ").append(attrs.get("filter"));
                }
                yield line.toString();
            }
            case JOIN -> {
                String kind = node.getJoinKind().name();
                StringBuilder line = new StringBuilder()
                        .append(kind.charAt(0))
                        .append(kind.substring(1).toLowerCase(Locale.ROOT))
                        .append(" Join");
                List<String> parts = new ArrayList<>();
                if (attrs.containsKey("table")) {
                    parts.add(attrs.get("table"));
                }
                if (attrs.containsKey("condition")) {
                    parts.add("ON " + attrs.get("condition"));
                }
                if (!parts.isEmpty()) {
                    line.append('(').append(String.join(" ", parts)).append(')');
                }
                yield line.toString();
            }
            case AGGREGATION -> {
                StringBuilder line = new StringBuilder("Aggregation");
                if (attrs.containsKey("aggregates")) {
                    line.append('(').append(attrs.get("aggregates")).append(')');
                }
                if (attrs.containsKey("groupBy")) {
                    line.append(" GROUP BY ").append(attrs.get("groupBy"));
                }
                yield line.toString();
            }
            case SORT -> attrs.containsKey("orderBy") ? "Sort(" + attrs.get("orderBy") + ")" : "Sort";
            case LIMIT -> {
                if (!attrs.containsKey("count")) {
                    yield "Limit";
                }
                yield attrs.containsKey("offset")
                        ? "Limit(" + attrs.get("count") + " OFFSET " + attrs.get("offset") + ")"
                        : "Limit(" + attrs.get("count") + ")";
            }
        };
    }

    private static Map<String, String> limitAttributes(String topLevelText) {
        Map<String, String> limit = new LinkedHashMap<>();
        Matcher matcher = LIMIT.matcher(topLevelText);
        if (matcher.find()) {
            if (matcher.group(2) != null) {
                // LIMIT offset, count
                limit.put("count", matcher.group(2));
                limit.put("offset", matcher.group(1));
            } else {
                limit.put("count", matcher.group(1));
            }
        }
        if (!limit.containsKey("offset")) {
            putIfFound(limit, "offset", OFFSET, topLevelText);
        }
        return limit;
    }

    private static void putIfFound(Map<String, String> target, String key, Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (matcher.find()) {
            String value = matcher.group(1).trim();
            if (!value.isEmpty()) {
                target.put(key, value);
            }
        }
    }

    private static List<String> findAll(Pattern pattern, String text) {
        List<String> found = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group());
        }
        return found;
    }
}
