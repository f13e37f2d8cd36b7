package queryrouter.sql;

import io.micronaut.core.annotation.Nullable;
import queryrouter.model.JoinKind;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural cues detected in a SQL statement.
 * Both the classifier and the planner decide from the same detection so that
 * a statement's classification and its plan shape always agree.
 *
 * @param mutation    an INSERT, UPDATE or DELETE keyword is present
 * @param join        a JOIN clause is present
 * @param joinKind    flavour of the first join, INNER unless LEFT, RIGHT or FULL is spelled out
 * @param aggregation GROUP BY or an aggregate function call is present
 * @param ordering    ORDER BY is present
 * @param limit       a LIMIT appears outside any parentheses
 */
public record QueryFeatures(
        boolean mutation,
        boolean join,
        JoinKind joinKind,
        boolean aggregation,
        boolean ordering,
        boolean limit
) {

    private static final Pattern MUTATION = Pattern.compile("\\b(INSERT|UPDATE|DELETE)\\b");
    private static final Pattern JOIN = Pattern.compile("\\b(?:(LEFT|RIGHT|FULL)(?: OUTER)? )?JOIN\\b");
    private static final Pattern GROUP_BY = Pattern.compile("\\bGROUP BY\\b");
    private static final Pattern ORDER_BY = Pattern.compile("\\bORDER BY\\b");
    private static final Pattern LIMIT = Pattern.compile("\\bLIMIT\\b");

    /**
     * Aggregate function names recognised by {@link #AGGREGATE_CALL}.
     */
    public static final String AGGREGATE_FUNCTIONS =
            "COUNT|SUM|AVG|MIN|MAX|STDDEV|VARIANCE|MEDIAN|GROUP_CONCAT|STRING_AGG|ARRAY_AGG";

    public static final Pattern AGGREGATE_CALL =
            Pattern.compile("\\b(" + AGGREGATE_FUNCTIONS + ") ?\\(", Pattern.CASE_INSENSITIVE);

    /**
     * Detects the structural cues of a statement. Never fails; null or blank
     * text yields a feature set with every flag off.
     *
     * @param sql raw statement text
     * @return the detected features
     */
    public static QueryFeatures detect(@Nullable String sql) {
        String normalized = SqlText.normalize(sql);

        Matcher joinMatcher = JOIN.matcher(normalized);
        boolean join = joinMatcher.find();
        JoinKind joinKind = JoinKind.INNER;
        if (join && joinMatcher.group(1) != null) {
            joinKind = JoinKind.valueOf(joinMatcher.group(1));
        }

        return new QueryFeatures(
                MUTATION.matcher(normalized).find(),
                join,
                joinKind,
                GROUP_BY.matcher(normalized).find() || AGGREGATE_CALL.matcher(normalized).find(),
                ORDER_BY.matcher(normalized).find(),
                LIMIT.matcher(SqlText.topLevel(normalized)).find()
        );
    }
}
