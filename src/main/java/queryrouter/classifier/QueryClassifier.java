package queryrouter.classifier;

import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import queryrouter.model.QueryType;
import queryrouter.sql.QueryFeatures;

/**
 * Assigns a {@link QueryType} to a SQL statement.
 *
 * Rules are evaluated in priority order and the first match wins:
 * mutation -> TRANSACTIONAL, join -> HYBRID, grouping or aggregates -> ANALYTICAL,
 * ORDER BY -> ANALYTICAL, top-level LIMIT -> ANALYTICAL, anything else -> TRANSACTIONAL.
 *
 * Matching is lexical, so a keyword inside a string literal still counts.
 * Stateless and thread-safe.
 */
@Singleton
public class QueryClassifier {

    /**
     * Classifies a statement. Never fails: null, blank or malformed text is TRANSACTIONAL.
     *
     * @param query raw statement text
     * @return the statement's classification
     */
    public QueryType classify(@Nullable String query) {
        return classify(QueryFeatures.detect(query));
    }

    /**
     * Classifies from already-detected features.
     */
    public QueryType classify(QueryFeatures features) {
        if (features.mutation()) {
            return QueryType.TRANSACTIONAL;
        }
        if (features.join()) {
            return QueryType.HYBRID;
        }
        if (features.aggregation() || features.ordering() || features.limit()) {
            return QueryType.ANALYTICAL;
        }
        return QueryType.TRANSACTIONAL;
    }
}
