package queryrouter.service;

import queryrouter.model.QueryResult;
import queryrouter.model.QueryType;

/**
 * A query result together with the routing decision that produced it.
 *
 * @param queryType  classification the router made
 * @param engineName engine that executed the statement
 * @param result     the engine's result
 */
public record RoutedQuery(QueryType queryType, String engineName, QueryResult result) {
}
