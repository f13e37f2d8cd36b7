package queryrouter.model;

/**
 * Classification of a SQL statement for engine routing.
 */
public enum QueryType {
    /**
     * Point lookups and single-row mutations - executed by the transactional engine
     */
    TRANSACTIONAL,

    /**
     * Scans, aggregation, sorting and limits - executed by the analytical engine
     */
    ANALYTICAL,

    /**
     * Statements with joins - executed by the analytical engine
     */
    HYBRID
}
