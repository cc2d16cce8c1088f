package eu.fbk.stardog.data;

/**
 * The kind of a query, determining the endpoint it is sent to, the media type requested and the
 * way the response is decoded.
 */
public enum QueryKind {

    /** A SPARQL SELECT query, returning a table of bindings. */
    SELECT("query", "application/sparql-results+json", true),

    /** A SPARQL ASK query, returning a boolean. */
    ASK("query", "text/boolean", true),

    /** A SPARQL CONSTRUCT / DESCRIBE query, returning an RDF document. */
    GRAPH("query", "text/turtle", true),

    /** A Stardog PATHS query, returning a table of bindings. */
    PATHS("query", "application/sparql-results+json", true),

    /** A SPARQL UPDATE request, auto-committed outside transactions. */
    UPDATE("update", "text/plain", true),

    /** A request for the evaluation plan of a query, never transactional. */
    EXPLAIN("explain", "text/plain", false);

    private final String path;

    private final String accept;

    private final boolean transactional;

    private QueryKind(final String path, final String accept, final boolean transactional) {
        this.path = path;
        this.accept = accept;
        this.transactional = transactional;
    }

    /**
     * Returns the last path segment of the endpoint for this kind of query.
     */
    public String getPath() {
        return this.path;
    }

    /**
     * Returns the media type to be requested by default for this kind of query.
     */
    public String getAccept() {
        return this.accept;
    }

    /**
     * Returns true if queries of this kind are evaluated within the active transaction, if any.
     */
    public boolean isTransactional() {
        return this.transactional;
    }

    /**
     * Returns true if the response to queries of this kind is a table of bindings.
     */
    public boolean isTupleKind() {
        return this == SELECT || this == PATHS;
    }

}
