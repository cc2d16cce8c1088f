package eu.fbk.stardog;

import java.util.Map;

import javax.annotation.Nullable;

import eu.fbk.stardog.data.QueryKind;
import eu.fbk.stardog.data.QueryRequest;
import eu.fbk.stardog.data.QueryResult;
import eu.fbk.stardog.http.Request;
import eu.fbk.stardog.internal.Protocol;

/**
 * Routes query requests to the endpoint rooted at a path prefix ({@code db} for ordinary
 * queries, {@code db/vcs} for queries over the version history), encoding them as HTTP requests.
 */
final class QueryDispatcher {

    private final DefaultConnection connection;

    private final String name;

    private final String prefix;

    private final boolean transactional;

    QueryDispatcher(final DefaultConnection connection, final String name, final String prefix,
            final boolean transactional) {
        this.connection = connection;
        this.name = name;
        this.prefix = prefix;
        this.transactional = transactional;
    }

    /**
     * Returns the name of the query endpoint, used for logging.
     */
    String getName() {
        return this.name;
    }

    String getPrefix() {
        return this.prefix;
    }

    /**
     * Returns true if queries are evaluated within the active transaction of the connection.
     */
    boolean isTransactional() {
        return this.transactional;
    }

    QueryResult dispatch(final QueryRequest request) throws StardogException {
        return this.connection.query(this, request);
    }

    /**
     * Encodes a query request as a form-encoded POST to {@code prefix/[tx/]endpoint}. Options not
     * set in the request are omitted; bindings are sent as {@code $name} parameters with their
     * text unchanged.
     *
     * @param prefix
     *            the path prefix
     * @param request
     *            the query request
     * @param transactionID
     *            the transaction to evaluate the query in, null if none
     * @return the HTTP request
     */
    static Request encode(final String prefix, final QueryRequest request,
            @Nullable final String transactionID) {
        final QueryKind kind = request.getKind();
        final String path = transactionID == null || !kind.isTransactional() ? prefix + "/"
                + kind.getPath() : prefix + "/" + Protocol.path(transactionID) + "/"
                + kind.getPath();
        final Request.Builder builder = Request.builder(Request.POST, path)
                .accept(request.getAccept())
                .parameter(Protocol.PARAMETER_QUERY, request.getQuery())
                .parameter(Protocol.PARAMETER_REASONING, request.getReasoning())
                .parameter(Protocol.PARAMETER_OFFSET, request.getOffset())
                .parameter(Protocol.PARAMETER_LIMIT, request.getLimit())
                .parameter(Protocol.PARAMETER_TIMEOUT, request.getTimeout())
                .parameter(Protocol.PARAMETER_SCHEMA, request.getSchema())
                .parameters(Protocol.PARAMETER_DEFAULT_GRAPH, request.getDefaultGraphs())
                .parameters(Protocol.PARAMETER_NAMED_GRAPH, request.getNamedGraphs());
        for (final Map.Entry<String, String> entry : request.getBindings().entrySet()) {
            builder.parameter(Protocol.PARAMETER_BINDING_PREFIX + entry.getKey(),
                    entry.getValue());
        }
        return builder.build();
    }

}
