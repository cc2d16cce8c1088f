package eu.fbk.stardog;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.openrdf.model.Value;
import org.openrdf.rio.ntriples.NTriplesUtil;

import eu.fbk.stardog.data.QueryKind;
import eu.fbk.stardog.data.QueryRequest;
import eu.fbk.stardog.data.QueryResult;
import eu.fbk.stardog.data.Stream;
import eu.fbk.stardog.http.Response;
import eu.fbk.stardog.internal.Decoding;

/**
 * Base class of operation objects.
 * <p>
 * Operations returning more than a scalar are invoked through <i>operation objects</i>: the
 * object is obtained from a {@link Connection} (or one of its facades), configured by calling
 * its setter-like methods (which return the object itself, for call chaining) and finally
 * executed by calling one of its {@code exec()} / {@code execXXX()} methods. An operation object
 * can be executed multiple times, each execution resulting in a new request to the server.
 * </p>
 */
public abstract class Operation {

    Operation() {
    }

    /**
     * A read of a possibly large body, either buffered or streamed.
     * <p>
     * Method {@link #exec()} and {@link #execBytes()} buffer the whole body in memory, while
     * {@link #execStream()} returns a {@link Stream} of chunks that keeps the HTTP connection open
     * until the stream is exhausted or closed; the latter MUST be consumed within a
     * try-with-resources block. A connection supports at most one open stream at a time.
     * </p>
     */
    public abstract static class Download extends Operation {

        @Nullable
        private String mediaType;

        protected Download() {
            this.mediaType = null;
        }

        /**
         * Sets the media type to request, overriding the default one of the operation.
         *
         * @param mediaType
         *            the media type; null to use the default
         * @return this operation object, for call chaining
         */
        public final synchronized Download accept(@Nullable final String mediaType) {
            this.mediaType = mediaType;
            return this;
        }

        /**
         * Executes the operation, returning the whole body decoded as text according to the
         * charset declared by the server (default UTF-8).
         *
         * @return the body text
         * @throws StardogException
         *             in case of failure
         */
        public final String exec() throws StardogException {
            return Decoding.readText(doExec(getMediaType()));
        }

        /**
         * Executes the operation, returning the whole body.
         *
         * @return the body bytes
         * @throws StardogException
         *             in case of failure
         */
        public final byte[] execBytes() throws StardogException {
            return Decoding.readBytes(doExec(getMediaType()));
        }

        /**
         * Executes the operation, returning a stream of chunks of the default size.
         *
         * @return a stream of chunks, to be closed after use
         * @throws StardogException
         *             in case of failure
         * @throws UsageException
         *             if another stream is open on the connection
         */
        public final Stream<byte[]> execStream() throws StardogException {
            return execStream(Stream.DEFAULT_CHUNK_SIZE);
        }

        /**
         * Executes the operation, returning a stream of chunks of at most {@code chunkSize}
         * bytes. The concatenation of the chunks is the same body returned by
         * {@link #execBytes()}.
         *
         * @param chunkSize
         *            the maximum chunk size, greater than zero
         * @return a stream of chunks, to be closed after use
         * @throws StardogException
         *             in case of failure
         * @throws UsageException
         *             if another stream is open on the connection
         */
        public final Stream<byte[]> execStream(final int chunkSize) throws StardogException {
            Preconditions.checkArgument(chunkSize > 0, "Invalid chunk size %s", chunkSize);
            return doExecStream(getMediaType(), chunkSize);
        }

        @Nullable
        private synchronized String getMediaType() {
            return this.mediaType;
        }

        /**
         * Implementation method sending the request and returning the successful response.
         *
         * @param mediaType
         *            the media type to request, null for the default one
         * @return the response, with a 2xx status
         * @throws StardogException
         *             in case of failure
         */
        protected abstract Response doExec(@Nullable String mediaType) throws StardogException;

        /**
         * Implementation method sending the request and wrapping the successful response in a
         * stream of chunks, which becomes the open stream of the connection.
         *
         * @param mediaType
         *            the media type to request, null for the default one
         * @param chunkSize
         *            the maximum chunk size, greater than zero
         * @return a stream releasing the response when closed
         * @throws StardogException
         *             in case of failure
         */
        protected abstract Stream<byte[]> doExecStream(@Nullable String mediaType,
                int chunkSize) throws StardogException;

    }

    /**
     * Base class of query operations.
     *
     * @param <Q>
     *            the concrete query operation type, returned by setters
     */
    public abstract static class Query<Q extends Query<Q>> extends Operation {

        private final QueryDispatcher dispatcher;

        private final QueryKind kind;

        private final String query;

        @Nullable
        private Boolean reasoning;

        private final Map<String, String> bindings;

        @Nullable
        private Long offset;

        @Nullable
        private Long limit;

        @Nullable
        private Long timeout;

        @Nullable
        private String schema;

        private final List<String> defaultGraphs;

        private final List<String> namedGraphs;

        Query(final QueryDispatcher dispatcher, final QueryKind kind, final String query) {
            this.dispatcher = dispatcher;
            this.kind = kind;
            this.query = Preconditions.checkNotNull(query, "Null query");
            this.bindings = Maps.newLinkedHashMap();
            this.defaultGraphs = Lists.newArrayList();
            this.namedGraphs = Lists.newArrayList();
        }

        @SuppressWarnings("unchecked")
        private Q self() {
            return (Q) this;
        }

        /**
         * Enables or disables reasoning (default: server setting).
         *
         * @param reasoning
         *            true to enable reasoning; null to use the server default
         * @return this operation object, for call chaining
         */
        public final synchronized Q reasoning(@Nullable final Boolean reasoning) {
            this.reasoning = reasoning;
            return self();
        }

        /**
         * Binds a query variable to an RDF term given in its textual (N-Triples) form, e.g.,
         * {@code <urn:x>} or {@code "5"^^<http://www.w3.org/2001/XMLSchema#integer>}. The text
         * is sent verbatim.
         *
         * @param name
         *            the variable name, without {@code ?} or {@code $}
         * @param term
         *            the term text
         * @return this operation object, for call chaining
         */
        public final synchronized Q binding(final String name, final String term) {
            Preconditions.checkArgument(!name.isEmpty(), "Empty variable name");
            this.bindings.put(name, Preconditions.checkNotNull(term));
            return self();
        }

        /**
         * Binds a query variable to an RDF value.
         *
         * @param name
         *            the variable name, without {@code ?} or {@code $}
         * @param value
         *            the value
         * @return this operation object, for call chaining
         */
        public final synchronized Q binding(final String name, final Value value) {
            return binding(name, NTriplesUtil.toNTriplesString(value));
        }

        /**
         * Adds all the bindings in the map supplied; values can be {@link Value}s or strings in
         * N-Triples syntax.
         *
         * @param bindings
         *            a variable name to term map
         * @return this operation object, for call chaining
         */
        public final synchronized Q bindings(final Map<String, ?> bindings) {
            for (final Map.Entry<String, ?> entry : bindings.entrySet()) {
                final Object term = Preconditions.checkNotNull(entry.getValue(),
                        "Null binding for %s", entry.getKey());
                if (term instanceof Value) {
                    binding(entry.getKey(), (Value) term);
                } else {
                    binding(entry.getKey(), term.toString());
                }
            }
            return self();
        }

        public final synchronized Q offset(@Nullable final Long offset) {
            Preconditions.checkArgument(offset == null || offset >= 0, "Invalid offset %s",
                    offset);
            this.offset = offset;
            return self();
        }

        public final synchronized Q limit(@Nullable final Long limit) {
            Preconditions.checkArgument(limit == null || limit >= 0, "Invalid limit %s", limit);
            this.limit = limit;
            return self();
        }

        /**
         * Sets the query timeout in milliseconds, enforced by the server.
         *
         * @param timeout
         *            the timeout; null to use the server default
         * @return this operation object, for call chaining
         */
        public final synchronized Q timeout(@Nullable final Long timeout) {
            Preconditions.checkArgument(timeout == null || timeout >= 0, "Invalid timeout %s",
                    timeout);
            this.timeout = timeout;
            return self();
        }

        /**
         * Sets the reasoning schema to use.
         *
         * @param schema
         *            the schema name; null to use the server default
         * @return this operation object, for call chaining
         */
        public final synchronized Q schema(@Nullable final String schema) {
            this.schema = schema;
            return self();
        }

        public final synchronized Q defaultGraphs(final String... graphs) {
            this.defaultGraphs.addAll(Arrays.asList(graphs));
            return self();
        }

        public final synchronized Q namedGraphs(final String... graphs) {
            this.namedGraphs.addAll(Arrays.asList(graphs));
            return self();
        }

        final synchronized QueryRequest.Builder newRequestBuilder() {
            final QueryRequest.Builder builder = QueryRequest.builder(this.kind, this.query)
                    .reasoning(this.reasoning).offset(this.offset).limit(this.limit)
                    .timeout(this.timeout).schema(this.schema);
            for (final Map.Entry<String, String> entry : this.bindings.entrySet()) {
                builder.binding(entry.getKey(), entry.getValue());
            }
            for (final String graph : this.defaultGraphs) {
                builder.defaultGraph(graph);
            }
            for (final String graph : this.namedGraphs) {
                builder.namedGraph(graph);
            }
            return builder;
        }

        QueryRequest newRequest() {
            return newRequestBuilder().build();
        }

        final QueryResult execute() throws StardogException {
            return this.dispatcher.dispatch(newRequest());
        }

    }

    public static final class Select extends Query<Select> {

        Select(final QueryDispatcher dispatcher, final String query) {
            super(dispatcher, QueryKind.SELECT, query);
        }

        /**
         * Executes the query, returning the table of results.
         *
         * @return the result tuples, in server order
         * @throws StardogException
         *             in case of failure
         */
        public QueryResult.Tuples exec() throws StardogException {
            return (QueryResult.Tuples) execute();
        }

    }

    public static final class Ask extends Query<Ask> {

        Ask(final QueryDispatcher dispatcher, final String query) {
            super(dispatcher, QueryKind.ASK, query);
        }

        public boolean exec() throws StardogException {
            return ((QueryResult.Bool) execute()).getValue();
        }

    }

    public static final class Graph extends Query<Graph> {

        @Nullable
        private String contentType;

        Graph(final QueryDispatcher dispatcher, final String query) {
            super(dispatcher, QueryKind.GRAPH, query);
        }

        /**
         * Sets the RDF media type of the result (default {@code text/turtle}).
         *
         * @param contentType
         *            the media type; null to use the default
         * @return this operation object, for call chaining
         */
        public synchronized Graph contentType(@Nullable final String contentType) {
            this.contentType = contentType;
            return this;
        }

        @Override
        synchronized QueryRequest newRequest() {
            return newRequestBuilder().accept(this.contentType).build();
        }

        /**
         * Executes the query, returning the resulting RDF document.
         *
         * @return the RDF document, in the requested media type
         * @throws StardogException
         *             in case of failure
         */
        public String exec() throws StardogException {
            return ((QueryResult.Text) execute()).getText();
        }

    }

    public static final class Paths extends Query<Paths> {

        Paths(final QueryDispatcher dispatcher, final String query) {
            super(dispatcher, QueryKind.PATHS, query);
        }

        public QueryResult.Tuples exec() throws StardogException {
            return (QueryResult.Tuples) execute();
        }

    }

    public static final class Update extends Query<Update> {

        Update(final QueryDispatcher dispatcher, final String query) {
            super(dispatcher, QueryKind.UPDATE, query);
        }

        /**
         * Executes the update, within the active transaction if any, otherwise in a transaction
         * of its own committed by the server.
         *
         * @throws StardogException
         *             in case of failure
         */
        public void exec() throws StardogException {
            execute();
        }

    }

    public static final class Explain extends Query<Explain> {

        Explain(final QueryDispatcher dispatcher, final String query) {
            super(dispatcher, QueryKind.EXPLAIN, query);
        }

        /**
         * Returns the evaluation plan of the query.
         *
         * @return the plan text
         * @throws StardogException
         *             in case of failure
         */
        public String exec() throws StardogException {
            return ((QueryResult.Text) execute()).getText();
        }

    }

}
