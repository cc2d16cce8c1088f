package eu.fbk.stardog;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import eu.fbk.stardog.Operation.Ask;
import eu.fbk.stardog.Operation.Download;
import eu.fbk.stardog.Operation.Explain;
import eu.fbk.stardog.Operation.Graph;
import eu.fbk.stardog.Operation.Paths;
import eu.fbk.stardog.Operation.Select;
import eu.fbk.stardog.Operation.Update;
import eu.fbk.stardog.data.Content;
import eu.fbk.stardog.data.QueryRequest;
import eu.fbk.stardog.data.QueryResult;
import eu.fbk.stardog.data.Stream;
import eu.fbk.stardog.http.Request;
import eu.fbk.stardog.http.Response;
import eu.fbk.stardog.http.Transport;
import eu.fbk.stardog.internal.Decoding;
import eu.fbk.stardog.internal.Logging;
import eu.fbk.stardog.internal.Protocol;
import eu.fbk.stardog.internal.Util;

/**
 * The {@code Connection} implementation, built on a {@link Transport}.
 */
public final class DefaultConnection implements Connection {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultConnection.class);

    private final Transport transport;

    private final String database;

    private final QueryDispatcher dispatcher;

    private final Docs docs;

    private final ICV icv;

    private final Versioning versioning;

    private final GraphQL graphql;

    private TransactionState state;

    @Nullable
    private String transactionID;

    @Nullable
    private Stream<byte[]> openStream;

    // Request-scoped variables

    private long timestamp;

    @Nullable
    private String oldContext;

    private DefaultConnection(final Transport transport, final String database) {
        this.transport = transport;
        this.database = database;
        this.dispatcher = new QueryDispatcher(this, "", Protocol.path(database), true);
        this.docs = new Docs(this);
        this.icv = new ICV(this);
        this.versioning = new Versioning(this);
        this.graphql = new GraphQL(this);
        this.state = TransactionState.INACTIVE;
        this.transactionID = null;
        this.openStream = null;
    }

    /**
     * Opens a connection to the database specified, checking that the server is alive. On
     * failure, the transport is closed.
     *
     * @param transport
     *            the transport, owned by the returned connection
     * @param database
     *            the database name
     * @return the created connection
     * @throws StardogException
     *             in case the server cannot be reached or fails the check
     */
    public static DefaultConnection open(final Transport transport, final String database)
            throws StardogException {
        Preconditions.checkNotNull(transport);
        Preconditions.checkArgument(!database.isEmpty(), "Empty database name");
        final DefaultConnection connection = new DefaultConnection(transport, database);
        try {
            connection.execute("OPEN", () -> {
                Decoding.readText(connection.send(Request.builder(Request.GET,
                        Protocol.PATH_ALIVE).build()));
                return null;
            }, null, database);
        } catch (final StardogException | RuntimeException ex) {
            Util.closeQuietly(transport);
            connection.state = TransactionState.CLOSED;
            throw ex;
        }
        return connection;
    }

    @Override
    public String getDatabase() {
        return this.database;
    }

    @Override
    public synchronized TransactionState getState() {
        return this.state;
    }

    @Override
    @Nullable
    public synchronized String getTransactionID() {
        return this.transactionID;
    }

    @Override
    public synchronized String begin() throws StardogException {
        checkOpen();
        if (this.state == TransactionState.ACTIVE) {
            throw new UsageException("Transaction " + this.transactionID + " already active");
        }
        return execute("BEGIN", () -> {
            final String id = Decoding.readText(
                    send(post(Protocol.PATH_TRANSACTION, Protocol.PATH_BEGIN).build())).trim();
            if (id.isEmpty()) {
                throw new StardogException("No transaction ID returned by server", null);
            }
            this.transactionID = id;
            this.state = TransactionState.ACTIVE;
            return id;
        });
    }

    @Override
    public synchronized void commit() throws StardogException {
        checkActive("commit");
        final String id = this.transactionID;
        execute("COMMIT", () -> {
            try {
                Decoding.readText(send(post(Protocol.PATH_TRANSACTION, Protocol.PATH_COMMIT, id)
                        .build()));
            } catch (final StardogException ex) {
                this.state = TransactionState.INDETERMINATE;
                this.transactionID = null;
                throw new IndeterminateTransactionException(id, ex);
            }
            this.state = TransactionState.INACTIVE;
            this.transactionID = null;
            return null;
        }, null, id);
    }

    @Override
    public synchronized void rollback() throws StardogException {
        checkActive("rollback");
        final String id = this.transactionID;
        execute("ROLLBACK", () -> {
            try {
                Decoding.readText(send(post(Protocol.PATH_TRANSACTION, Protocol.PATH_ROLLBACK,
                        id).build()));
            } finally {
                this.state = TransactionState.INACTIVE;
                this.transactionID = null;
            }
            return null;
        }, null, id);
    }

    @Override
    public synchronized void add(final Content content) throws StardogException {
        mutate("ADD", Protocol.PATH_ADD, content);
    }

    @Override
    public synchronized void remove(final Content content) throws StardogException {
        mutate("REMOVE", Protocol.PATH_REMOVE, content);
    }

    private void mutate(final String operation, final String endpoint, final Content content)
            throws StardogException {
        Preconditions.checkNotNull(content);
        checkActive(operation.toLowerCase());
        execute(operation, () -> {
            final Request request = post(this.transactionID, endpoint)
                    .entity(content.getSource(), content.getMediaType(), content.getEncoding())
                    .parameter(Protocol.PARAMETER_GRAPH, content.getContext()).build();
            Decoding.readText(send(request));
            return null;
        }, null, content);
    }

    @Override
    public void clear() throws StardogException {
        clear(null);
    }

    @Override
    public synchronized void clear(@Nullable final String graph) throws StardogException {
        checkActive("clear");
        execute("CLEAR", () -> {
            Decoding.readText(send(post(this.transactionID, Protocol.PATH_CLEAR).parameter(
                    Protocol.PARAMETER_GRAPH, graph).build()));
            return null;
        }, "graph", graph);
    }

    @Override
    public synchronized long size() throws StardogException {
        checkOpen();
        return execute("SIZE", () -> Decoding.readLong(send(get(Protocol.PATH_SIZE).build())));
    }

    @Override
    public Download export() {
        return export(null);
    }

    @Override
    public synchronized Download export(@Nullable final String graph) {
        checkOpen();
        return newDownload("EXPORT", Protocol.path(this.database, Protocol.PATH_EXPORT),
                Protocol.MIME_TURTLE, graph);
    }

    @Override
    public synchronized Select select(final String query) {
        checkOpen();
        return new Select(this.dispatcher, query);
    }

    @Override
    public synchronized Ask ask(final String query) {
        checkOpen();
        return new Ask(this.dispatcher, query);
    }

    @Override
    public synchronized Graph graph(final String query) {
        checkOpen();
        return new Graph(this.dispatcher, query);
    }

    @Override
    public synchronized Paths paths(final String query) {
        checkOpen();
        return new Paths(this.dispatcher, query);
    }

    @Override
    public synchronized Update update(final String query) {
        checkOpen();
        return new Update(this.dispatcher, query);
    }

    @Override
    public synchronized Explain explain(final String query) {
        checkOpen();
        return new Explain(this.dispatcher, query);
    }

    @Override
    public synchronized Docs docs() {
        checkOpen();
        return this.docs;
    }

    @Override
    public synchronized ICV icv() {
        checkOpen();
        return this.icv;
    }

    @Override
    public synchronized Versioning versioning() {
        checkOpen();
        return this.versioning;
    }

    @Override
    public synchronized GraphQL graphql() {
        checkOpen();
        return this.graphql;
    }

    @Override
    public synchronized void close() {
        if (this.state == TransactionState.CLOSED) {
            return;
        }
        try {
            if (this.state == TransactionState.ACTIVE) {
                try {
                    rollback();
                } catch (final Throwable ex) {
                    LOGGER.warn("Rollback of transaction failed while closing connection to "
                            + this.database + ": " + ex.getMessage(), ex);
                }
            }
            if (this.openStream != null && !this.openStream.isClosed()) {
                LOGGER.debug("Closing stream left open on connection to {}", this.database);
                this.openStream.close();
            }
            Util.closeQuietly(this.transport);
        } finally {
            this.openStream = null;
            this.transactionID = null;
            this.state = TransactionState.CLOSED;
        }
    }

    @Override
    public synchronized String toString() {
        return getClass().getSimpleName() + "[" + this.database + ", "
                + this.state.name().toLowerCase()
                + (this.transactionID == null ? "" : ", tx " + this.transactionID) + "]";
    }

    // Shared with query operations and facades

    synchronized QueryResult query(final QueryDispatcher dispatcher, final QueryRequest request)
            throws StardogException {
        checkOpen();
        final String id = dispatcher.isTransactional()
                && this.state == TransactionState.ACTIVE ? this.transactionID : null;
        return execute(dispatcher.getName() + request.getKind().name(),
                () -> Decoding.decode(request.getKind(),
                        send(QueryDispatcher.encode(dispatcher.getPrefix(), request, id))), null,
                request, "tx", id);
    }

    Download newDownload(final String operation, final String path,
            final String defaultMediaType, @Nullable final String graph) {
        return new Download() {

            @Override
            protected Response doExec(@Nullable final String mediaType) throws StardogException {
                return execute(operation, () -> send(request(mediaType)), null, path, "accept",
                        mediaType, "graph", graph);
            }

            @Override
            protected Stream<byte[]> doExecStream(@Nullable final String mediaType,
                    final int chunkSize) throws StardogException {
                synchronized (DefaultConnection.this) {
                    checkOpen();
                    final Stream<byte[]> current = DefaultConnection.this.openStream;
                    if (current != null && !current.isClosed()) {
                        throw new UsageException("Another stream is open on connection to "
                                + DefaultConnection.this.database);
                    }
                    final Stream<byte[]> stream = execute(operation, () -> {
                        final Response response = send(request(mediaType));
                        return Stream.read(response.getBody(), chunkSize).onClose(response);
                    }, null, path, "accept", mediaType, "graph", graph, null, "streaming");
                    DefaultConnection.this.openStream = stream;
                    return stream;
                }
            }

            private Request request(@Nullable final String mediaType) {
                return Request.builder(Request.GET, path)
                        .accept(mediaType != null ? mediaType : defaultMediaType)
                        .parameter(Protocol.PARAMETER_GRAPH, graph).build();
            }

        };
    }

    /**
     * Runs an invocation, setting the MDC context and logging its start and completion.
     */
    synchronized <T> T execute(final String operation, final Invocation<T> invocation,
            final Object... args) throws StardogException {
        checkOpen();
        start();
        try {
            logRequest(operation, args);
            return logResponse(invocation.call());
        } catch (final StardogException | RuntimeException ex) {
            logFailure(ex);
            throw ex;
        } finally {
            end();
        }
    }

    /**
     * Sends a request, translating non-2xx responses into {@code StardogException}s.
     */
    Response send(final Request request) throws StardogException {
        final Response response = this.transport.send(request);
        if (!response.isSuccessful()) {
            throw Decoding.toException(response);
        }
        return response;
    }

    Request.Builder get(final String... segments) {
        return Request.builder(Request.GET, databasePath(segments));
    }

    Request.Builder post(final String... segments) {
        return Request.builder(Request.POST, databasePath(segments));
    }

    Request.Builder put(final String... segments) {
        return Request.builder(Request.PUT, databasePath(segments));
    }

    Request.Builder delete(final String... segments) {
        return Request.builder(Request.DELETE, databasePath(segments));
    }

    private String databasePath(final String... segments) {
        final String[] allSegments = new String[segments.length + 1];
        allSegments[0] = this.database;
        System.arraycopy(segments, 0, allSegments, 1, segments.length);
        return Protocol.path(allSegments);
    }

    void checkOpen() {
        if (this.state == TransactionState.CLOSED) {
            throw new UsageException("Connection to " + this.database + " has been closed");
        }
    }

    private void checkActive(final String operation) {
        checkOpen();
        if (this.state != TransactionState.ACTIVE) {
            throw new UsageException("Cannot " + operation + ": no active transaction (state "
                    + this.state + ")");
        }
    }

    private void start() {
        this.timestamp = System.currentTimeMillis();
        this.oldContext = MDC.get(Logging.MDC_CONTEXT);
        MDC.put(Logging.MDC_CONTEXT, Logging.newInvocationID());
    }

    private void end() {
        if (this.oldContext == null) {
            MDC.remove(Logging.MDC_CONTEXT);
        } else {
            MDC.put(Logging.MDC_CONTEXT, this.oldContext);
        }
        this.oldContext = null;
    }

    private void logRequest(final String operation, final Object... args) {
        if (LOGGER.isInfoEnabled()) {
            final StringBuilder builder = new StringBuilder();
            builder.append(operation).append(' ').append(this.database);
            String separator = " ";
            for (int i = 0; i + 1 < args.length; i += 2) {
                final Object name = args[i];
                final Object value = args[i + 1];
                if (value != null) {
                    builder.append(separator);
                    if (name != null) {
                        builder.append(name).append('=');
                    }
                    builder.append(value);
                    separator = ", ";
                }
            }
            LOGGER.info(builder.toString());
        }
    }

    private <T> T logResponse(final T result) {
        if (LOGGER.isInfoEnabled()) {
            final long elapsed = System.currentTimeMillis() - this.timestamp;
            if (result == null) {
                LOGGER.info("Result: done, {} ms", elapsed);
            } else {
                LOGGER.info("Result: {}, {} ms", result, elapsed);
            }
        }
        return result;
    }

    private void logFailure(final Exception ex) {
        if (LOGGER.isInfoEnabled()) {
            final long elapsed = System.currentTimeMillis() - this.timestamp;
            LOGGER.info("Failure: {}, {} ms", ex.getMessage(), elapsed);
        }
    }

    /**
     * A unit of work run by {@link DefaultConnection#execute(String, Invocation, Object...)}.
     *
     * @param <T>
     *            the result type
     */
    interface Invocation<T> {

        T call() throws StardogException;

    }

}
