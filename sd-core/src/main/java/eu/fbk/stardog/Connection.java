package eu.fbk.stardog;

import java.io.Closeable;

import javax.annotation.Nullable;

import eu.fbk.stardog.Operation.Ask;
import eu.fbk.stardog.Operation.Download;
import eu.fbk.stardog.Operation.Explain;
import eu.fbk.stardog.Operation.Graph;
import eu.fbk.stardog.Operation.Paths;
import eu.fbk.stardog.Operation.Select;
import eu.fbk.stardog.Operation.Update;
import eu.fbk.stardog.data.Content;

/**
 * A connection to a Stardog database.
 * <p>
 * Interaction with a database occurs within a {@code Connection}, which is bound to the database
 * for its whole lifetime and tracks the server-side transaction the client is working in. A
 * {@code Connection} is obtained via {@link Stardog#newConnection(String)} and must be released
 * with {@link #close()}, which rolls back any transaction left active.
 * </p>
 * <p>
 * Data is modified within explicit transactions: {@link #begin()} starts one, after which
 * {@link #add(Content)}, {@link #remove(Content)} and {@link #clear()} can be called, and
 * {@link #commit()} or {@link #rollback()} end it. The current state is returned by
 * {@link #getState()}:
 * </p>
 * <blockquote>
 * <table border="1">
 * <tr>
 * <th>State</th>
 * <th>Reached by</th>
 * <th>Allowed transaction calls</th>
 * </tr>
 * <tr>
 * <td>{@code INACTIVE}</td>
 * <td>open, successful {@code commit()}, any {@code rollback()}</td>
 * <td>{@code begin()}</td>
 * </tr>
 * <tr>
 * <td>{@code ACTIVE}</td>
 * <td>{@code begin()}</td>
 * <td>{@code add()}, {@code remove()}, {@code clear()}, {@code commit()}, {@code rollback()}</td>
 * </tr>
 * <tr>
 * <td>{@code INDETERMINATE}</td>
 * <td>failed {@code commit()}</td>
 * <td>{@code begin()}</td>
 * </tr>
 * <tr>
 * <td>{@code CLOSED}</td>
 * <td>{@code close()}</td>
 * <td>none</td>
 * </tr>
 * </table>
 * </blockquote>
 * <p>
 * Calls not allowed in the current state fail with a {@link UsageException} before any request
 * is sent. Queries are invoked through operation objects: {@link #select(String)},
 * {@link #ask(String)}, {@link #graph(String)}, {@link #paths(String)}, {@link #update(String)}
 * and {@link #explain(String)}; they see the changes of the active transaction, if any, and
 * otherwise run in an implicit read transaction. {@link #export()} dumps the database contents,
 * either buffered or streamed. Sub-resources of the database are reached through the facades
 * returned by {@link #docs()}, {@link #icv()}, {@link #versioning()} and {@link #graphql()},
 * which never require a transaction.
 * </p>
 * <p>
 * Connections are not meant to be used by multiple callers concurrently: methods are
 * synchronized, but a connection tracks a single transaction and at most one open stream.
 * </p>
 */
public interface Connection extends Closeable {

    String getDatabase();

    /**
     * Returns the transaction state. This method can be called also after the connection has
     * been closed.
     *
     * @return the current state
     */
    TransactionState getState();

    /**
     * Returns the identifier of the active transaction.
     *
     * @return the transaction ID, null if no transaction is active
     */
    @Nullable
    String getTransactionID();

    /**
     * Starts a new transaction.
     *
     * @return the identifier of the new transaction
     * @throws UsageException
     *             if a transaction is already active
     * @throws StardogException
     *             in case of failure
     */
    String begin() throws StardogException;

    /**
     * Commits the active transaction. On failure the connection state becomes
     * {@link TransactionState#INDETERMINATE} and the transaction is forgotten.
     *
     * @throws UsageException
     *             if no transaction is active
     * @throws IndeterminateTransactionException
     *             if the commit failed, so that its outcome is unknown
     * @throws StardogException
     *             in case of failure
     */
    void commit() throws StardogException;

    /**
     * Rolls back the active transaction. The transaction is forgotten and the state becomes
     * {@link TransactionState#INACTIVE} also if the server call fails, in which case the failure
     * is thrown.
     *
     * @throws UsageException
     *             if no transaction is active
     * @throws StardogException
     *             in case of failure
     */
    void rollback() throws StardogException;

    /**
     * Adds the RDF statements in the content supplied to the graph given by its context (default
     * graph if none).
     *
     * @param content
     *            the RDF content
     * @throws UsageException
     *             if no transaction is active
     * @throws StardogException
     *             in case of failure
     */
    void add(Content content) throws StardogException;

    /**
     * Removes the RDF statements in the content supplied from the graph given by its context
     * (default graph if none).
     *
     * @param content
     *            the RDF content
     * @throws UsageException
     *             if no transaction is active
     * @throws StardogException
     *             in case of failure
     */
    void remove(Content content) throws StardogException;

    /**
     * Removes all the statements of the database.
     *
     * @throws UsageException
     *             if no transaction is active
     * @throws StardogException
     *             in case of failure
     */
    void clear() throws StardogException;

    /**
     * Removes all the statements of a named graph.
     *
     * @param graph
     *            the graph IRI; null to clear the whole database
     * @throws UsageException
     *             if no transaction is active
     * @throws StardogException
     *             in case of failure
     */
    void clear(@Nullable String graph) throws StardogException;

    /**
     * Returns the number of statements in the database, outside any transaction.
     *
     * @return the statement count
     * @throws StardogException
     *             in case of failure
     */
    long size() throws StardogException;

    /**
     * Returns an operation exporting the whole database (default media type
     * {@code text/turtle}).
     *
     * @return the created operation object
     */
    Download export();

    /**
     * Returns an operation exporting a named graph.
     *
     * @param graph
     *            the graph IRI; null to export the whole database
     * @return the created operation object
     */
    Download export(@Nullable String graph);

    Select select(String query);

    Ask ask(String query);

    Graph graph(String query);

    Paths paths(String query);

    Update update(String query);

    Explain explain(String query);

    Docs docs();

    ICV icv();

    Versioning versioning();

    GraphQL graphql();

    /**
     * {@inheritDoc} Rolls back the active transaction, if any (failures are logged), closes the
     * open stream, if any, and releases the transport. Calling this method additional times has
     * no effect.
     */
    @Override
    void close();

}
