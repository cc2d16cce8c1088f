package eu.fbk.stardog;

import java.io.Closeable;

import javax.annotation.Nullable;

/**
 * A Stardog server.
 * <p>
 * This interface represents the entry point of the API. Users have to first obtain an instance of
 * this interface (e.g., an HTTP client configured with the server URL and default credentials);
 * after that, connections to the databases hosted by the server can be opened by calling
 * {@link #newConnection(String)} (default credentials) or
 * {@link #newConnection(String, String, String)} (explicit credentials); the returned
 * {@link Connection} objects allow in turn to issue transactional API calls. When the instance is
 * no more used, method {@link #close()} should be called to release the instance and any
 * connection still open.
 * </p>
 * <p>
 * {@code Stardog} instances are thread safe, while the returned connections are not.
 * </p>
 */
public interface Stardog extends Closeable {

    /**
     * Opens a new connection to the database specified, using default credentials. A liveness
     * check is performed before returning.
     *
     * @param database
     *            the database name
     * @return the created {@code Connection}
     * @throws StardogException
     *             in case the server cannot be reached or fails the liveness check
     * @throws UsageException
     *             in case this {@code Stardog} instance has been closed
     */
    Connection newConnection(String database) throws StardogException;

    /**
     * Opens a new connection to the database specified, using the credentials supplied, falling
     * back to default credentials if the username is null. A liveness check is performed before
     * returning.
     *
     * @param database
     *            the database name
     * @param username
     *            the username, possibly null
     * @param password
     *            the user password, possibly null
     * @return the created {@code Connection}
     * @throws StardogException
     *             in case the server cannot be reached or fails the liveness check
     * @throws UsageException
     *             in case this {@code Stardog} instance has been closed
     */
    Connection newConnection(String database, @Nullable String username,
            @Nullable String password) throws StardogException;

    /**
     * Tests whether this {@code Stardog} instance has been closed.
     *
     * @return true, if this {@code Stardog} instance has been closed
     */
    boolean isClosed();

    /**
     * {@inheritDoc} Closes the {@code Stardog} instance together with all the connections still
     * open, releasing any resource possibly allocated. Calling this method additional times has
     * no effect.
     */
    @Override
    void close();

}
