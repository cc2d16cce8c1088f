package eu.fbk.stardog;

import java.util.Iterator;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.Lists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class AbstractStardog implements Stardog {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractStardog.class);

    private final List<Connection> connections;

    private boolean closed;

    protected AbstractStardog() {
        this.connections = Lists.newLinkedList();
        this.closed = false;
    }

    @Override
    public final Connection newConnection(final String database) throws StardogException {
        return newConnection(database, null, null);
    }

    @Override
    public final synchronized Connection newConnection(final String database,
            @Nullable final String username, @Nullable final String password)
            throws StardogException {
        checkNotClosed();
        evictClosedConnections();
        final Connection connection = doNewConnection(database, username, password);
        this.connections.add(connection);
        return connection;
    }

    @Override
    public final synchronized void close() {
        if (!this.closed) {
            for (final Connection connection : this.connections) {
                try {
                    connection.close();
                } catch (final Throwable ex) {
                    LOGGER.error("Error closing connection: " + ex.getMessage(), ex);
                }
            }
            this.connections.clear();
            try {
                doClose();
            } finally {
                this.closed = true;
            }
        }
    }

    @Override
    public final synchronized boolean isClosed() {
        return this.closed;
    }

    @Override
    public synchronized String toString() {
        return getClass().getSimpleName() + "[" + (this.closed ? "closed" : "open") + ", "
                + this.connections.size() + " connections]";
    }

    protected final void checkNotClosed() {
        if (this.closed) {
            throw new UsageException("Stardog instance has been closed");
        }
    }

    private void evictClosedConnections() {
        for (final Iterator<Connection> i = this.connections.iterator(); i.hasNext();) {
            if (i.next().getState() == TransactionState.CLOSED) {
                i.remove();
            }
        }
    }

    protected abstract Connection doNewConnection(String database, @Nullable String username,
            @Nullable String password) throws StardogException;

    protected void doClose() {
    }

}
