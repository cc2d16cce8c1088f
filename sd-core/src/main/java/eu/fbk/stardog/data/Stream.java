package eu.fbk.stardog.data;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.Callable;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.Lists;
import com.google.common.collect.UnmodifiableIterator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A stream of typed elements that can be consumed at most once.
 * <p>
 * A Stream returns a sequence of elements (e.g., the chunks of a response body streamed from the
 * server) one at a time, after which it is no more usable. The sequence is lazy, finite and
 * forward-only: no restart and no random access are possible.
 * </p>
 * <p>
 * A Stream is created via {@link #read(InputStream, int)}, which splits the bytes of an
 * {@code InputStream} in chunks of fixed maximum size, or by subclassing the Stream class and
 * overriding protected method {@link #doIterator()} and possibly {@link #doClose()}.
 * </p>
 * <p>
 * Method {@link #iterator()} consumes the elements of the stream and can be invoked at most once.
 * Before invoking it, the Stream is {@link #isAvailable() available}; after invoking it, the
 * Stream is <i>consumed</i> and invoking it again results in an {@code IllegalStateException}.
 * </p>
 * <p>
 * Streams implement {@link Iterable}, hence can be used in enhanced {@code for} loops, and
 * {@link Closeable}, as they may wrap resources (e.g., network connections) that need to be
 * released; the intended usage is within a try-with-resources block that bounds the lifetime of
 * those resources. Resources are released exactly once: when iteration reaches the end of the
 * sequence, when {@link #close()} is called, or when iteration fails with an exception (which is
 * propagated after the release). Reading from a closed Stream fails with an
 * {@code IllegalStateException}; closing is idempotent.
 * </p>
 *
 * @param <T>
 *            the type of element returned by the Stream
 */
public abstract class Stream<T> implements Iterable<T>, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Stream.class);

    /** The chunk size used by {@link #read(InputStream)}. */
    public static final int DEFAULT_CHUNK_SIZE = 8192;

    private final List<Object> closeObjects;

    private boolean available;

    private boolean closed;

    /**
     * Constructor for use by sub-classes.
     */
    protected Stream() {
        this.closeObjects = Lists.newArrayList();
        this.available = true;
        this.closed = false;
    }

    /**
     * Creates a Stream of byte chunks of at most {@link #DEFAULT_CHUNK_SIZE} bytes read from the
     * supplied {@code InputStream}.
     *
     * @param in
     *            the {@code InputStream} to read, closed when the Stream is closed
     * @return the created Stream
     * @see #read(InputStream, int)
     */
    public static Stream<byte[]> read(final InputStream in) {
        return read(in, DEFAULT_CHUNK_SIZE);
    }

    /**
     * Creates a Stream of byte chunks read lazily from the supplied {@code InputStream}. Each
     * chunk contains at most {@code chunkSize} bytes (the last one possibly fewer) and the
     * concatenation of all the chunks is the full content of the {@code InputStream}. The
     * {@code InputStream} is closed exactly once when the Stream is exhausted, closed or fails.
     * An {@code IOException} raised while reading is propagated as an
     * {@code UncheckedIOException}, after the Stream is closed.
     *
     * @param in
     *            the {@code InputStream} to read, closed when the Stream is closed
     * @param chunkSize
     *            the maximum size of chunks, greater than zero
     * @return the created Stream
     */
    public static Stream<byte[]> read(final InputStream in, final int chunkSize) {
        Preconditions.checkNotNull(in);
        Preconditions.checkArgument(chunkSize > 0, "Invalid chunk size %s", chunkSize);
        return new ChunkStream(in, chunkSize);
    }

    /**
     * Returns an Iterator over the elements of this Stream. The Stream is
     * closed as soon as the Iterator reports no more elements, or an exception is thrown while
     * advancing it. {@inheritDoc}
     */
    @Override
    public final synchronized Iterator<T> iterator() {
        checkState();
        this.available = false;
        final Iterator<T> iterator;
        try {
            iterator = new CheckedIterator<T>(doIterator(), this);
        } catch (final Throwable ex) {
            close();
            Throwables.propagateIfPossible(ex);
            throw new RuntimeException(ex);
        }
        return iterator;
    }

    /**
     * Checks whether this Stream is available, i.e., {@link #iterator()} can be called.
     * Iterating or closing the Stream will make it non-available.
     *
     * @return true, if the Stream is available
     */
    public final synchronized boolean isAvailable() {
        return this.available;
    }

    /**
     * Checks whether this Stream has been closed. Note that a Stream is automatically closed when
     * iteration of its elements completes.
     *
     * @return true, if the Stream has been closed
     */
    public final synchronized boolean isClosed() {
        return this.closed;
    }

    /**
     * Register zero or more objects for activation when this {@code Stream} will be closed. Each
     * supplied object can be a {@code Closeable}, in which case method {@link Closeable#close()}
     * will be called, a {@code Runnable}, in which case method {@link Runnable#run()} will be
     * called, or a {@code Callable}, in which case method {@link Callable#call()} will be called;
     * any other type of object will be rejected. In case the {@code Stream} has already been
     * closed, activation of supplied objects will be done immediately.
     *
     * @param objects
     *            the objects to activate when the {@code Stream} will be closed
     * @return this {@code Stream}, for call chaining.
     */
    public final synchronized Stream<T> onClose(final Object... objects) {
        for (final Object object : objects) {
            if (!(object instanceof Closeable) && !(object instanceof Runnable)
                    && !(object instanceof Callable)) {
                throw new IllegalArgumentException("Illegal object: " + object);
            } else if (this.closed) {
                closeAction(object);
            } else {
                boolean alreadyContained = false;
                for (final Object o : this.closeObjects) {
                    if (o == object) {
                        alreadyContained = true;
                        break;
                    }
                }
                if (!alreadyContained) {
                    this.closeObjects.add(object);
                }
            }
        }
        return this;
    }

    /**
     * Closes this {@code Stream} and releases any resource associated to it. If this
     * {@code Stream} has already been closed, then calling this method has no effect.
     */
    @Override
    public final synchronized void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        this.available = false;
        try {
            doClose();
        } catch (final Throwable ex) {
            LOGGER.error("Error closing " + this, ex);
        }
        for (final Object object : this.closeObjects) {
            closeAction(object);
        }
        this.closeObjects.clear();
    }

    @Override
    public String toString() {
        final String name = getClass().getSimpleName();
        final String args = doToString();
        return (name.isEmpty() ? "anon-Stream" : name) + (args == null ? "" : "<" + args + ">");
    }

    private void checkState() {
        if (this.closed) {
            throw new IllegalStateException("Stream already closed: " + this);
        } else if (!this.available) {
            throw new IllegalStateException("Stream already being iterated: " + this);
        }
    }

    private void closeAction(final Object object) {
        try {
            if (object instanceof Closeable) {
                ((Closeable) object).close();
            } else if (object instanceof Runnable) {
                ((Runnable) object).run();
            } else if (object instanceof Callable<?>) {
                ((Callable<?>) object).call();
            }
        } catch (final Throwable ex) {
            LOGGER.error("Error performing close action on " + object, ex);
        }
    }

    /**
     * Implementation method responsible of producing an Iterator over the elements of the Stream.
     * This method is called by {@link #iterator()} with the guarantee that it is called at most
     * once and with the Stream in the <i>available</i> state.
     *
     * @return an Iterator over the elements of the Stream
     * @throws Throwable
     *             in case of failure
     */
    protected abstract Iterator<T> doIterator() throws Throwable;

    /**
     * Implementation method supporting the generation of a string representation of this Stream.
     *
     * @return an optional string with the arguments / state characterizing this {@code Stream},
     *         possibly null
     */
    @Nullable
    protected String doToString() {
        return null;
    }

    /**
     * Implementation method responsible of closing optional resources associated to this Stream.
     * It is called exactly once. The default implementation does nothing.
     *
     * @throws Throwable
     *             in case of failure
     */
    protected void doClose() throws Throwable {
    }

    private static final class CheckedIterator<T> extends UnmodifiableIterator<T> {

        private final Iterator<T> delegate;

        private final Stream<T> stream;

        private boolean exhausted;

        CheckedIterator(final Iterator<T> delegate, final Stream<T> stream) {
            this.delegate = delegate;
            this.stream = stream;
        }

        @Override
        public boolean hasNext() {
            if (this.exhausted) {
                return false;
            } else if (this.stream.isClosed()) {
                throw new IllegalStateException("Stream already closed: " + this.stream);
            }
            try {
                if (this.delegate.hasNext()) {
                    return true;
                }
            } catch (final RuntimeException ex) {
                this.stream.close();
                throw ex;
            }
            this.exhausted = true;
            this.stream.close();
            return false;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            try {
                return this.delegate.next();
            } catch (final RuntimeException ex) {
                this.stream.close();
                throw ex;
            }
        }

    }

    private static final class ChunkStream extends Stream<byte[]> {

        private final InputStream in;

        private final int chunkSize;

        ChunkStream(final InputStream in, final int chunkSize) {
            this.in = in;
            this.chunkSize = chunkSize;
        }

        @Override
        protected Iterator<byte[]> doIterator() {
            return new UnmodifiableIterator<byte[]>() {

                @Nullable
                private byte[] next;

                private boolean eof;

                @Override
                public boolean hasNext() {
                    if (this.next == null && !this.eof) {
                        this.next = readChunk();
                        this.eof = this.next == null;
                    }
                    return this.next != null;
                }

                @Override
                public byte[] next() {
                    if (!hasNext()) {
                        throw new NoSuchElementException();
                    }
                    final byte[] result = this.next;
                    this.next = null;
                    return result;
                }

            };
        }

        @Nullable
        private byte[] readChunk() {
            final byte[] buffer = new byte[this.chunkSize];
            int length = 0;
            try {
                while (length < buffer.length) {
                    final int n = this.in.read(buffer, length, buffer.length - length);
                    if (n < 0) {
                        break;
                    }
                    length += n;
                }
            } catch (final IOException ex) {
                throw new UncheckedIOException(ex);
            }
            return length == 0 ? null : length == buffer.length ? buffer : Arrays.copyOf(buffer,
                    length);
        }

        @Override
        protected String doToString() {
            return "chunk size " + this.chunkSize;
        }

        @Override
        protected void doClose() throws IOException {
            this.in.close();
        }

    }

}
