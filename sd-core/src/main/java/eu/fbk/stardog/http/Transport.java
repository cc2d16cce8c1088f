package eu.fbk.stardog.http;

import java.io.Closeable;

import eu.fbk.stardog.TransportException;

/**
 * The HTTP exchange primitive a {@code Connection} is built upon.
 * <p>
 * A {@code Transport} sends one authenticated {@link Request} to the Stardog server and returns
 * the corresponding {@link Response}, whatever its HTTP status: translating 4xx / 5xx statuses
 * into errors is a concern of the caller. A {@link TransportException} is thrown only when no
 * response could be obtained at all (connection refused, I/O failure, timeout). Transports never
 * retry requests.
 * </p>
 * <p>
 * The body of a returned {@code Response} may be backed by an open network connection, which is
 * held until the response is {@link Response#close() closed}. Implementations must be usable by
 * a single caller at a time; they are not required to be thread safe.
 * </p>
 */
public interface Transport extends Closeable {

    /**
     * Sends the request specified, returning the server response.
     *
     * @param request
     *            the request to send
     * @return the server response, for any HTTP status; to be closed by the caller
     * @throws TransportException
     *             in case the server could not be reached or the exchange failed before a
     *             response status was received
     */
    Response send(Request request) throws TransportException;

    /**
     * {@inheritDoc} Releases any resource (e.g., pooled connections) allocated to the transport.
     * Calling this method more than once has no effect.
     */
    @Override
    void close();

}
