package eu.fbk.stardog;

import javax.annotation.Nullable;

/**
 * Signals that a request could not be exchanged with the server.
 * <p>
 * Thrown when the server cannot be reached, when the connection fails while sending the request
 * or reading the response, or when a transport timeout expires. No HTTP status is available
 * ({@link #getStatus()} returns 0). The request may or may not have been processed by the server.
 * </p>
 */
public class TransportException extends StardogException {

    private static final long serialVersionUID = 1L;

    public TransportException(final String message, @Nullable final Throwable cause) {
        super(message, cause);
    }

}
