package eu.fbk.stardog;

import javax.annotation.Nullable;

/**
 * Signals the failure of a Stardog operation.
 * <p>
 * This exception is thrown every time the server rejects a request with a non-2xx status. The
 * HTTP status ({@link #getStatus()}), the server error code ({@link #getCode()}) and the server
 * message ({@link #getServerMessage()}) are preserved verbatim, as callers usually match on them;
 * method {@link #getMessage()} combines them as {@code [status] code: message}. Sub-classes
 * signal failures that did not originate from a server rejection: {@link TransportException} for
 * connection level failures and {@link IndeterminateTransactionException} for commits whose
 * outcome is unknown.
 * </p>
 * <p>
 * Operations never retry: recovering from a failure is always a decision of the caller.
 * </p>
 */
public class StardogException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int status;

    @Nullable
    private final String code;

    @Nullable
    private final String serverMessage;

    /**
     * Creates a new instance for a server rejection.
     *
     * @param status
     *            the HTTP status returned by the server
     * @param code
     *            the server error code, possibly null
     * @param serverMessage
     *            the server error message, possibly null
     */
    public StardogException(final int status, @Nullable final String code,
            @Nullable final String serverMessage) {
        super(messageFor(status, code, serverMessage));
        this.status = status;
        this.code = code;
        this.serverMessage = serverMessage;
    }

    /**
     * Creates a new instance not associated to a server rejection, e.g., for a response that
     * could not be decoded.
     *
     * @param message
     *            the exception message
     * @param cause
     *            the optional cause
     */
    public StardogException(final String message, @Nullable final Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.code = null;
        this.serverMessage = null;
    }

    /**
     * Returns the HTTP status returned by the server.
     *
     * @return the HTTP status, 0 if no response was received
     */
    public int getStatus() {
        return this.status;
    }

    /**
     * Returns the error code returned by the server, if any.
     *
     * @return the error code, e.g. {@code UnknownQuery}; null if not available
     */
    @Nullable
    public String getCode() {
        return this.code;
    }

    /**
     * Returns the unmodified error message returned by the server, if any.
     *
     * @return the server message; null if not available
     */
    @Nullable
    public String getServerMessage() {
        return this.serverMessage;
    }

    private static String messageFor(final int status, @Nullable final String code,
            @Nullable final String serverMessage) {
        final StringBuilder builder = new StringBuilder();
        builder.append('[').append(status).append(']');
        if (code != null) {
            builder.append(' ').append(code).append(':');
        }
        if (serverMessage != null) {
            builder.append(' ').append(serverMessage);
        }
        return builder.toString();
    }

}
