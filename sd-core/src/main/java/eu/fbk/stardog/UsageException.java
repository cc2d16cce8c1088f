package eu.fbk.stardog;

/**
 * Signals an invalid sequence of calls on a {@code Connection}, detected locally.
 * <p>
 * Examples are calling {@link Connection#begin()} while a transaction is active, mutating data
 * or committing without an active transaction, opening a second stream while another one is
 * open, or using a closed connection. This exception is always thrown before any request is sent
 * to the server.
 * </p>
 */
public class UsageException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public UsageException(final String message) {
        super(message);
    }

}
