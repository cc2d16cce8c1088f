package eu.fbk.stardog;

/**
 * Signals that the commit of a transaction failed after being requested, so that whether the
 * transaction has been persisted by the server is unknown.
 * <p>
 * When this exception is thrown the connection is left in state
 * {@link TransactionState#INDETERMINATE}: the transaction identifier is discarded and no further
 * operation may be attempted on that transaction. A new transaction can be started with
 * {@link Connection#begin()}. The failure that caused the exception (a {@link StardogException}
 * for a server rejection, or a {@link TransportException}) is available via {@link #getCause()}.
 * </p>
 */
public class IndeterminateTransactionException extends StardogException {

    private static final long serialVersionUID = 1L;

    private final String transactionID;

    public IndeterminateTransactionException(final String transactionID,
            final StardogException cause) {
        super("Commit of transaction " + transactionID + " failed, outcome unknown: "
                + cause.getMessage(), cause);
        this.transactionID = transactionID;
    }

    public String getTransactionID() {
        return this.transactionID;
    }

    @Override
    public StardogException getCause() {
        return (StardogException) super.getCause();
    }

}
