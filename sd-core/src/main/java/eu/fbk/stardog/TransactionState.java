package eu.fbk.stardog;

/**
 * The transaction state of a {@link Connection}.
 * <p>
 * State transitions are: {@code INACTIVE --begin--> ACTIVE}, {@code ACTIVE --commit--> INACTIVE},
 * {@code ACTIVE --rollback--> INACTIVE}, {@code ACTIVE --commit failure--> INDETERMINATE},
 * {@code INDETERMINATE --begin--> ACTIVE} and {@code any --close--> CLOSED}.
 * </p>
 */
public enum TransactionState {

    /** No transaction is open; reads execute as isolated implicit transactions. */
    INACTIVE,

    /** A server transaction is open and attached to every request. */
    ACTIVE,

    /** The last commit failed and it is unknown whether its changes were persisted. */
    INDETERMINATE,

    /** The connection has been closed. */
    CLOSED;

    public boolean isActive() {
        return this == ACTIVE;
    }

}
