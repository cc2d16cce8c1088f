package eu.fbk.stardog;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import eu.fbk.stardog.data.Content;
import eu.fbk.stardog.http.Request;
import eu.fbk.stardog.internal.Decoding;
import eu.fbk.stardog.internal.Protocol;

/**
 * Integrity constraint validation on a database.
 * <p>
 * Constraints are RDF documents (e.g., OWL axioms or SHACL shapes) that are either supplied with
 * each validation call or persisted in the database constraint set through
 * {@link #add(Content)}, {@link #remove(Content)} and {@link #clear()}. Validation is performed
 * on committed data; no method takes part to the active transaction.
 * </p>
 */
public final class ICV {

    private final DefaultConnection connection;

    ICV(final DefaultConnection connection) {
        this.connection = connection;
    }

    /**
     * Checks whether the database satisfies the constraints supplied.
     *
     * @param constraints
     *            the constraints
     * @return true, if there are no violations
     * @throws StardogException
     *             in case of failure
     */
    public boolean isValid(final Content constraints) throws StardogException {
        return isValid(constraints, null);
    }

    /**
     * Checks whether a graph of the database satisfies the constraints supplied.
     *
     * @param constraints
     *            the constraints
     * @param graph
     *            the graph IRI; null to validate the whole database
     * @return true, if there are no violations
     * @throws StardogException
     *             in case of failure
     */
    public boolean isValid(final Content constraints, @Nullable final String graph)
            throws StardogException {
        synchronized (this.connection) {
            return this.connection.execute("ICV VALIDATE", () -> Decoding
                    .readBooleanText(this.connection.send(newRequest(Protocol.PATH_VALIDATE,
                            constraints, graph).accept(Protocol.MIME_TEXT).build())), null,
                    constraints, "graph", graph);
        }
    }

    /**
     * Returns the violations of the constraints supplied, one RDF document per violation.
     *
     * @param constraints
     *            the constraints
     * @return the violation documents, empty if the database is valid
     * @throws StardogException
     *             in case of failure
     */
    public List<String> explainViolations(final Content constraints) throws StardogException {
        return explainViolations(constraints, null);
    }

    /**
     * Returns the violations of the constraints supplied in a graph of the database, one RDF
     * document per violation.
     *
     * @param constraints
     *            the constraints
     * @param graph
     *            the graph IRI; null to validate the whole database
     * @return the violation documents, empty if the graph is valid
     * @throws StardogException
     *             in case of failure
     */
    public List<String> explainViolations(final Content constraints,
            @Nullable final String graph) throws StardogException {
        synchronized (this.connection) {
            return this.connection.execute("ICV VIOLATIONS", () -> Decoding
                    .readMultipart(this.connection.send(newRequest(Protocol.PATH_VIOLATIONS,
                            constraints, graph).accept(Protocol.MIME_MULTIPART).build())), null,
                    constraints, "graph", graph);
        }
    }

    /**
     * Converts the constraints supplied to the SPARQL queries used to check them.
     *
     * @param constraints
     *            the constraints
     * @return the text of the resulting queries
     * @throws StardogException
     *             in case of failure
     */
    public String convert(final Content constraints) throws StardogException {
        synchronized (this.connection) {
            return this.connection.execute("ICV CONVERT", () -> Decoding
                    .readText(this.connection.send(newRequest(Protocol.PATH_CONVERT,
                            constraints, null).accept(Protocol.MIME_TEXT).build())), null,
                    constraints);
        }
    }

    /**
     * Adds the constraints supplied to the constraint set of the database.
     *
     * @param constraints
     *            the constraints
     * @throws StardogException
     *             in case of failure
     */
    public void add(final Content constraints) throws StardogException {
        update("ICV ADD", Protocol.PATH_ADD, constraints);
    }

    /**
     * Removes the constraints supplied from the constraint set of the database.
     *
     * @param constraints
     *            the constraints
     * @throws StardogException
     *             in case of failure
     */
    public void remove(final Content constraints) throws StardogException {
        update("ICV REMOVE", Protocol.PATH_REMOVE, constraints);
    }

    /**
     * Removes all the constraints of the database.
     *
     * @throws StardogException
     *             in case of failure
     */
    public void clear() throws StardogException {
        synchronized (this.connection) {
            this.connection.execute("ICV CLEAR", () -> {
                Decoding.readText(this.connection.send(this.connection.post(Protocol.PATH_ICV,
                        Protocol.PATH_CLEAR).build()));
                return null;
            });
        }
    }

    private void update(final String operation, final String endpoint, final Content constraints)
            throws StardogException {
        synchronized (this.connection) {
            this.connection.execute(operation, () -> {
                Decoding.readText(this.connection.send(newRequest(endpoint, constraints, null)
                        .build()));
                return null;
            }, null, constraints);
        }
    }

    private Request.Builder newRequest(final String endpoint, final Content constraints,
            @Nullable final String graph) {
        Preconditions.checkNotNull(constraints);
        return this.connection.post(Protocol.PATH_ICV, endpoint)
                .entity(constraints.getSource(), constraints.getMediaType(),
                        constraints.getEncoding())
                .parameter(Protocol.PARAMETER_GRAPH, graph);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).addValue(this.connection.getDatabase())
                .toString();
    }

}
