package eu.fbk.stardog;

import com.google.common.base.Charsets;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.io.ByteSource;

import eu.fbk.stardog.Operation.Ask;
import eu.fbk.stardog.Operation.Graph;
import eu.fbk.stardog.Operation.Paths;
import eu.fbk.stardog.Operation.Select;
import eu.fbk.stardog.internal.Decoding;
import eu.fbk.stardog.internal.Protocol;

/**
 * The version history of a database.
 * <p>
 * The history is exposed as an RDF graph that can be queried with the same query operations of
 * {@link Connection}, using vocabulary {@code tag:stardog:api:versioning:}. Queries over the
 * history never see the active transaction. Revisions can be tagged and the database can be
 * reverted to a previous revision; revisions are identified either by their bare ID or by their
 * full {@code tag:stardog:api:versioning:version:} IRI.
 * </p>
 */
public final class Versioning {

    private final DefaultConnection connection;

    private final QueryDispatcher dispatcher;

    Versioning(final DefaultConnection connection) {
        this.connection = connection;
        this.dispatcher = new QueryDispatcher(connection, "VCS ", Protocol.path(
                connection.getDatabase(), Protocol.PATH_VCS), false);
    }

    public Select select(final String query) {
        this.connection.checkOpen();
        return new Select(this.dispatcher, query);
    }

    public Ask ask(final String query) {
        this.connection.checkOpen();
        return new Ask(this.dispatcher, query);
    }

    public Graph graph(final String query) {
        this.connection.checkOpen();
        return new Graph(this.dispatcher, query);
    }

    public Paths paths(final String query) {
        this.connection.checkOpen();
        return new Paths(this.dispatcher, query);
    }

    /**
     * Assigns a tag to a revision.
     *
     * @param revision
     *            the revision ID or IRI
     * @param name
     *            the tag name
     * @throws StardogException
     *             in case of failure
     */
    public void createTag(final String revision, final String name) throws StardogException {
        Preconditions.checkArgument(!name.isEmpty(), "Empty tag name");
        send("VCS CREATE TAG", quote(toRevisionIRI(revision)) + ", " + quote(name),
                Protocol.PATH_TAGS, Protocol.PATH_CREATE);
    }

    /**
     * Deletes a tag.
     *
     * @param name
     *            the tag name
     * @throws StardogException
     *             in case of failure
     */
    public void deleteTag(final String name) throws StardogException {
        Preconditions.checkArgument(!name.isEmpty(), "Empty tag name");
        send("VCS DELETE TAG", name, Protocol.PATH_TAGS, Protocol.PATH_DELETE);
    }

    /**
     * Reverts the changes made between two revisions, recording a new revision with the message
     * supplied.
     *
     * @param fromRevision
     *            the revision ID or IRI whose changes are reverted
     * @param toRevision
     *            the revision ID or IRI the database is reverted to
     * @param message
     *            the message of the new revision
     * @throws StardogException
     *             in case of failure
     */
    public void revert(final String fromRevision, final String toRevision, final String message)
            throws StardogException {
        send("VCS REVERT", quote(toRevisionIRI(toRevision)) + ", "
                + quote(toRevisionIRI(fromRevision)) + ", " + quote(message),
                Protocol.PATH_REVERT);
    }

    private void send(final String operation, final String body, final String... segments)
            throws StardogException {
        final String[] path = new String[segments.length + 1];
        path[0] = Protocol.PATH_VCS;
        System.arraycopy(segments, 0, path, 1, segments.length);
        synchronized (this.connection) {
            this.connection.execute(operation, () -> {
                Decoding.readText(this.connection.send(this.connection.post(path)
                        .entity(ByteSource.wrap(body.getBytes(Charsets.UTF_8)),
                                Protocol.MIME_TEXT, null).build()));
                return null;
            }, null, body);
        }
    }

    static String toRevisionIRI(final String revision) {
        Preconditions.checkArgument(!revision.isEmpty(), "Empty revision");
        return revision.startsWith(Protocol.VERSION_PREFIX) ? revision
                : Protocol.VERSION_PREFIX + revision;
    }

    private static String quote(final String string) {
        return '"' + string.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).addValue(this.connection.getDatabase())
                .toString();
    }

}
