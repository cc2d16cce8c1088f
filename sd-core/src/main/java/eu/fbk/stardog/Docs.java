package eu.fbk.stardog;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import eu.fbk.stardog.Operation.Download;
import eu.fbk.stardog.data.Content;
import eu.fbk.stardog.internal.Decoding;
import eu.fbk.stardog.internal.Protocol;

/**
 * The document store (BITES) of a database.
 * <p>
 * Documents are binary files identified by name, stored alongside the RDF data but outside of
 * its transactions: none of the methods require, nor take part to, the active transaction of the
 * connection. Document contents are read through a {@link Download} operation, either buffered
 * or streamed.
 * </p>
 */
public final class Docs {

    private final DefaultConnection connection;

    Docs(final DefaultConnection connection) {
        this.connection = connection;
    }

    /**
     * Returns the number of documents in the store.
     *
     * @return the document count
     * @throws StardogException
     *             in case of failure
     */
    public long size() throws StardogException {
        synchronized (this.connection) {
            return this.connection.execute("DOCS SIZE", () -> Decoding.readLong(this.connection
                    .send(this.connection.get(Protocol.PATH_DOCS, Protocol.PATH_SIZE).build())));
        }
    }

    /**
     * Stores a document, replacing any document with the same name.
     *
     * @param name
     *            the document name
     * @param content
     *            the document content
     * @throws StardogException
     *             in case of failure
     */
    public void add(final String name, final Content content) throws StardogException {
        Preconditions.checkArgument(!name.isEmpty(), "Empty document name");
        synchronized (this.connection) {
            this.connection.execute("DOCS ADD", () -> {
                Decoding.readText(this.connection.send(this.connection.post(Protocol.PATH_DOCS)
                        .part(Protocol.PARAMETER_UPLOAD, name, content.getSource(),
                                content.getMediaType()).build()));
                return null;
            }, null, name, null, content);
        }
    }

    /**
     * Returns an operation retrieving the content of a document.
     *
     * @param name
     *            the document name
     * @return the created operation object
     */
    public Download get(final String name) {
        Preconditions.checkArgument(!name.isEmpty(), "Empty document name");
        synchronized (this.connection) {
            this.connection.checkOpen();
            return this.connection.newDownload("DOCS GET", Protocol.path(
                    this.connection.getDatabase(), Protocol.PATH_DOCS, name), Protocol.MIME_ANY,
                    null);
        }
    }

    /**
     * Deletes a document.
     *
     * @param name
     *            the document name
     * @throws StardogException
     *             in case of failure (e.g., the document does not exist)
     */
    public void delete(final String name) throws StardogException {
        Preconditions.checkArgument(!name.isEmpty(), "Empty document name");
        synchronized (this.connection) {
            this.connection.execute("DOCS DELETE", () -> {
                Decoding.readText(this.connection.send(this.connection.delete(
                        Protocol.PATH_DOCS, name).build()));
                return null;
            }, null, name);
        }
    }

    /**
     * Deletes all the documents in the store.
     *
     * @throws StardogException
     *             in case of failure
     */
    public void clear() throws StardogException {
        synchronized (this.connection) {
            this.connection.execute("DOCS CLEAR", () -> {
                Decoding.readText(this.connection.send(this.connection.delete(
                        Protocol.PATH_DOCS).build()));
                return null;
            });
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).addValue(this.connection.getDatabase())
                .toString();
    }

}
