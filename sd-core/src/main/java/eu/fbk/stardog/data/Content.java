package eu.fbk.stardog.data;

import java.io.File;
import java.net.URL;

import javax.annotation.Nullable;

import com.google.common.base.Charsets;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.io.ByteSource;
import com.google.common.io.Files;
import com.google.common.io.Resources;

import org.openrdf.rio.RDFFormat;

/**
 * A piece of data to be uploaded to the server.
 * <p>
 * A Content can be created from a string ({@link #raw(String, String)}), a local file (
 * {@link #file(File)}) or a remote resource ({@link #url(URL)}). Each kind yields the bytes to
 * send, the media type to declare and an optional content encoding; bytes are read only when the
 * content is actually sent, so a {@code Content} may be reused for multiple uploads. The
 * named-graph context the data should go to can be set with {@link #withContext(String)}.
 * </p>
 * <p>
 * Instances are immutable.
 * </p>
 */
public abstract class Content {

    /** Content encoding of gzip compressed data. */
    public static final String GZIP = "gzip";

    @Nullable
    private final String context;

    Content(@Nullable final String context) {
        this.context = context;
    }

    /**
     * Creates a Content wrapping the supplied text, encoded in UTF-8.
     *
     * @param text
     *            the text
     * @param mediaType
     *            the media type, e.g., {@code text/turtle}
     * @return the created Content
     */
    public static Content raw(final String text, final String mediaType) {
        return new Raw(Preconditions.checkNotNull(text), Preconditions.checkNotNull(mediaType),
                null);
    }

    /**
     * Creates a Content for the supplied file, inferring the media type from its extension. A
     * {@code .gz} suffix marks the data as gzip encoded and is ignored for the purpose of media
     * type detection (e.g., {@code data.ttl.gz} is Turtle).
     *
     * @param file
     *            the file
     * @return the created Content
     * @throws IllegalArgumentException
     *             if the media type cannot be inferred from the file name
     */
    public static Content file(final File file) {
        return file(file, null);
    }

    /**
     * Creates a Content for the supplied file, using the media type specified, if not null.
     *
     * @param file
     *            the file
     * @param mediaType
     *            the media type, null to infer it from the file extension
     * @return the created Content
     */
    public static Content file(final File file, @Nullable final String mediaType) {
        final String name = file.getName();
        return new FileContent(file, mediaType != null ? mediaType : detectMediaType(name),
                encodingFor(name), null);
    }

    /**
     * Creates a Content for the resource at the supplied URL, inferring the media type from the
     * URL path.
     *
     * @param url
     *            the URL, read only when the content is sent
     * @return the created Content
     */
    public static Content url(final URL url) {
        return url(url, null);
    }

    /**
     * Creates a Content for the resource at the supplied URL, using the media type specified, if
     * not null.
     *
     * @param url
     *            the URL, read only when the content is sent
     * @param mediaType
     *            the media type, null to infer it from the URL path
     * @return the created Content
     */
    public static Content url(final URL url, @Nullable final String mediaType) {
        final String path = url.getPath();
        return new UrlContent(url, mediaType != null ? mediaType : detectMediaType(path),
                encodingFor(path), null);
    }

    /**
     * Returns a copy of this Content targeting the named graph specified.
     *
     * @param context
     *            the named graph IRI, null for the default graph
     * @return the resulting Content
     */
    public abstract Content withContext(@Nullable String context);

    /**
     * Returns the source of the bytes to send, possibly encoded according to
     * {@link #getEncoding()}.
     *
     * @return a byte source, opened when the content is sent
     */
    public abstract ByteSource getSource();

    public abstract String getMediaType();

    @Nullable
    public abstract String getEncoding();

    /**
     * Returns the name of this Content, used as file name when uploading it as a document.
     *
     * @return the file name or the last segment of the URL path, null for raw content
     */
    @Nullable
    public abstract String getName();

    @Nullable
    public final String getContext() {
        return this.context;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(getClass().getSimpleName()).omitNullValues()
                .add("name", getName()).add("mediaType", getMediaType())
                .add("encoding", getEncoding()).add("context", this.context).toString();
    }

    private static String detectMediaType(final String name) {
        final String stripped = name.endsWith(".gz") ? name.substring(0, name.length() - 3) : name;
        final RDFFormat format = RDFFormat.forFileName(stripped);
        if (format != null) {
            return format.getDefaultMIMEType();
        }
        final String lower = stripped.toLowerCase();
        if (lower.endsWith(".txt")) {
            return "text/plain";
        } else if (lower.endsWith(".pdf")) {
            return "application/pdf";
        } else if (lower.endsWith(".graphql") || lower.endsWith(".gql")) {
            return "application/graphql";
        }
        throw new IllegalArgumentException("Cannot infer media type of " + name);
    }

    @Nullable
    private static String encodingFor(final String name) {
        return name.endsWith(".gz") ? GZIP : null;
    }

    private static String lastSegment(final String path) {
        final int index = path.lastIndexOf('/');
        return index < 0 ? path : path.substring(index + 1);
    }

    private static final class Raw extends Content {

        private final String text;

        private final String mediaType;

        Raw(final String text, final String mediaType, @Nullable final String context) {
            super(context);
            this.text = text;
            this.mediaType = mediaType;
        }

        @Override
        public Content withContext(@Nullable final String context) {
            return new Raw(this.text, this.mediaType, context);
        }

        @Override
        public ByteSource getSource() {
            return ByteSource.wrap(this.text.getBytes(Charsets.UTF_8));
        }

        @Override
        public String getMediaType() {
            return this.mediaType;
        }

        @Override
        public String getEncoding() {
            return null;
        }

        @Override
        public String getName() {
            return null;
        }

    }

    private static final class FileContent extends Content {

        private final File file;

        private final String mediaType;

        @Nullable
        private final String encoding;

        FileContent(final File file, final String mediaType, @Nullable final String encoding,
                @Nullable final String context) {
            super(context);
            this.file = file;
            this.mediaType = mediaType;
            this.encoding = encoding;
        }

        @Override
        public Content withContext(@Nullable final String context) {
            return new FileContent(this.file, this.mediaType, this.encoding, context);
        }

        @Override
        public ByteSource getSource() {
            return Files.asByteSource(this.file);
        }

        @Override
        public String getMediaType() {
            return this.mediaType;
        }

        @Override
        public String getEncoding() {
            return this.encoding;
        }

        @Override
        public String getName() {
            return this.file.getName();
        }

    }

    private static final class UrlContent extends Content {

        private final URL url;

        private final String mediaType;

        @Nullable
        private final String encoding;

        UrlContent(final URL url, final String mediaType, @Nullable final String encoding,
                @Nullable final String context) {
            super(context);
            this.url = url;
            this.mediaType = mediaType;
            this.encoding = encoding;
        }

        @Override
        public Content withContext(@Nullable final String context) {
            return new UrlContent(this.url, this.mediaType, this.encoding, context);
        }

        @Override
        public ByteSource getSource() {
            return Resources.asByteSource(this.url);
        }

        @Override
        public String getMediaType() {
            return this.mediaType;
        }

        @Override
        public String getEncoding() {
            return this.encoding;
        }

        @Override
        public String getName() {
            return lastSegment(this.url.getPath());
        }

    }

}
