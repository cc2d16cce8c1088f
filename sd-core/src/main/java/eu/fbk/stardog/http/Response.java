package eu.fbk.stardog.http;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.Locale;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.ByteStreams;
import com.google.common.net.MediaType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The response to a {@link Request}.
 * <p>
 * A response exposes the HTTP status, the response headers (looked up case-insensitively) and
 * the body as an {@code InputStream} that may be backed by an open network connection. It MUST
 * be closed after use; closing releases the body and the optional transport resource attached at
 * creation time, exactly once, and further calls to {@link #close()} have no effect.
 * </p>
 */
public final class Response implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Response.class);

    private final int status;

    private final Map<String, String> headers; // lowercase name -> value

    private final InputStream body;

    @Nullable
    private final Closeable resource;

    private boolean closed;

    private Response(final int status, final Map<String, String> headers,
            final InputStream body, @Nullable final Closeable resource) {
        final ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        for (final Map.Entry<String, String> entry : headers.entrySet()) {
            builder.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue());
        }
        this.status = status;
        this.headers = builder.build();
        this.body = Preconditions.checkNotNull(body);
        this.resource = resource;
        this.closed = false;
    }

    /**
     * Creates a response over a body stream, optionally attaching a resource (e.g., a pooled
     * connection) to be released when the response is closed.
     */
    public static Response create(final int status, final Map<String, String> headers,
            final InputStream body, @Nullable final Closeable resource) {
        return new Response(status, headers, body, resource);
    }

    public static Response create(final int status, final Map<String, String> headers,
            final byte[] body) {
        return new Response(status, headers, new ByteArrayInputStream(body), null);
    }

    public int getStatus() {
        return this.status;
    }

    public boolean isSuccessful() {
        return this.status / 100 == 2;
    }

    public Map<String, String> getHeaders() {
        return this.headers;
    }

    @Nullable
    public String getHeader(final String name) {
        return this.headers.get(name.toLowerCase(Locale.ROOT));
    }

    @Nullable
    public MediaType getMediaType() {
        final String contentType = getHeader("Content-Type");
        if (contentType != null) {
            try {
                return MediaType.parse(contentType);
            } catch (final IllegalArgumentException ex) {
                LOGGER.debug("Ignoring invalid Content-Type: {}", contentType);
            }
        }
        return null;
    }

    public Charset getCharset() {
        final MediaType mediaType = getMediaType();
        return mediaType == null ? Charsets.UTF_8 : mediaType.charset().or(Charsets.UTF_8);
    }

    public synchronized InputStream getBody() {
        Preconditions.checkState(!this.closed, "Response has been closed");
        return this.body;
    }

    public byte[] readBytes() throws IOException {
        try {
            return ByteStreams.toByteArray(getBody());
        } finally {
            close();
        }
    }

    public String readString() throws IOException {
        final Charset charset = getCharset();
        return new String(readBytes(), charset);
    }

    public synchronized boolean isClosed() {
        return this.closed;
    }

    @Override
    public synchronized void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        try {
            this.body.close();
        } catch (final IOException ex) {
            LOGGER.warn("Exception caught while closing response body", ex);
        } finally {
            if (this.resource != null) {
                try {
                    this.resource.close();
                } catch (final IOException ex) {
                    LOGGER.warn("Exception caught while releasing response resource", ex);
                }
            }
        }
    }

    @Override
    public String toString() {
        final String contentType = getHeader("Content-Type");
        return this.status + (contentType == null ? "" : ", " + contentType);
    }

}
