package eu.fbk.stardog.http;

import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Maps;
import com.google.common.io.ByteSource;

/**
 * An HTTP request addressed to the Stardog server.
 * <p>
 * A request consists of a method, a path relative to the server root (e.g., {@code db/query}),
 * an ordered list of parameters, a map of headers and an optional body, which is either a single
 * {@link Entity} or a list of multipart form {@link Part}s. Parameters of a {@code POST} or
 * {@code PUT} request without body are sent as a URL-encoded form body; otherwise they go in the
 * query string. Requests are immutable and are created via {@link #builder(String, String)}.
 * </p>
 */
public final class Request {

    public static final String GET = "GET";

    public static final String POST = "POST";

    public static final String PUT = "PUT";

    public static final String DELETE = "DELETE";

    private final String method;

    private final String path;

    private final ListMultimap<String, String> parameters;

    private final Map<String, String> headers;

    @Nullable
    private final Entity entity;

    private final List<Part> parts;

    private Request(final Builder builder) {
        this.method = builder.method;
        this.path = builder.path;
        this.parameters = builder.parameters.build();
        this.headers = ImmutableMap.copyOf(builder.headers);
        this.entity = builder.entity;
        this.parts = builder.parts.build();
    }

    public static Builder builder(final String method, final String path) {
        return new Builder(method, path);
    }

    public String getMethod() {
        return this.method;
    }

    public String getPath() {
        return this.path;
    }

    public ListMultimap<String, String> getParameters() {
        return this.parameters;
    }

    @Nullable
    public String getParameter(final String name) {
        final List<String> values = this.parameters.get(name);
        return values.isEmpty() ? null : values.get(0);
    }

    public Map<String, String> getHeaders() {
        return this.headers;
    }

    @Nullable
    public String getHeader(final String name) {
        for (final Map.Entry<String, String> entry : this.headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    @Nullable
    public Entity getEntity() {
        return this.entity;
    }

    public List<Part> getParts() {
        return this.parts;
    }

    /**
     * Returns true if the parameters of this request have to be sent as a URL-encoded form body.
     *
     * @return true for POST / PUT requests carrying neither an entity nor multipart parts
     */
    public boolean isFormEncoded() {
        return (POST.equals(this.method) || PUT.equals(this.method)) && this.entity == null
                && this.parts.isEmpty();
    }

    @Override
    public String toString() {
        return this.method + " " + this.path;
    }

    public static final class Builder {

        private final String method;

        private final String path;

        private final ImmutableListMultimap.Builder<String, String> parameters;

        private final Map<String, String> headers;

        @Nullable
        private Entity entity;

        private final ImmutableList.Builder<Part> parts;

        Builder(final String method, final String path) {
            this.method = Preconditions.checkNotNull(method);
            this.path = Preconditions.checkNotNull(path);
            this.parameters = ImmutableListMultimap.builder();
            this.headers = Maps.newLinkedHashMap();
            this.parts = ImmutableList.builder();
        }

        /**
         * Adds a parameter, unless the value is null. Null values are skipped so that options not
         * supplied by the caller never reach the wire.
         */
        public Builder parameter(final String name, @Nullable final Object value) {
            if (value != null) {
                this.parameters.put(name, value.toString());
            }
            return this;
        }

        public Builder parameters(final String name, @Nullable final Iterable<?> values) {
            if (values != null) {
                for (final Object value : values) {
                    parameter(name, value);
                }
            }
            return this;
        }

        public Builder header(final String name, @Nullable final String value) {
            if (value != null) {
                this.headers.put(name, value);
            }
            return this;
        }

        public Builder accept(final String mediaType) {
            return header("Accept", mediaType);
        }

        public Builder entity(final ByteSource source, final String mediaType,
                @Nullable final String encoding) {
            this.entity = new Entity(source, mediaType, encoding);
            return this;
        }

        public Builder part(final String name, final String filename, final ByteSource source,
                final String mediaType) {
            this.parts.add(new Part(name, filename, source, mediaType));
            return this;
        }

        public Request build() {
            final Request request = new Request(this);
            Preconditions.checkState(request.entity == null || request.parts.isEmpty(),
                    "Cannot send both an entity and multipart parts");
            return request;
        }

    }

    /**
     * The body of a request, with its media type and optional content encoding.
     */
    public static final class Entity {

        private final ByteSource source;

        private final String mediaType;

        @Nullable
        private final String encoding;

        Entity(final ByteSource source, final String mediaType, @Nullable final String encoding) {
            this.source = Preconditions.checkNotNull(source);
            this.mediaType = Preconditions.checkNotNull(mediaType);
            this.encoding = encoding;
        }

        public ByteSource getSource() {
            return this.source;
        }

        public String getMediaType() {
            return this.mediaType;
        }

        @Nullable
        public String getEncoding() {
            return this.encoding;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).omitNullValues()
                    .add("mediaType", this.mediaType).add("encoding", this.encoding).toString();
        }

    }

    /**
     * A file part of a {@code multipart/form-data} request body.
     */
    public static final class Part {

        private final String name;

        private final String filename;

        private final ByteSource source;

        private final String mediaType;

        Part(final String name, final String filename, final ByteSource source,
                final String mediaType) {
            this.name = Preconditions.checkNotNull(name);
            this.filename = Preconditions.checkNotNull(filename);
            this.source = Preconditions.checkNotNull(source);
            this.mediaType = Preconditions.checkNotNull(mediaType);
        }

        public String getName() {
            return this.name;
        }

        public String getFilename() {
            return this.filename;
        }

        public ByteSource getSource() {
            return this.source;
        }

        public String getMediaType() {
            return this.mediaType;
        }

        @Override
        public String toString() {
            return this.name + "=" + this.filename + " (" + this.mediaType + ")";
        }

    }

}
