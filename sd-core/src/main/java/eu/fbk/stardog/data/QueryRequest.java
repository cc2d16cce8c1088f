package eu.fbk.stardog.data;

import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * A query with its evaluation options.
 * <p>
 * Options are optional: an unset option is null (or empty, for collections) and is not sent to
 * the server, which then applies its own default. Bindings map a variable name (without
 * {@code ?} or {@code $}) to the textual form of an RDF term, e.g., {@code <urn:x>} or
 * {@code "5"^^<http://www.w3.org/2001/XMLSchema#integer>}, which is forwarded verbatim.
 * </p>
 */
public final class QueryRequest {

    private final QueryKind kind;

    private final String query;

    @Nullable
    private final Boolean reasoning;

    private final Map<String, String> bindings;

    @Nullable
    private final Long offset;

    @Nullable
    private final Long limit;

    @Nullable
    private final Long timeout;

    @Nullable
    private final String schema;

    private final List<String> defaultGraphs;

    private final List<String> namedGraphs;

    @Nullable
    private final String accept;

    private QueryRequest(final Builder builder) {
        this.kind = builder.kind;
        this.query = builder.query;
        this.reasoning = builder.reasoning;
        this.bindings = ImmutableMap.copyOf(builder.bindings);
        this.offset = builder.offset;
        this.limit = builder.limit;
        this.timeout = builder.timeout;
        this.schema = builder.schema;
        this.defaultGraphs = ImmutableList.copyOf(builder.defaultGraphs);
        this.namedGraphs = ImmutableList.copyOf(builder.namedGraphs);
        this.accept = builder.accept;
    }

    public static Builder builder(final QueryKind kind, final String query) {
        return new Builder(kind, query);
    }

    public QueryKind getKind() {
        return this.kind;
    }

    public String getQuery() {
        return this.query;
    }

    @Nullable
    public Boolean getReasoning() {
        return this.reasoning;
    }

    public Map<String, String> getBindings() {
        return this.bindings;
    }

    @Nullable
    public Long getOffset() {
        return this.offset;
    }

    @Nullable
    public Long getLimit() {
        return this.limit;
    }

    /**
     * Returns the query timeout in milliseconds, if set.
     */
    @Nullable
    public Long getTimeout() {
        return this.timeout;
    }

    /**
     * Returns the reasoning schema, if set.
     */
    @Nullable
    public String getSchema() {
        return this.schema;
    }

    public List<String> getDefaultGraphs() {
        return this.defaultGraphs;
    }

    public List<String> getNamedGraphs() {
        return this.namedGraphs;
    }

    /**
     * Returns the media type to request, defaulting to the one of the query kind.
     */
    public String getAccept() {
        return this.accept != null ? this.accept : this.kind.getAccept();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper("").omitNullValues().add("reasoning", this.reasoning)
                .add("offset", this.offset).add("limit", this.limit)
                .add("timeout", this.timeout).add("schema", this.schema)
                .add("bindings", this.bindings.isEmpty() ? null : this.bindings.keySet())
                .add("accept", this.accept).toString();
    }

    public static final class Builder {

        private final QueryKind kind;

        private final String query;

        @Nullable
        private Boolean reasoning;

        private final Map<String, String> bindings;

        @Nullable
        private Long offset;

        @Nullable
        private Long limit;

        @Nullable
        private Long timeout;

        @Nullable
        private String schema;

        private final List<String> defaultGraphs;

        private final List<String> namedGraphs;

        @Nullable
        private String accept;

        Builder(final QueryKind kind, final String query) {
            this.kind = Preconditions.checkNotNull(kind);
            this.query = Preconditions.checkNotNull(query);
            this.bindings = Maps.newLinkedHashMap();
            this.defaultGraphs = Lists.newArrayList();
            this.namedGraphs = Lists.newArrayList();
        }

        public Builder reasoning(@Nullable final Boolean reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder binding(final String name, final String term) {
            Preconditions.checkArgument(!name.isEmpty(), "Empty binding name");
            this.bindings.put(name, Preconditions.checkNotNull(term));
            return this;
        }

        public Builder offset(@Nullable final Long offset) {
            Preconditions.checkArgument(offset == null || offset >= 0, "Invalid offset %s",
                    offset);
            this.offset = offset;
            return this;
        }

        public Builder limit(@Nullable final Long limit) {
            Preconditions.checkArgument(limit == null || limit >= 0, "Invalid limit %s", limit);
            this.limit = limit;
            return this;
        }

        public Builder timeout(@Nullable final Long timeout) {
            Preconditions.checkArgument(timeout == null || timeout >= 0, "Invalid timeout %s",
                    timeout);
            this.timeout = timeout;
            return this;
        }

        public Builder schema(@Nullable final String schema) {
            this.schema = schema;
            return this;
        }

        public Builder defaultGraph(final String graph) {
            this.defaultGraphs.add(Preconditions.checkNotNull(graph));
            return this;
        }

        public Builder namedGraph(final String graph) {
            this.namedGraphs.add(Preconditions.checkNotNull(graph));
            return this;
        }

        public Builder accept(@Nullable final String accept) {
            this.accept = accept;
            return this;
        }

        public QueryRequest build() {
            return new QueryRequest(this);
        }

    }

}
