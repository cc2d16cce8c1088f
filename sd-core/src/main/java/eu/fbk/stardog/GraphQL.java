package eu.fbk.stardog;

import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.io.ByteSource;

import eu.fbk.stardog.data.Content;
import eu.fbk.stardog.internal.Decoding;
import eu.fbk.stardog.internal.Protocol;

/**
 * GraphQL queries and schemas of a database.
 * <p>
 * Queries are answered against the default schema generated from the database contents, or
 * against a named schema previously registered with {@link #addSchema(String, Content)}. The
 * {@code data} member of the server response is returned as a Jackson {@link JsonNode}.
 * </p>
 */
public final class GraphQL {

    private final DefaultConnection connection;

    GraphQL(final DefaultConnection connection) {
        this.connection = connection;
    }

    /**
     * Evaluates a GraphQL query against the default schema.
     *
     * @param query
     *            the query text
     * @return the {@code data} member of the response
     * @throws StardogException
     *             in case of failure
     */
    public JsonNode query(final String query) throws StardogException {
        return query(query, null, null);
    }

    /**
     * Evaluates a GraphQL query with variables. Variable {@code @schema}, if present, selects the
     * schema to query.
     *
     * @param query
     *            the query text
     * @param variables
     *            the query variables, possibly null
     * @return the {@code data} member of the response
     * @throws StardogException
     *             in case of failure
     */
    public JsonNode query(final String query, @Nullable final Map<String, ?> variables)
            throws StardogException {
        return query(query, variables, null);
    }

    /**
     * Evaluates a GraphQL query with variables against a named schema.
     *
     * @param query
     *            the query text
     * @param variables
     *            the query variables, possibly null
     * @param schema
     *            the schema name; null for the default schema
     * @return the {@code data} member of the response
     * @throws StardogException
     *             in case of failure
     */
    public JsonNode query(final String query, @Nullable final Map<String, ?> variables,
            @Nullable final String schema) throws StardogException {
        Preconditions.checkNotNull(query);
        final Map<String, Object> allVariables = Maps.newLinkedHashMap();
        if (variables != null) {
            allVariables.putAll(variables);
        }
        if (schema != null) {
            allVariables.put(Protocol.GRAPHQL_SCHEMA_VARIABLE, schema);
        }
        final byte[] body = Decoding.writeJson(ImmutableMap.of("query", query, "variables",
                allVariables));
        synchronized (this.connection) {
            return this.connection.execute("GRAPHQL", () -> {
                final JsonNode json = Decoding.readJson(this.connection.send(this.connection
                        .post(Protocol.PATH_GRAPHQL).accept(Protocol.MIME_JSON)
                        .entity(ByteSource.wrap(body), Protocol.MIME_JSON, null).build()));
                final JsonNode data = json.get("data");
                if (data == null) {
                    throw new StardogException("No data in GraphQL response: " + json, null);
                }
                return data;
            }, "schema", allVariables.get(Protocol.GRAPHQL_SCHEMA_VARIABLE));
        }
    }

    /**
     * Registers a schema, replacing any schema with the same name.
     *
     * @param name
     *            the schema name
     * @param content
     *            the schema, in GraphQL SDL
     * @throws StardogException
     *             in case of failure
     */
    public void addSchema(final String name, final Content content) throws StardogException {
        Preconditions.checkArgument(!name.isEmpty(), "Empty schema name");
        synchronized (this.connection) {
            this.connection.execute("GRAPHQL ADD SCHEMA", () -> {
                Decoding.readText(this.connection.send(this.connection
                        .put(Protocol.PATH_GRAPHQL, Protocol.PATH_SCHEMAS, name)
                        .entity(content.getSource(), content.getMediaType(),
                                content.getEncoding()).build()));
                return null;
            }, null, name);
        }
    }

    public void removeSchema(final String name) throws StardogException {
        Preconditions.checkArgument(!name.isEmpty(), "Empty schema name");
        synchronized (this.connection) {
            this.connection.execute("GRAPHQL REMOVE SCHEMA", () -> {
                Decoding.readText(this.connection.send(this.connection.delete(
                        Protocol.PATH_GRAPHQL, Protocol.PATH_SCHEMAS, name).build()));
                return null;
            }, null, name);
        }
    }

    public void clearSchemas() throws StardogException {
        synchronized (this.connection) {
            this.connection.execute("GRAPHQL CLEAR SCHEMAS", () -> {
                Decoding.readText(this.connection.send(this.connection.delete(
                        Protocol.PATH_GRAPHQL, Protocol.PATH_SCHEMAS).build()));
                return null;
            });
        }
    }

    /**
     * Returns the names of the registered schemas.
     *
     * @return the schema names
     * @throws StardogException
     *             in case of failure
     */
    public List<String> schemas() throws StardogException {
        synchronized (this.connection) {
            return this.connection.execute("GRAPHQL SCHEMAS", () -> {
                final JsonNode json = Decoding.readJson(this.connection.send(this.connection
                        .get(Protocol.PATH_GRAPHQL, Protocol.PATH_SCHEMAS)
                        .accept(Protocol.MIME_JSON).build()));
                final ImmutableList.Builder<String> builder = ImmutableList.builder();
                for (final JsonNode name : json.path(Protocol.PATH_SCHEMAS)) {
                    builder.add(name.asText());
                }
                return builder.build();
            });
        }
    }

    /**
     * Returns the text of a registered schema.
     *
     * @param name
     *            the schema name
     * @return the schema, in GraphQL SDL
     * @throws StardogException
     *             in case of failure (e.g., the schema does not exist)
     */
    public String schema(final String name) throws StardogException {
        Preconditions.checkArgument(!name.isEmpty(), "Empty schema name");
        synchronized (this.connection) {
            return this.connection.execute("GRAPHQL SCHEMA", () -> Decoding
                    .readText(this.connection.send(this.connection.get(Protocol.PATH_GRAPHQL,
                            Protocol.PATH_SCHEMAS, name).accept(Protocol.MIME_TEXT).build())),
                    null, name);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).addValue(this.connection.getDatabase())
                .toString();
    }

}
