package eu.fbk.stardog.internal;

import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;

public final class Protocol {

    // MIME types

    public static final String MIME_TEXT = "text/plain";

    public static final String MIME_TURTLE = "text/turtle";

    public static final String MIME_JSON = "application/json";

    public static final String MIME_SPARQL_JSON = "application/sparql-results+json";

    public static final String MIME_BOOLEAN = "text/boolean";

    public static final String MIME_MULTIPART = "multipart/mixed";

    public static final String MIME_ANY = "*/*";

    // Paths

    public static final String PATH_ALIVE = "admin/alive";

    public static final String PATH_TRANSACTION = "transaction";

    public static final String PATH_BEGIN = "begin";

    public static final String PATH_COMMIT = "commit";

    public static final String PATH_ROLLBACK = "rollback";

    public static final String PATH_ADD = "add";

    public static final String PATH_REMOVE = "remove";

    public static final String PATH_CLEAR = "clear";

    public static final String PATH_SIZE = "size";

    public static final String PATH_EXPORT = "export";

    public static final String PATH_DOCS = "docs";

    public static final String PATH_ICV = "icv";

    public static final String PATH_VALIDATE = "validate";

    public static final String PATH_VIOLATIONS = "violations";

    public static final String PATH_CONVERT = "convert";

    public static final String PATH_VCS = "vcs";

    public static final String PATH_QUERY = "query";

    public static final String PATH_TAGS = "tags";

    public static final String PATH_CREATE = "create";

    public static final String PATH_DELETE = "delete";

    public static final String PATH_REVERT = "revert";

    public static final String PATH_GRAPHQL = "graphql";

    public static final String PATH_SCHEMAS = "schemas";

    // Parameters

    public static final String PARAMETER_QUERY = "query";

    public static final String PARAMETER_REASONING = "reasoning";

    public static final String PARAMETER_OFFSET = "offset";

    public static final String PARAMETER_LIMIT = "limit";

    public static final String PARAMETER_TIMEOUT = "timeout";

    public static final String PARAMETER_SCHEMA = "schema";

    public static final String PARAMETER_DEFAULT_GRAPH = "default-graph-uri";

    public static final String PARAMETER_NAMED_GRAPH = "named-graph-uri";

    public static final String PARAMETER_GRAPH = "graph-uri";

    public static final String PARAMETER_BINDING_PREFIX = "$";

    public static final String PARAMETER_UPLOAD = "upload";

    // Headers

    public static final String HEADER_ERROR_CODE = "SD-Error-Code";

    public static final String HEADER_CONTENT_ENCODING = "Content-Encoding";

    // Versioning

    public static final String VERSION_PREFIX = "tag:stardog:api:versioning:version:";

    // GraphQL

    public static final String GRAPHQL_SCHEMA_VARIABLE = "@schema";

    private static final Escaper SEGMENT_ESCAPER = UrlEscapers.urlPathSegmentEscaper();

    private Protocol() {
    }

    /**
     * Joins the supplied segments into a path, escaping each of them. Segments are joined with
     * {@code /}; they should not contain slashes themselves, which are escaped.
     *
     * @param segments
     *            the path segments, not empty
     * @return the resulting path
     */
    public static String path(final String... segments) {
        final StringBuilder builder = new StringBuilder();
        for (final String segment : segments) {
            if (builder.length() > 0) {
                builder.append('/');
            }
            builder.append(SEGMENT_ESCAPER.escape(segment));
        }
        return builder.toString();
    }

}
