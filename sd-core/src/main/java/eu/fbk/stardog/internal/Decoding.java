package eu.fbk.stardog.internal;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.io.ByteStreams;
import com.google.common.net.MediaType;

import org.jvnet.mimepull.MIMEConfig;
import org.jvnet.mimepull.MIMEMessage;
import org.jvnet.mimepull.MIMEPart;
import org.openrdf.query.BindingSet;
import org.openrdf.query.QueryResultHandlerException;
import org.openrdf.query.TupleQueryResultHandlerBase;
import org.openrdf.query.TupleQueryResultHandlerException;
import org.openrdf.query.resultio.BooleanQueryResultFormat;
import org.openrdf.query.resultio.BooleanQueryResultParser;
import org.openrdf.query.resultio.QueryResultIO;
import org.openrdf.query.resultio.QueryResultParseException;
import org.openrdf.query.resultio.TupleQueryResultFormat;
import org.openrdf.query.resultio.TupleQueryResultParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.stardog.StardogException;
import eu.fbk.stardog.TransportException;
import eu.fbk.stardog.data.QueryKind;
import eu.fbk.stardog.data.QueryResult;
import eu.fbk.stardog.http.Response;

/**
 * Decoding of server responses. All the methods consume and close the supplied response.
 */
public final class Decoding {

    private static final Logger LOGGER = LoggerFactory.getLogger(Decoding.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Decoding() {
    }

    public static ObjectMapper getMapper() {
        return MAPPER;
    }

    /**
     * Translates a non-2xx response into a {@code StardogException}, preserving the status, the
     * error code (from the {@code SD-Error-Code} header or the JSON {@code code} member) and the
     * server message (the JSON {@code message} member, otherwise the whole body).
     */
    public static StardogException toException(final Response response) {
        final int status = response.getStatus();
        String code = response.getHeader(Protocol.HEADER_ERROR_CODE);
        String message = null;
        try {
            final String body = response.readString().trim();
            if (body.startsWith("{")) {
                try {
                    final JsonNode json = MAPPER.readTree(body);
                    if (code == null && json.hasNonNull("code")) {
                        code = json.get("code").asText();
                    }
                    if (json.hasNonNull("message")) {
                        message = json.get("message").asText();
                    }
                } catch (final IOException ex) {
                    LOGGER.debug("Error body is not valid JSON: {}", ex.getMessage());
                }
            }
            if (message == null && !body.isEmpty()) {
                message = body;
            }
        } catch (final IOException ex) {
            LOGGER.warn("Could not read body of error response " + response, ex);
        } finally {
            response.close();
        }
        return new StardogException(status, Strings.emptyToNull(code), message);
    }

    public static String readText(final Response response) throws StardogException {
        try {
            return response.readString();
        } catch (final IOException ex) {
            throw new TransportException("Failed reading response: " + ex.getMessage(), ex);
        } finally {
            response.close();
        }
    }

    public static byte[] readBytes(final Response response) throws StardogException {
        try {
            return response.readBytes();
        } catch (final IOException ex) {
            throw new TransportException("Failed reading response: " + ex.getMessage(), ex);
        } finally {
            response.close();
        }
    }

    public static long readLong(final Response response) throws StardogException {
        final String text = readText(response).trim();
        try {
            return Long.parseLong(text);
        } catch (final NumberFormatException ex) {
            throw new StardogException("Invalid number in response: " + text, ex);
        }
    }

    public static boolean readBooleanText(final Response response) throws StardogException {
        final String text = readText(response).trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        } else if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new StardogException("Invalid boolean in response: " + text, null);
    }

    public static JsonNode readJson(final Response response) throws StardogException {
        try {
            return MAPPER.readTree(response.getBody());
        } catch (final IOException ex) {
            throw new StardogException("Invalid JSON in response: " + ex.getMessage(), ex);
        } finally {
            response.close();
        }
    }

    public static byte[] writeJson(final Object object) {
        try {
            return MAPPER.writeValueAsBytes(object);
        } catch (final IOException ex) {
            throw new IllegalArgumentException("Cannot serialize to JSON: " + object, ex);
        }
    }

    public static QueryResult decode(final QueryKind kind, final Response response)
            throws StardogException {
        if (kind.isTupleKind()) {
            return readTuples(kind, response);
        } else if (kind == QueryKind.ASK) {
            return QueryResult.bool(kind, readBoolean(response));
        } else {
            return QueryResult.text(kind, readText(response));
        }
    }

    public static QueryResult.Tuples readTuples(final QueryKind kind, final Response response)
            throws StardogException {
        final TupleQueryResultParser parser = QueryResultIO
                .createParser(TupleQueryResultFormat.JSON);
        final List<String> variables = Lists.newArrayList();
        final List<BindingSet> rows = Lists.newArrayList();
        try {
            parser.setQueryResultHandler(new TupleQueryResultHandlerBase() {

                @Override
                public void startQueryResult(final List<String> vars)
                        throws TupleQueryResultHandlerException {
                    variables.addAll(vars);
                }

                @Override
                public void handleSolution(final BindingSet bindings)
                        throws TupleQueryResultHandlerException {
                    if (bindings != null) {
                        rows.add(bindings);
                    }
                }

            });
            parser.parseQueryResult(response.getBody());
        } catch (final IOException ex) {
            throw new TransportException("Failed reading response: " + ex.getMessage(), ex);
        } catch (final QueryResultParseException | QueryResultHandlerException ex) {
            throw new StardogException("Invalid query result: " + ex.getMessage(), ex);
        } finally {
            response.close();
        }
        return QueryResult.tuples(kind, variables, rows);
    }

    public static boolean readBoolean(final Response response) throws StardogException {
        final BooleanQueryResultParser parser = QueryResultIO
                .createParser(BooleanQueryResultFormat.TEXT);
        final AtomicBoolean resultHolder = new AtomicBoolean();
        try {
            parser.setQueryResultHandler(new TupleQueryResultHandlerBase() {

                @Override
                public void handleBoolean(final boolean result) throws QueryResultHandlerException {
                    resultHolder.set(result);
                }

            });
            parser.parseQueryResult(response.getBody());
            return resultHolder.get();
        } catch (final IOException ex) {
            throw new TransportException("Failed reading response: " + ex.getMessage(), ex);
        } catch (final QueryResultParseException | QueryResultHandlerException ex) {
            throw new StardogException("Invalid boolean result: " + ex.getMessage(), ex);
        } finally {
            response.close();
        }
    }

    /**
     * Splits a {@code multipart/*} response in its parts, returning the text of each of them.
     */
    public static List<String> readMultipart(final Response response) throws StardogException {
        final MediaType mediaType = response.getMediaType();
        final String boundary = mediaType == null ? null : Iterables.getFirst(mediaType
                .parameters().get("boundary"), null);
        try {
            if (boundary == null) {
                final String text = response.readString();
                return text.trim().isEmpty() ? ImmutableList.<String>of() : ImmutableList
                        .of(text);
            }
            final ImmutableList.Builder<String> builder = ImmutableList.builder();
            final MIMEMessage message = new MIMEMessage(response.getBody(), boundary,
                    new MIMEConfig());
            try {
                for (final MIMEPart part : message.getAttachments()) {
                    try (InputStream in = part.readOnce()) {
                        builder.add(new String(ByteStreams.toByteArray(in), response
                                .getCharset()));
                    } finally {
                        part.close();
                    }
                }
            } finally {
                message.close();
            }
            return builder.build();
        } catch (final IOException ex) {
            throw new TransportException("Failed reading response: " + ex.getMessage(), ex);
        } catch (final RuntimeException ex) {
            throw new StardogException("Invalid multipart response: " + ex.getMessage(), ex);
        } finally {
            response.close();
        }
    }

}
