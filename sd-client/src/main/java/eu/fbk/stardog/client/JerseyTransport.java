package eu.fbk.stardog.client;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;
import javax.ws.rs.ProcessingException;
import javax.ws.rs.client.Entity;
import javax.ws.rs.client.Invocation;
import javax.ws.rs.core.Form;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Variant;

import com.google.common.base.Charsets;
import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.collect.Maps;
import com.google.common.escape.Escaper;
import com.google.common.io.BaseEncoding;
import com.google.common.net.HttpHeaders;
import com.google.common.net.UrlEscapers;

import org.glassfish.jersey.media.multipart.FormDataMultiPart;
import org.glassfish.jersey.media.multipart.file.StreamDataBodyPart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.stardog.TransportException;
import eu.fbk.stardog.http.Request;
import eu.fbk.stardog.http.Response;
import eu.fbk.stardog.http.Transport;

/**
 * A {@code Transport} sending requests through the JAX-RS client of a {@link Client}, with the
 * credentials of a connection.
 */
final class JerseyTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(JerseyTransport.class);

    private static final Escaper PARAMETER_ESCAPER = UrlEscapers.urlFormParameterEscaper();

    private final Client client;

    private final String username;

    private final String authorization;

    private boolean closed;

    JerseyTransport(final Client client, final String username, final String password) {
        final String authorizationString = username + ":" + password;
        final byte[] authorizationBytes = authorizationString.getBytes(Charsets.ISO_8859_1);
        this.client = client;
        this.username = username;
        this.authorization = "Basic " + BaseEncoding.base64().encode(authorizationBytes);
        this.closed = false;
    }

    @Override
    public synchronized Response send(final Request request) throws TransportException {
        if (this.closed) {
            throw new IllegalStateException("Transport has been closed");
        }
        return invoke(request, false);
    }

    @Override
    public synchronized void close() {
        this.closed = true;
    }

    private Response invoke(final Request request, final boolean redirected)
            throws TransportException {

        // Determine target URI based on path and stored redirections
        final String method = request.getMethod();
        final String path = request.getPath();
        final String action = method + ":" + path;
        final String target = this.client.getTargets().get(action);
        final String uri = target != null ? target : this.client.getServerURL() + "/" + path;

        // Encode parameters either in the query string or as a form body
        String query = null;
        Entity<?> entity = null;
        if (request.isFormEncoded()) {
            final Form form = new Form();
            for (final Map.Entry<String, String> entry : request.getParameters().entries()) {
                form.param(entry.getKey(), entry.getValue());
            }
            entity = Entity.form(form);
        } else {
            query = query(request);
            entity = entity(request);
        }

        // Create an invocation builder for the target URI + query string
        final Invocation.Builder invoker = this.client.getJaxrsClient()
                .target(query == null ? uri : uri + query).request();
        for (final Map.Entry<String, String> entry : request.getHeaders().entrySet()) {
            invoker.header(entry.getKey(), entry.getValue());
        }
        invoker.header(HttpHeaders.AUTHORIZATION, this.authorization);
        invoker.header(HttpHeaders.USER_AGENT, Client.USER_AGENT);
        invoker.header(HttpHeaders.ACCEPT_ENCODING,
                this.client.isCompressionEnabled() ? "gzip, deflate, identity" : "identity");

        // Log the request
        if (LOGGER.isDebugEnabled()) {
            final StringBuilder builder = new StringBuilder("Http: ");
            builder.append(method).append(' ').append(query == null ? uri : uri + query);
            if (entity != null) {
                builder.append(' ').append(entity.getMediaType());
            }
            builder.append(' ').append(this.username);
            LOGGER.debug(builder.toString());
        }

        // Perform the request
        final long timestamp = System.currentTimeMillis();
        final javax.ws.rs.core.Response response;
        try {
            response = entity == null ? invoker.method(method) : invoker.method(method, entity);
        } catch (final ProcessingException ex) {
            final Throwable cause = MoreObjects.firstNonNull(ex.getCause(), ex);
            throw new TransportException("Http: " + method + " " + uri + " failed: "
                    + cause.getMessage(), cause);
        }
        final long elapsed = System.currentTimeMillis() - timestamp;

        // Log the response
        if (LOGGER.isDebugEnabled()) {
            final StringBuilder builder = new StringBuilder("Http: ");
            builder.append(response.getStatus());
            if (response.hasEntity()) {
                builder.append(", ").append(response.getMediaType());
            }
            builder.append(", ").append(elapsed).append(" ms");
            LOGGER.debug(builder.toString());
        }

        // On redirection, close response, update targets map and try again (once)
        final int status = response.getStatus();
        final String location = response.getHeaderString(HttpHeaders.LOCATION);
        if ((status == 302 || status == 307 || status == 308) && location != null && !redirected) {
            response.close();
            final int index = location.indexOf('?');
            final String newURI = index < 0 ? location : location.substring(0, index);
            this.client.getTargets().put(action, newURI);
            LOGGER.debug("Http: stored redirection: {} -> {}", path, newURI);
            return invoke(request, true);
        }

        // Otherwise, update targets map and return the response, whatever its status
        this.client.getTargets().put(action, uri);
        final Map<String, String> headers = Maps.newHashMap();
        for (final Map.Entry<String, List<String>> entry : response.getStringHeaders().entrySet()) {
            headers.put(entry.getKey(), Joiner.on(", ").join(entry.getValue()));
        }
        try {
            final InputStream body = response.hasEntity() ? response
                    .readEntity(InputStream.class) : new ByteArrayInputStream(new byte[0]);
            return Response.create(status, headers, body, response::close);
        } catch (final ProcessingException | IllegalStateException ex) {
            response.close();
            throw new TransportException("Http: cannot read response body: " + ex.getMessage(),
                    ex);
        }
    }

    @Nullable
    private static String query(final Request request) {
        if (request.getParameters().isEmpty()) {
            return null;
        }
        final StringBuilder builder = new StringBuilder();
        for (final Map.Entry<String, String> entry : request.getParameters().entries()) {
            builder.append(builder.length() == 0 ? '?' : '&');
            builder.append(PARAMETER_ESCAPER.escape(entry.getKey())).append('=')
                    .append(PARAMETER_ESCAPER.escape(entry.getValue()));
        }
        return builder.toString();
    }

    @Nullable
    private static Entity<?> entity(final Request request) throws TransportException {
        try {
            final Request.Entity entity = request.getEntity();
            if (entity != null) {
                final Variant variant = new Variant(MediaType.valueOf(entity.getMediaType()),
                        (String) null, entity.getEncoding());
                return Entity.entity(entity.getSource().openStream(), variant);
            }
            if (!request.getParts().isEmpty()) {
                final FormDataMultiPart multipart = new FormDataMultiPart();
                for (final Request.Part part : request.getParts()) {
                    multipart.bodyPart(new StreamDataBodyPart(part.getName(), part.getSource()
                            .openStream(), part.getFilename(), MediaType.valueOf(part
                            .getMediaType())));
                }
                return Entity.entity(multipart, multipart.getMediaType());
            }
            return null;
        } catch (final IOException ex) {
            throw new TransportException("Cannot read request body: " + ex.getMessage(), ex);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + this.client.getServerURL() + ", "
                + this.username + "]";
    }

}
