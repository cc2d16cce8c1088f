package eu.fbk.stardog.client;

import java.security.cert.X509Certificate;
import java.util.Map;

import javax.annotation.Nullable;
import javax.net.ssl.HostnameVerifier;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import javax.ws.rs.client.ClientBuilder;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.config.RegistryBuilder;
import org.apache.http.conn.socket.ConnectionSocketFactory;
import org.apache.http.conn.socket.PlainConnectionSocketFactory;
import org.apache.http.conn.ssl.DefaultHostnameVerifier;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.conn.ssl.SSLConnectionSocketFactory;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.glassfish.jersey.apache.connector.ApacheClientProperties;
import org.glassfish.jersey.apache.connector.ApacheConnectorProvider;
import org.glassfish.jersey.client.ClientConfig;
import org.glassfish.jersey.client.ClientProperties;
import org.glassfish.jersey.client.RequestEntityProcessing;
import org.glassfish.jersey.media.multipart.MultiPartFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.stardog.AbstractStardog;
import eu.fbk.stardog.Connection;
import eu.fbk.stardog.DefaultConnection;
import eu.fbk.stardog.StardogException;
import eu.fbk.stardog.internal.Util;

/**
 * A {@code Stardog} server reached over HTTP.
 * <p>
 * Instances are created with {@link #builder(String)}, which allows configuring the server URL,
 * the size of the HTTP connection pool shared by all the connections, timeouts, TLS validation,
 * compression, an optional proxy and the default credentials. Each {@link Connection} opened on
 * the client authenticates its requests with HTTP Basic credentials.
 * </p>
 */
public final class Client extends AbstractStardog {

    private static final Logger LOGGER = LoggerFactory.getLogger(Client.class);

    static final String USER_AGENT = String.format("Stardog-Java/%s Apache-HttpClient/%s",
            Util.getVersion("eu.fbk.stardog", "sd-core", "devel"),
            Util.getVersion("org.apache.httpcomponents", "httpclient", "unknown"));

    private static final String[] HTTPS_PROTOCOLS = new String[] { "TLSv1.3", "TLSv1.2" };

    private static final String DEFAULT_SERVER_URL = "http://localhost:5820";

    private static final String DEFAULT_USERNAME = "admin";

    private static final String DEFAULT_PASSWORD = "admin";

    private static final int DEFAULT_MAX_CONNECTIONS = 2;

    private static final boolean DEFAULT_VALIDATE_SERVER = true;

    private static final int DEFAULT_CONNECTION_TIMEOUT = 1000; // 1 sec

    private static final int DEFAULT_SOCKET_TIMEOUT = 0; // none

    private static final boolean DEFAULT_COMPRESSION_ENABLED = LoggerFactory.getLogger(
            "org.apache.http.wire").isDebugEnabled();

    private final String serverURL;

    private final String username;

    private final String password;

    private final boolean compressionEnabled;

    private final PoolingHttpClientConnectionManager connectionManager;

    private final javax.ws.rs.client.Client client;

    private final Map<String, String> targets; // method:path -> URI

    private Client(final Builder builder) {

        String url = Preconditions.checkNotNull(builder.serverURL);
        if (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }

        final int connectionTimeout = MoreObjects.firstNonNull(builder.connectionTimeout,
                DEFAULT_CONNECTION_TIMEOUT);
        final int socketTimeout = MoreObjects.firstNonNull(builder.socketTimeout,
                DEFAULT_SOCKET_TIMEOUT);
        final int maxConnections = MoreObjects.firstNonNull(builder.maxConnections,
                DEFAULT_MAX_CONNECTIONS);
        Preconditions.checkArgument(connectionTimeout >= 0, "Invalid connection timeout %s",
                connectionTimeout);
        Preconditions.checkArgument(socketTimeout >= 0, "Invalid socket timeout %s",
                socketTimeout);
        Preconditions.checkArgument(maxConnections > 0, "Invalid max connections %s",
                maxConnections);

        this.serverURL = url;
        this.username = MoreObjects.firstNonNull(builder.username, DEFAULT_USERNAME);
        this.password = MoreObjects.firstNonNull(builder.password, DEFAULT_PASSWORD);
        this.compressionEnabled = MoreObjects.firstNonNull(builder.compressionEnabled,
                DEFAULT_COMPRESSION_ENABLED);
        this.connectionManager = createConnectionManager(maxConnections,
                MoreObjects.firstNonNull(builder.validateServer, DEFAULT_VALIDATE_SERVER));
        this.client = createJaxrsClient(this.connectionManager, connectionTimeout,
                socketTimeout, builder.proxy);
        this.targets = Maps.newConcurrentMap();
        LOGGER.debug("Created client for {} (user {}, {} connections)", this.serverURL,
                this.username, maxConnections);
    }

    public String getServerURL() {
        return this.serverURL;
    }

    boolean isCompressionEnabled() {
        return this.compressionEnabled;
    }

    javax.ws.rs.client.Client getJaxrsClient() {
        return this.client;
    }

    Map<String, String> getTargets() {
        return this.targets;
    }

    /**
     * Returns the number of pooled HTTP connections currently leased, i.e., bound to a request
     * or to an open response body.
     */
    int getLeasedConnections() {
        return this.connectionManager.getTotalStats().getLeased();
    }

    @Override
    protected Connection doNewConnection(final String database, @Nullable final String username,
            @Nullable final String password) throws StardogException {
        final JerseyTransport transport = username == null ? new JerseyTransport(this,
                this.username, this.password) : new JerseyTransport(this, username,
                MoreObjects.firstNonNull(password, ""));
        return DefaultConnection.open(transport, database);
    }

    @Override
    protected void doClose() {
        try {
            this.client.close();
        } finally {
            this.connectionManager.shutdown();
        }
    }

    private static PoolingHttpClientConnectionManager createConnectionManager(
            final int maxConnections, final boolean validateServer) {

        // Setup SSLContext and HostnameVerifier based on validateServer parameter
        final SSLContext sslContext;
        HostnameVerifier hostVerifier;
        try {
            if (validateServer) {
                sslContext = SSLContext.getDefault();
                hostVerifier = new DefaultHostnameVerifier();
            } else {
                sslContext = SSLContext.getInstance("TLS");
                sslContext.init(null, new TrustManager[] { new X509TrustManager() {

                    @Override
                    public void checkClientTrusted(final X509Certificate[] chain,
                            final String authType) {
                    }

                    @Override
                    public void checkServerTrusted(final X509Certificate[] chain,
                            final String authType) {
                    }

                    @Override
                    public X509Certificate[] getAcceptedIssuers() {
                        return new X509Certificate[0];
                    }

                } }, null);
                hostVerifier = NoopHostnameVerifier.INSTANCE;
            }
        } catch (final Throwable ex) {
            throw new RuntimeException("SSL configuration failed", ex);
        }

        // Create HTTP connection factory
        final ConnectionSocketFactory httpConnectionFactory = PlainConnectionSocketFactory
                .getSocketFactory();

        // Create HTTPS connection factory
        final ConnectionSocketFactory httpsConnectionFactory = new SSLConnectionSocketFactory(
                sslContext, HTTPS_PROTOCOLS, null, hostVerifier);

        // Create pooled connection manager
        final PoolingHttpClientConnectionManager manager = new PoolingHttpClientConnectionManager(
                RegistryBuilder.<ConnectionSocketFactory>create()
                        .register("http", httpConnectionFactory)
                        .register("https", httpsConnectionFactory).build());

        // Setup max concurrent connections
        manager.setMaxTotal(maxConnections);
        manager.setDefaultMaxPerRoute(maxConnections);
        manager.setValidateAfterInactivity(1000); // validate connection after 1s idle
        return manager;
    }

    private static javax.ws.rs.client.Client createJaxrsClient(
            final PoolingHttpClientConnectionManager connectionManager,
            final int connectionTimeout, final int socketTimeout,
            @Nullable final ProxyConfig proxy) {

        // Configure requests
        final RequestConfig requestConfig = RequestConfig.custom()//
                .setExpectContinueEnabled(false) //
                .setRedirectsEnabled(false) //
                .setConnectionRequestTimeout(connectionTimeout) //
                .setConnectTimeout(connectionTimeout) //
                .setSocketTimeout(socketTimeout) //
                .build();

        // Configure client
        final ClientConfig config = new ClientConfig();
        config.connectorProvider(new ApacheConnectorProvider());
        config.property(ApacheClientProperties.CONNECTION_MANAGER, connectionManager);
        config.property(ApacheClientProperties.REQUEST_CONFIG, requestConfig);
        config.property(ApacheClientProperties.DISABLE_COOKIES, true); // not needed
        config.property(ClientProperties.FOLLOW_REDIRECTS, false);
        config.property(ClientProperties.REQUEST_ENTITY_PROCESSING,
                RequestEntityProcessing.CHUNKED); // required to stream data to the server
        if (proxy != null) {
            config.property(ClientProperties.PROXY_URI, proxy.getURL());
            config.property(ClientProperties.PROXY_USERNAME, proxy.getUsername());
            config.property(ClientProperties.PROXY_PASSWORD, proxy.getPassword());
        }

        // Register multipart support for document uploads
        config.register(MultiPartFeature.class);

        // Create and return a configured JAX-RS client
        return ClientBuilder.newClient(config);
    }

    public static Builder builder() {
        return new Builder(DEFAULT_SERVER_URL);
    }

    public static Builder builder(final String serverURL) {
        return new Builder(serverURL);
    }

    public static class Builder {

        String serverURL;

        @Nullable
        Integer maxConnections;

        @Nullable
        Integer connectionTimeout;

        @Nullable
        Integer socketTimeout;

        @Nullable
        Boolean compressionEnabled;

        @Nullable
        Boolean validateServer;

        @Nullable
        ProxyConfig proxy;

        @Nullable
        String username;

        @Nullable
        String password;

        Builder(final String serverURL) {
            this.serverURL = Preconditions.checkNotNull(serverURL);
        }

        public Builder maxConnections(@Nullable final Integer maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder connectionTimeout(@Nullable final Integer connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public Builder socketTimeout(@Nullable final Integer socketTimeout) {
            this.socketTimeout = socketTimeout;
            return this;
        }

        public Builder compressionEnabled(@Nullable final Boolean compressionEnabled) {
            this.compressionEnabled = compressionEnabled;
            return this;
        }

        public Builder validateServer(@Nullable final Boolean validateServer) {
            this.validateServer = validateServer;
            return this;
        }

        public Builder proxy(@Nullable final ProxyConfig proxy) {
            this.proxy = proxy;
            return this;
        }

        /**
         * Sets the default credentials of connections (default {@code admin/admin}).
         */
        public Builder credentials(@Nullable final String username,
                @Nullable final String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        public Client build() {
            return new Client(this);
        }

    }

}
