package eu.fbk.stardog.client;

import java.net.URI;
import java.net.URISyntaxException;

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * The HTTP proxy the {@link Client} connects through, with optional proxy credentials.
 */
public final class ProxyConfig {

    private final URI uri;

    @Nullable
    private final String username;

    @Nullable
    private final String password;

    public ProxyConfig(final String url) {
        this(url, null, null);
    }

    /**
     * Creates a new proxy configuration.
     *
     * @param url
     *            the proxy URL, with scheme {@code http} or {@code https} and no user info
     * @param username
     *            the proxy username, possibly null
     * @param password
     *            the proxy password, possibly null; ignored if the username is null
     */
    public ProxyConfig(final String url, @Nullable final String username,
            @Nullable final String password) {
        try {
            this.uri = new URI(url.trim());
        } catch (final URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid proxy URL: " + url, ex);
        }
        final String scheme = this.uri.getScheme();
        Preconditions.checkArgument(scheme != null && (scheme.equalsIgnoreCase("http")
                || scheme.equalsIgnoreCase("https")), "Not an HTTP(S) URL: %s", url);
        Preconditions.checkArgument(this.uri.getHost() != null, "No host in proxy URL: %s", url);
        Preconditions.checkArgument(this.uri.getUserInfo() == null,
                "Credentials must not be embedded in proxy URL: %s", url);
        this.username = username;
        this.password = username == null ? null : password;
    }

    public String getURL() {
        return this.uri.toString();
    }

    public String getHost() {
        return this.uri.getHost();
    }

    /**
     * Returns the proxy port, defaulting to 80 for HTTP and 443 for HTTPS.
     */
    public int getPort() {
        final int port = this.uri.getPort();
        if (port >= 0) {
            return port;
        }
        return this.uri.getScheme().equalsIgnoreCase("https") ? 443 : 80;
    }

    @Nullable
    public String getUsername() {
        return this.username;
    }

    @Nullable
    public String getPassword() {
        return this.password;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof ProxyConfig)) {
            return false;
        }
        final ProxyConfig o = (ProxyConfig) object;
        return this.uri.equals(o.uri) && Objects.equal(this.username, o.username)
                && Objects.equal(this.password, o.password);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.uri, this.username, this.password);
    }

    @Override
    public String toString() {
        // password never shown
        return this.username == null ? this.uri.toString() : this.uri.toString() + " (user "
                + this.username + ")";
    }

}
