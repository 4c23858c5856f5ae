package com.amqpharness.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable, parsed broker connection string:
 * {@code scheme://[user[:password]@]host[:port][/vhost]}.
 */
public final class BrokerUri {

    public static final String SCHEME_AMQP = "amqp";
    public static final String SCHEME_AMQPS = "amqps";

    public static final int DEFAULT_PORT = 5672;
    public static final int DEFAULT_TLS_PORT = 5671;
    public static final String DEFAULT_USERNAME = "guest";
    public static final String DEFAULT_PASSWORD = "guest";
    public static final String DEFAULT_VIRTUAL_HOST = "/";

    private final String scheme;
    private final String username;
    private final String password;
    private final String host;
    private final int port;
    private final String virtualHost;

    private BrokerUri(String scheme, String username, String password,
                      String host, int port, String virtualHost) {
        this.scheme = scheme;
        this.username = username;
        this.password = password;
        this.host = host;
        this.port = port;
        this.virtualHost = virtualHost;
    }

    public static BrokerUri parse(String uri) {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("Broker URI must not be empty");
        }

        URI parsed;
        try {
            parsed = new URI(uri.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed broker URI: " + mask(uri), e);
        }

        String scheme = parsed.getScheme();
        if (scheme == null) {
            throw new IllegalArgumentException("Broker URI has no scheme: " + mask(uri));
        }
        scheme = scheme.toLowerCase(Locale.ROOT);

        String host = parsed.getHost();
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("Broker URI has no host: " + mask(uri));
        }

        int port = parsed.getPort();
        if (port == -1) {
            port = SCHEME_AMQPS.equals(scheme) ? DEFAULT_TLS_PORT : DEFAULT_PORT;
        }

        String username = DEFAULT_USERNAME;
        String password = DEFAULT_PASSWORD;
        String userInfo = parsed.getRawUserInfo();
        if (userInfo != null && !userInfo.isEmpty()) {
            int colon = userInfo.indexOf(':');
            if (colon >= 0) {
                username = decode(userInfo.substring(0, colon));
                password = decode(userInfo.substring(colon + 1));
            } else {
                username = decode(userInfo);
                password = "";
            }
        }

        String rawPath = parsed.getRawPath();
        String virtualHost;
        if (rawPath == null || rawPath.isEmpty() || "/".equals(rawPath)) {
            virtualHost = DEFAULT_VIRTUAL_HOST;
        } else {
            virtualHost = decode(rawPath.substring(1));
        }

        return new BrokerUri(scheme, username, password, host, port, virtualHost);
    }

    private static String decode(String value) {
        // URLDecoder treats '+' as space; URI userinfo and paths do not
        return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String mask(String uri) {
        return uri.replaceAll("(://[^:/@]*:)[^@]*@", "$1****@");
    }

    /**
     * True for the AMQP 0-9-1 family, the only schemes whose handshake the diagnoser understands.
     */
    public boolean isHandshakeDiagnosable() {
        return SCHEME_AMQP.equals(scheme) || SCHEME_AMQPS.equals(scheme);
    }

    public boolean isTls() {
        return SCHEME_AMQPS.equals(scheme);
    }

    public BrokerUri withVirtualHost(String name) {
        Objects.requireNonNull(name, "name");
        return new BrokerUri(scheme, username, password, host, port, name);
    }

    /**
     * Canonical rendering with explicit port and encoded vhost, used as a pool key.
     */
    public String normalized() {
        return render(password);
    }

    private String render(String shownPassword) {
        return scheme + "://" + encode(username) + ":" + shownPassword + "@" + host + ":" + port
            + "/" + encode(virtualHost);
    }

    public String getScheme() {
        return scheme;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BrokerUri)) return false;
        BrokerUri other = (BrokerUri) o;
        return port == other.port
            && scheme.equals(other.scheme)
            && username.equals(other.username)
            && password.equals(other.password)
            && host.equalsIgnoreCase(other.host)
            && virtualHost.equals(other.virtualHost);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheme, username, password, host.toLowerCase(Locale.ROOT), port, virtualHost);
    }

    @Override
    public String toString() {
        return render("****");
    }
}
