package com.amqpharness.config;

import java.util.Objects;

/**
 * PEM file locations for TLS connections: the CA bundle used to verify the broker, and an
 * optional client certificate and key.
 */
public final class TlsSettings {

    private static final TlsSettings NONE = new TlsSettings(null, null, null);

    private final String caCerts;
    private final String certfile;
    private final String keyfile;

    public TlsSettings(String caCerts, String certfile, String keyfile) {
        if ((certfile == null) != (keyfile == null)) {
            throw new IllegalArgumentException("certfile and keyfile must be given together");
        }
        this.caCerts = caCerts;
        this.certfile = certfile;
        this.keyfile = keyfile;
    }

    public static TlsSettings none() {
        return NONE;
    }

    public boolean isConfigured() {
        return caCerts != null || certfile != null;
    }

    public boolean hasClientCertificate() {
        return certfile != null;
    }

    public String getCaCerts() {
        return caCerts;
    }

    public String getCertfile() {
        return certfile;
    }

    public String getKeyfile() {
        return keyfile;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TlsSettings)) return false;
        TlsSettings other = (TlsSettings) o;
        return Objects.equals(caCerts, other.caCerts)
            && Objects.equals(certfile, other.certfile)
            && Objects.equals(keyfile, other.keyfile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(caCerts, certfile, keyfile);
    }

    @Override
    public String toString() {
        return String.format("TlsSettings{caCerts=%s, certfile=%s, keyfile=%s}", caCerts, certfile, keyfile);
    }
}
