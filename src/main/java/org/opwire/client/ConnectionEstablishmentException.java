package org.opwire.client;

/**
 * Thrown when the TCP connection to the server cannot be opened.
 */
public final class ConnectionEstablishmentException extends RuntimeException {
    private final String host;
    private final int port;

    public ConnectionEstablishmentException(final String host, final int port, final Throwable cause) {
        super("failed to connect host=" + host + " port=" + port + ": " + cause.getMessage(), cause);
        this.host = host;
        this.port = port;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }
}
