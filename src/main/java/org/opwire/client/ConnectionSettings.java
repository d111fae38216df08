package org.opwire.client;

import java.util.Objects;
import org.opwire.obs.JsonLinesLogger;

/**
 * Immutable connection settings.
 */
public final class ConnectionSettings {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 27017;

    private final String host;
    private final int port;
    private final boolean tcpNoDelay;
    private final JsonLinesLogger logger;

    private ConnectionSettings(final Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.tcpNoDelay = builder.tcpNoDelay;
        this.logger = builder.logger;
    }

    public static ConnectionSettings of(final String host, final int port) {
        return builder().host(host).port(port).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses {@code --host=} and {@code --port=} arguments. Blank arguments are skipped; anything else is rejected.
     */
    public static ConnectionSettings parse(final String... args) {
        final Builder builder = builder();
        for (final String arg : args) {
            if (arg == null || arg.isBlank()) {
                continue;
            }
            if (arg.startsWith("--host=")) {
                builder.host(requireValue(arg, "--host="));
                continue;
            }
            if (arg.startsWith("--port=")) {
                builder.port(parsePort(requireValue(arg, "--port=")));
                continue;
            }
            throw new IllegalArgumentException("unsupported argument: " + arg);
        }
        return builder.build();
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public boolean tcpNoDelay() {
        return tcpNoDelay;
    }

    public JsonLinesLogger logger() {
        return logger;
    }

    public Builder toBuilder() {
        return new Builder().host(host).port(port).tcpNoDelay(tcpNoDelay).logger(logger);
    }

    @Override
    public String toString() {
        return "ConnectionSettings{host=" + host + ", port=" + port + ", tcpNoDelay=" + tcpNoDelay + '}';
    }

    static String requireValue(final String arg, final String prefix) {
        final String value = Objects.requireNonNull(arg, "arg").substring(prefix.length()).trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("argument value is empty for " + prefix);
        }
        return value;
    }

    static int parsePort(final String value) {
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException numberFormatException) {
            throw new IllegalArgumentException("invalid port: " + value, numberFormatException);
        }
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private boolean tcpNoDelay = true;
        private JsonLinesLogger logger = JsonLinesLogger.discarding();

        private Builder() {}

        public Builder host(final String host) {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("host must not be blank");
            }
            this.host = host.trim();
            return this;
        }

        public Builder port(final int port) {
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("port must be between 1 and 65535: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder tcpNoDelay(final boolean tcpNoDelay) {
            this.tcpNoDelay = tcpNoDelay;
            return this;
        }

        public Builder logger(final JsonLinesLogger logger) {
            this.logger = Objects.requireNonNull(logger, "logger");
            return this;
        }

        public ConnectionSettings build() {
            return new ConnectionSettings(this);
        }
    }
}
