package com.questrail.qotd.client;

import com.questrail.qotd.host.QotdHostConfig;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings snapshot for a {@link QotdClient}.
 *
 * <p>Each request captures the snapshot current when it is issued; applying a
 * new one affects later requests only.</p>
 *
 * @param endpoint       resolved address of the QOTD server
 * @param defaultTimeout timeout used when a request passes {@link Duration#ZERO};
 *                       a negative value waits indefinitely
 */
public record QotdClientConfig(
    QotdClientMode mode,
    InetSocketAddress endpoint,
    Duration defaultTimeout,
    QotdHostConfig host
) {
    public static final int DEFAULT_PORT = 17;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    public QotdClientConfig {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        Objects.requireNonNull(host, "host");
        if (endpoint.isUnresolved()) {
            throw new IllegalArgumentException("endpoint must be resolved: " + endpoint);
        }
        if (defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must not be zero");
        }
    }

    /**
     * Stream mode against 127.0.0.1:17 with a 5 second timeout.
     */
    public static QotdClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private QotdClientMode mode = QotdClientMode.STREAM;
        private InetSocketAddress endpoint = new InetSocketAddress("127.0.0.1", DEFAULT_PORT);
        private Duration defaultTimeout = DEFAULT_TIMEOUT;
        private QotdHostConfig host = QotdHostConfig.defaults();

        public Builder withMode(QotdClientMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder withEndpoint(InetSocketAddress endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withEndpoint(InetAddress address, int port) {
            this.endpoint = new InetSocketAddress(address, port);
            return this;
        }

        public Builder withDefaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder withHost(QotdHostConfig host) {
            this.host = host;
            return this;
        }

        public QotdClientConfig build() {
            return new QotdClientConfig(mode, endpoint, defaultTimeout, host);
        }
    }
}
