package com.questrail.qotd.server;

import com.questrail.qotd.host.QotdHostConfig;

import java.util.Objects;

/**
 * Immutable settings snapshot for a {@link QotdServer}.
 *
 * <p>Port {@code 0} binds an ephemeral port; the bound address is then
 * available from {@link QotdServer#streamAddress()} and
 * {@link QotdServer#datagramAddress()}.</p>
 *
 * @param dualStack listen on the IPv6 wildcard address, accepting IPv4 peers as
 *                  well; when {@code false} only the IPv4 wildcard is used
 */
public record QotdServerConfig(
    QotdServerMode mode,
    int datagramPort,
    int streamPort,
    boolean dualStack,
    QotdHostConfig host
) {
    /** Port assigned to QOTD by IANA. */
    public static final int DEFAULT_PORT = 17;

    public QotdServerConfig {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(host, "host");
        requireValidPort(datagramPort, "datagramPort");
        requireValidPort(streamPort, "streamPort");
    }

    /**
     * Both transports on port 17, dual-stack, default host settings.
     */
    public static QotdServerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requireValidPort(int port, String name) {
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException(name + " must be in 0..65535: " + port);
        }
    }

    public static final class Builder {
        private QotdServerMode mode = QotdServerMode.BOTH;
        private int port = DEFAULT_PORT;
        private Integer datagramPort;
        private Integer streamPort;
        private boolean dualStack = true;
        private QotdHostConfig host = QotdHostConfig.defaults();

        public Builder withMode(QotdServerMode mode) {
            this.mode = mode;
            return this;
        }

        /**
         * Port for both transports, unless overridden per transport.
         */
        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withDatagramPort(int datagramPort) {
            this.datagramPort = datagramPort;
            return this;
        }

        public Builder withStreamPort(int streamPort) {
            this.streamPort = streamPort;
            return this;
        }

        public Builder withDualStack(boolean dualStack) {
            this.dualStack = dualStack;
            return this;
        }

        public Builder withHost(QotdHostConfig host) {
            this.host = host;
            return this;
        }

        public QotdServerConfig build() {
            return new QotdServerConfig(
                mode,
                datagramPort != null ? datagramPort : port,
                streamPort != null ? streamPort : port,
                dualStack,
                host
            );
        }
    }
}
