package com.questrail.dtnclient.config;

import com.questrail.dtnclient.observability.DtnClientObservabilitySink;
import com.questrail.dtnclient.observability.Slf4jDtnClientObservabilitySink;

import java.net.SocketAddress;
import java.net.UnixDomainSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for a dtnd client.
 *
 * @param daemonAddress        dtnd's application-agent socket
 * @param timeout              deadline for each call; {@link Duration#ZERO} for none
 * @param diagnosticsDirectory where undecodable replies are archived
 * @param observabilitySink    receiver of call events
 */
public record DtnClientConfig(
    SocketAddress daemonAddress,
    Duration timeout,
    Path diagnosticsDirectory,
    DtnClientObservabilitySink observabilitySink
) {
    public DtnClientConfig {
        Objects.requireNonNull(daemonAddress, "daemonAddress");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(diagnosticsDirectory, "diagnosticsDirectory");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SocketAddress daemonAddress;
        private Duration timeout = Duration.ZERO;
        private Path diagnosticsDirectory = Path.of(System.getProperty("java.io.tmpdir"));
        private DtnClientObservabilitySink observabilitySink;

        public Builder withSocketPath(Path socketPath) {
            this.daemonAddress = UnixDomainSocketAddress.of(socketPath);
            return this;
        }

        public Builder withDaemonAddress(SocketAddress daemonAddress) {
            this.daemonAddress = daemonAddress;
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withDiagnosticsDirectory(Path diagnosticsDirectory) {
            this.diagnosticsDirectory = diagnosticsDirectory;
            return this;
        }

        public Builder withObservabilitySink(DtnClientObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public DtnClientConfig build() {
            if (daemonAddress == null) {
                throw new IllegalStateException("A daemon socket path or address is required");
            }
            DtnClientObservabilitySink sink = observabilitySink != null
                    ? observabilitySink
                    : new Slf4jDtnClientObservabilitySink();
            return new DtnClientConfig(daemonAddress, timeout, diagnosticsDirectory, sink);
        }
    }
}
