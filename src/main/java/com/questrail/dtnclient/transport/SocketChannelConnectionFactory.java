package com.questrail.dtnclient.transport;

import java.io.IOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.UnixDomainSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * SocketChannelConnectionFactory
 * =============================================================================
 * {@link ConnectionFactory} for dtnd's application-agent socket.
 *
 * <p>dtnd normally exposes a Unix domain socket; a TCP address is accepted as
 * well. Each {@link #open()} connects a new channel.</p>
 *
 * <h2>Connection-not-found</h2>
 * <p>A missing socket file, or a refused connection, is reported as
 * {@link DaemonNotFoundException}. Every other failure propagates as the
 * underlying {@link IOException}.</p>
 */
public final class SocketChannelConnectionFactory implements ConnectionFactory
{
    private final SocketAddress address;
    private final Duration timeout;

    public SocketChannelConnectionFactory(SocketAddress address, Duration timeout) {
        this.address = Objects.requireNonNull(address, "address");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
    }

    public static SocketChannelConnectionFactory unixSocket(Path socketPath, Duration timeout) {
        return new SocketChannelConnectionFactory(UnixDomainSocketAddress.of(socketPath), timeout);
    }

    public static SocketChannelConnectionFactory tcp(InetSocketAddress address, Duration timeout) {
        return new SocketChannelConnectionFactory(address, timeout);
    }

    public SocketAddress address() {
        return address;
    }

    @Override
    public Connection open() throws IOException {
        if (address instanceof UnixDomainSocketAddress unix && !Files.exists(unix.getPath())) {
            throw new DaemonNotFoundException("No such socket: " + unix.getPath());
        }
        try {
            return SocketChannelConnection.open(address, timeout);
        } catch (ConnectException e) {
            throw new DaemonNotFoundException("Could not connect to " + address + ": " + e.getMessage(), e);
        }
    }
}
