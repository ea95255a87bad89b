package com.questrail.dtnclient.transport;

import java.io.Closeable;
import java.io.IOException;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link Connection} over a non-blocking {@link SocketChannel}, either a Unix
 * domain socket or TCP.
 *
 * <p>The channel is driven through a private {@link Selector} so that an
 * optional deadline covers connecting, writing and reading alike. The
 * deadline is absolute: it is fixed when the connection is opened and spans
 * the whole exchange. Expiry raises {@link SocketTimeoutException}.</p>
 */
final class SocketChannelConnection implements Connection
{
    private final SocketChannel channel;
    private final Selector selector;
    private final SelectionKey key;
    private final long deadlineNanos;
    private final boolean hasDeadline;

    private SocketChannelConnection(SocketChannel channel, Selector selector, Duration timeout)
            throws IOException
    {
        this.channel = channel;
        this.selector = selector;
        this.hasDeadline = !timeout.isZero();
        this.deadlineNanos = System.nanoTime() + timeout.toNanos();
        this.channel.configureBlocking(false);
        this.key = channel.register(selector, 0);
    }

    /**
     * Opens and connects a channel to {@code address}.
     *
     * @param timeout deadline for the whole exchange; {@link Duration#ZERO} for none
     */
    static SocketChannelConnection open(SocketAddress address, Duration timeout) throws IOException {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(timeout, "timeout");

        SocketChannel channel = address instanceof UnixDomainSocketAddress
                ? SocketChannel.open(StandardProtocolFamily.UNIX)
                : SocketChannel.open();
        Selector selector = null;
        try {
            selector = Selector.open();
            SocketChannelConnection connection = new SocketChannelConnection(channel, selector, timeout);
            connection.connect(address);
            return connection;
        } catch (IOException | RuntimeException e) {
            closeSuppressing(e, selector);
            closeSuppressing(e, channel);
            throw e;
        }
    }

    private void connect(SocketAddress address) throws IOException {
        if (channel.connect(address)) {
            return;
        }
        while (!channel.finishConnect()) {
            await(SelectionKey.OP_CONNECT, "connect");
        }
    }

    @Override
    public void write(byte[] bytes) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        while (buffer.hasRemaining()) {
            if (channel.write(buffer) == 0) {
                await(SelectionKey.OP_WRITE, "write");
            }
        }
    }

    @Override
    public int readFully(byte[] target, int offset, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(target, offset, length);
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer);
            if (n < 0) {
                break;
            }
            if (n == 0) {
                await(SelectionKey.OP_READ, "read");
            }
        }
        return length - buffer.remaining();
    }

    private void await(int operation, String what) throws IOException {
        key.interestOps(operation);
        try {
            if (!hasDeadline) {
                selector.select();
            }
            else {
                long remaining = remainingMillis();
                if (remaining > 0) {
                    selector.select(remaining);
                }
                // A wakeup with time left just returns; the caller retries the operation.
                if (remainingMillis() <= 0) {
                    throw new SocketTimeoutException(what + " timed out");
                }
            }
        } finally {
            selector.selectedKeys().clear();
            key.interestOps(0);
        }
    }

    private long remainingMillis() {
        long remainingNanos = deadlineNanos - System.nanoTime();
        // Rounded up: select(0) blocks without limit.
        return remainingNanos <= 0 ? 0 : Math.max(1, Duration.ofNanos(remainingNanos).toMillis());
    }

    @Override
    public void close() throws IOException {
        try {
            selector.close();
        } finally {
            channel.close();
        }
    }

    private static void closeSuppressing(Exception primary, Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
