package com.questrail.dtnclient.transport;

import java.io.Closeable;
import java.io.IOException;

/**
 * Connection
 * -----------------------------------------------------------------------------
 * One open stream connection to dtnd, used for exactly one request/reply
 * exchange and then closed.
 *
 * <p>Implementations perform byte I/O only. They do not frame, encode or
 * interpret anything they carry.</p>
 */
public interface Connection extends Closeable
{
    /**
     * Writes all of {@code bytes}, blocking until they are handed to the
     * transport.
     *
     * @throws java.net.SocketTimeoutException if the connection's deadline expires
     */
    void write(byte[] bytes) throws IOException;

    /**
     * Reads into {@code buffer[offset, offset + length)} until the range is
     * full or the peer closes the stream.
     *
     * @return number of bytes read; less than {@code length} only if the
     *         stream ended
     * @throws java.net.SocketTimeoutException if the connection's deadline expires
     */
    int readFully(byte[] buffer, int offset, int length) throws IOException;
}
