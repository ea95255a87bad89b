package com.questrail.dtnclient.client;

import com.questrail.dtnclient.transport.Connection;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * LengthPrefixFraming
 * -----------------------------------------------------------------------------
 * Delimits one message body on a stream connection.
 *
 * <p>Both directions use the same layout:</p>
 * <pre>
 *   [8 bytes: body length, unsigned big-endian][N bytes: body]
 * </pre>
 *
 * <p>This class only handles the prefix. It knows nothing about the encoding
 * of the body.</p>
 */
public final class LengthPrefixFraming
{
    /** Size of the length prefix in bytes. */
    public static final int PREFIX_LENGTH = 8;

    /** Largest body a Java byte array can hold. */
    static final long MAX_BODY_LENGTH = Integer.MAX_VALUE - 8;

    // The announced length never sizes an allocation directly.
    private static final int CHUNK_SIZE = 64 * 1024;

    private LengthPrefixFraming() {}

    /**
     * Encodes the length prefix for a body of {@code length} bytes.
     */
    public static byte[] prefix(long length) {
        return ByteBuffer.allocate(PREFIX_LENGTH).putLong(length).array();
    }

    /**
     * Writes the length prefix followed by {@code body}.
     */
    public static void writeFrame(Connection connection, byte[] body) throws IOException {
        connection.write(prefix(body.length));
        connection.write(body);
    }

    /**
     * Reads the length prefix, then exactly that many body bytes.
     *
     * @return the body, without prefix
     * @throws DataException if the prefix is incomplete, zero or larger than
     *         {@link #MAX_BODY_LENGTH}, or if the stream ends before the
     *         announced number of bytes arrived
     */
    public static byte[] readFrame(Connection connection) throws IOException {
        byte[] header = new byte[PREFIX_LENGTH];
        int headerRead = connection.readFully(header, 0, PREFIX_LENGTH);
        if (headerRead != PREFIX_LENGTH) {
            throw new DataException("Connection closed before reply length was received - expected "
                    + PREFIX_LENGTH + " bytes, got " + headerRead);
        }

        long announced = ByteBuffer.wrap(header).getLong();
        if (announced == 0) {
            throw new DataException("Received nonsensical data-length: 0");
        }
        // Negative as a signed long means above 2^63 as unsigned.
        if (announced < 0 || announced > MAX_BODY_LENGTH) {
            throw new DataException("Received unsupported data-length: " + Long.toUnsignedString(announced));
        }

        return readBody(connection, (int) announced);
    }

    private static byte[] readBody(Connection connection, int announced) throws IOException {
        ByteArrayOutputStream body = new ByteArrayOutputStream(Math.min(announced, CHUNK_SIZE));
        byte[] chunk = new byte[Math.min(announced, CHUNK_SIZE)];
        int total = 0;
        while (total < announced) {
            int wanted = Math.min(chunk.length, announced - total);
            int n = connection.readFully(chunk, 0, wanted);
            body.write(chunk, 0, n);
            total += n;
            if (n < wanted) {
                break;
            }
        }

        if (total != announced) {
            throw new DataException("Announced data length and actual length do not match - announced: "
                    + announced + ", actual: " + total);
        }
        return body.toByteArray();
    }
}
