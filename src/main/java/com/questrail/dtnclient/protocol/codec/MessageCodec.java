package com.questrail.dtnclient.protocol.codec;

import com.questrail.dtnclient.protocol.model.DtnMessage;
import com.questrail.dtnclient.protocol.model.InvalidMessageException;

/**
 * MessageCodec
 * -----------------------------------------------------------------------------
 * Boundary between semantic {@link DtnMessage}s and the bytes of one message
 * body on the wire.
 *
 * <p>The codec is responsible only for:</p>
 * <ul>
 *   <li>Serializing a message's field mapping</li>
 *   <li>Deserializing bytes into a mapping and dispatching on its discriminant</li>
 * </ul>
 *
 * <p>The codec is <strong>not</strong> responsible for length framing or
 * transport I/O. It always operates on one complete message body.</p>
 */
public interface MessageCodec
{
    /**
     * Encodes a message body.
     *
     * @param message message to encode
     * @return encoded bytes, without length prefix
     * @throws InvalidMessageException if the message holds a value the wire
     *         format cannot represent
     */
    byte[] encode(DtnMessage message);

    /**
     * Decodes one complete message body.
     *
     * @param bytes encoded bytes, without length prefix
     * @return the decoded message variant
     * @throws InvalidMessageException if the bytes are malformed, carry no
     *         discriminant, an unknown discriminant, a discriminant without a
     *         registered decoder, or violate the variant's invariants
     */
    DtnMessage decode(byte[] bytes);
}
