/**
 * Application-Agent Codec
 * =============================================================================
 *
 * <p>Ports that turn semantic messages into message bodies and back. A message
 * body on the wire is one self-describing MessagePack map holding a
 * {@code Type} discriminant and the variant's fields by name.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   DtnMessage
 *        → MessageCodec.encode      (field mapping → bytes)
 *            → LengthPrefixFraming  (client package)
 *
 *   bytes
 *        → MessageCodec.decode      (bytes → mapping → MessageRegistry → variant)
 * </pre>
 *
 * <p>Decoding dispatches on the discriminant through
 * {@link com.questrail.dtnclient.protocol.codec.MessageRegistry}; it never
 * guesses a variant from the fields present.</p>
 */
package com.questrail.dtnclient.protocol.codec;
