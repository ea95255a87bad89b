package com.questrail.dtnclient.protocol.model;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Discriminant values carried in the {@code Type} field of every message.
 *
 * <p>The numeric identifiers are fixed by dtnd and must not be reordered.</p>
 */
public enum MessageType
{
    RESPONSE(1),
    REGISTER_EID(2),
    UNREGISTER_EID(3),
    BUNDLE_CREATE(4),
    BUNDLE_CREATE_RESPONSE(5),
    LIST_BUNDLES(6),
    LIST_RESPONSE(7),
    FETCH_BUNDLE(8),
    FETCH_BUNDLE_RESPONSE(9),
    FETCH_ALL_BUNDLES(10),
    FETCH_ALL_BUNDLES_RESPONSE(11);

    private final int id;

    MessageType(int id) {
        this.id = id;
    }

    /**
     * Returns the wire identifier of this message type.
     */
    public int id() {
        return id;
    }

    /**
     * Resolves a wire identifier.
     *
     * @param id numeric discriminant
     * @return the matching type, or empty if the identifier is unknown
     */
    public static Optional<MessageType> fromId(long id) {
        for (MessageType type : values()) {
            if (type.id == id) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a decoded discriminant value of any numeric type.
     *
     * @param value decoded {@code Type} field value
     * @return the matching type, or empty if the value is not a known identifier
     */
    public static Optional<MessageType> fromWireValue(Object value) {
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? fromId(big.longValue()) : Optional.empty();
        }
        if (value instanceof Byte || value instanceof Short
                || value instanceof Integer || value instanceof Long) {
            return fromId(((Number) value).longValue());
        }
        return Optional.empty();
    }
}
