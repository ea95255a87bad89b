package com.questrail.dtnclient.protocol.model;

import java.util.Map;

/**
 * Request to build a bundle from an argument map and inject it into dtnd.
 *
 * <p>The argument names and their meanings are those of dtnd's bundle
 * builder ({@code source}, {@code destination}, {@code creation_timestamp_now},
 * {@code lifetime}, {@code payload_block}, ...). This client does not
 * interpret them; it only requires the map to be non-empty.</p>
 *
 * <p>Argument values may be strings, booleans, integers (up to the unsigned
 * 64-bit range), floating point numbers, byte arrays, endpoint identifiers,
 * lists and nested maps of those. They are stored as the codec decodes them
 * (integers as {@code Long} or {@code BigInteger}, endpoint identifiers as
 * text, byte arrays and nested containers copied), so a decoded request
 * equals the one that was encoded.</p>
 */
public record BundleCreate(
        MessageType type,
        Map<String, Object> args
) implements DtnRequest
{
    public BundleCreate {
        MessageFields.requireType(type, MessageType.BUNDLE_CREATE);
        if (args == null || args.isEmpty()) {
            throw new InvalidMessageException(MessageFields.ARGS + " must not be empty");
        }
        args = BundleArguments.normalize(args);
    }

    public static BundleCreate of(Map<String, Object> args) {
        return new BundleCreate(MessageType.BUNDLE_CREATE, args);
    }

    @Override
    public Map<String, Object> toMapping() {
        Map<String, Object> mapping = MessageFields.base(type);
        mapping.put(MessageFields.ARGS, args);
        return mapping;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BundleCreate that)) return false;
        return type == that.type && BundleArguments.deepEquals(args, that.args);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + BundleArguments.deepHashCode(args);
    }

    public static BundleCreate fromMapping(Map<String, Object> mapping) {
        return new BundleCreate(
                MessageFields.type(mapping),
                MessageFields.requireMap(mapping, MessageFields.ARGS)
        );
    }
}
