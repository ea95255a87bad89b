package com.questrail.dtnclient.protocol.codec.impl;

import com.questrail.dtnclient.eid.EndpointId;
import com.questrail.dtnclient.protocol.model.InvalidMessageException;
import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;
import org.msgpack.value.IntegerValue;
import org.msgpack.value.Value;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MsgpackValues
 * -----------------------------------------------------------------------------
 * Conversion between plain Java values and MessagePack.
 *
 * <p>Supported Java types and their MessagePack counterparts:</p>
 * <ul>
 *   <li>{@code null} ↔ nil</li>
 *   <li>{@code Boolean} ↔ boolean</li>
 *   <li>{@code Byte/Short/Integer/Long/BigInteger} → int; int → {@code Long},
 *       or {@code BigInteger} above {@link Long#MAX_VALUE} (uint64)</li>
 *   <li>{@code Float/Double} → float; float → {@code Double}</li>
 *   <li>{@code String} ↔ str, {@code byte[]} ↔ bin</li>
 *   <li>{@link EndpointId} → str (canonical text)</li>
 *   <li>{@code Collection} → array → {@code List}</li>
 *   <li>{@code Map} → map → insertion-ordered {@code Map}</li>
 * </ul>
 *
 * <p>Extension types are not used by dtnd and are rejected.</p>
 */
final class MsgpackValues
{
    private MsgpackValues() {}

    /**
     * Serializes a string-keyed mapping as a single MessagePack map.
     *
     * @throws IllegalArgumentException if the mapping holds an unsupported value
     */
    static byte[] packMap(Map<String, ?> mapping) throws IOException {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            pack(packer, mapping);
            packer.flush();
            return packer.toByteArray();
        }
    }

    /**
     * Deserializes exactly one top-level MessagePack map with string keys.
     *
     * @throws IOException                if the bytes are not valid MessagePack
     * @throws InvalidMessageException    if the value is not a single string-keyed map
     */
    static Map<String, Object> unpackMap(byte[] bytes) throws IOException {
        try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(bytes)) {
            if (!unpacker.hasNext()) {
                throw new InvalidMessageException("Message is empty");
            }
            Value value = unpacker.unpackValue();
            if (unpacker.hasNext()) {
                throw new InvalidMessageException(
                        "Message has " + (bytes.length - unpacker.getTotalReadBytes())
                                + " trailing bytes after the top-level map");
            }
            if (!value.isMapValue()) {
                throw new InvalidMessageException(
                        "Message must be a map, was " + value.getValueType());
            }

            Map<String, Object> mapping = new LinkedHashMap<>();
            Value[] keyValues = value.asMapValue().getKeyValueArray();
            for (int i = 0; i < keyValues.length; i += 2) {
                Value key = keyValues[i];
                if (!key.isStringValue()) {
                    throw new InvalidMessageException(
                            "Message keys must be strings, found " + key.getValueType());
                }
                mapping.put(key.asStringValue().asString(), toJava(keyValues[i + 1]));
            }
            return mapping;
        }
    }

    static Object toJava(Value value) {
        return switch (value.getValueType()) {
            case NIL -> null;
            case BOOLEAN -> value.asBooleanValue().getBoolean();
            case INTEGER -> {
                IntegerValue integer = value.asIntegerValue();
                yield integer.isInLongRange() ? (Object) integer.toLong() : integer.toBigInteger();
            }
            case FLOAT -> value.asFloatValue().toDouble();
            case STRING -> value.asStringValue().asString();
            case BINARY -> value.asBinaryValue().asByteArray();
            case ARRAY -> {
                List<Object> list = new ArrayList<>();
                for (Value element : value.asArrayValue()) {
                    list.add(toJava(element));
                }
                yield list;
            }
            case MAP -> {
                Map<Object, Object> map = new LinkedHashMap<>();
                Value[] keyValues = value.asMapValue().getKeyValueArray();
                for (int i = 0; i < keyValues.length; i += 2) {
                    map.put(toJava(keyValues[i]), toJava(keyValues[i + 1]));
                }
                yield map;
            }
            case EXTENSION -> throw new InvalidMessageException(
                    "Unsupported MessagePack value type: " + value.getValueType());
        };
    }

    private static void pack(MessagePacker packer, Object value) throws IOException {
        if (value == null) {
            packer.packNil();
        }
        else if (value instanceof Boolean b) {
            packer.packBoolean(b);
        }
        else if (value instanceof Byte || value instanceof Short
                || value instanceof Integer || value instanceof Long) {
            packer.packLong(((Number) value).longValue());
        }
        else if (value instanceof BigInteger big) {
            // Throws IllegalArgumentException outside the int64/uint64 range.
            packer.packBigInteger(big);
        }
        else if (value instanceof Float f) {
            packer.packFloat(f);
        }
        else if (value instanceof Double d) {
            packer.packDouble(d);
        }
        else if (value instanceof String s) {
            packer.packString(s);
        }
        else if (value instanceof byte[] bytes) {
            packer.packBinaryHeader(bytes.length);
            packer.writePayload(bytes);
        }
        else if (value instanceof EndpointId eid) {
            packer.packString(eid.toString());
        }
        else if (value instanceof Map<?, ?> map) {
            packer.packMapHeader(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                pack(packer, entry.getKey());
                pack(packer, entry.getValue());
            }
        }
        else if (value instanceof Collection<?> collection) {
            packer.packArrayHeader(collection.size());
            for (Object element : collection) {
                pack(packer, element);
            }
        }
        else {
            throw new IllegalArgumentException(
                    "Unsupported value type: " + value.getClass().getName());
        }
    }
}
