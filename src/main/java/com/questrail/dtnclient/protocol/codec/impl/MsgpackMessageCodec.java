package com.questrail.dtnclient.protocol.codec.impl;

import com.questrail.dtnclient.protocol.codec.MessageCodec;
import com.questrail.dtnclient.protocol.codec.MessageRegistry;
import com.questrail.dtnclient.protocol.model.DtnMessage;
import com.questrail.dtnclient.protocol.model.InvalidMessageException;
import com.questrail.dtnclient.protocol.model.MessageFields;
import com.questrail.dtnclient.protocol.model.MessageType;
import org.msgpack.core.MessagePackException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * MsgpackMessageCodec
 * -----------------------------------------------------------------------------
 * {@link MessageCodec} producing the MessagePack maps dtnd reads and writes.
 *
 * <h2>Decode steps</h2>
 * <ol>
 *   <li>Unpack exactly one string-keyed map</li>
 *   <li>Require the {@code Type} discriminant</li>
 *   <li>Resolve it to a {@link MessageType}</li>
 *   <li>Look up the variant factory in the {@link MessageRegistry}</li>
 *   <li>Rebuild and validate the variant</li>
 * </ol>
 *
 * <p>A failure at any step raises {@link InvalidMessageException} with a
 * message specific to that step. The raw bytes are first written to the
 * {@link DecodeFailureArchive} and the archived path is attached to the
 * exception.</p>
 */
public final class MsgpackMessageCodec implements MessageCodec
{
    private final MessageRegistry registry;
    private final DecodeFailureArchive archive;

    public MsgpackMessageCodec(MessageRegistry registry, DecodeFailureArchive archive) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.archive = Objects.requireNonNull(archive, "archive");
    }

    /**
     * Codec over the full registry, archiving into the JVM temporary directory.
     */
    public MsgpackMessageCodec() {
        this(MessageRegistry.defaults(), DecodeFailureArchive.inTempDirectory());
    }

    @Override
    public byte[] encode(DtnMessage message) {
        Objects.requireNonNull(message, "message");
        try {
            return MsgpackValues.packMap(message.toMapping());
        } catch (IllegalArgumentException e) {
            throw new InvalidMessageException(
                    "Message " + message.type() + " is not serializable: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public DtnMessage decode(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");

        Map<String, Object> mapping;
        try {
            mapping = MsgpackValues.unpackMap(bytes);
        } catch (InvalidMessageException e) {
            throw failure(bytes, e.getMessage(), e);
        } catch (IOException | MessagePackException e) {
            throw failure(bytes, "Malformed MessagePack data: " + e.getMessage(), e);
        }

        if (!mapping.containsKey(MessageFields.TYPE)) {
            throw failure(bytes, "Message missing '" + MessageFields.TYPE + "' field", null);
        }

        Object rawType = mapping.get(MessageFields.TYPE);
        MessageType type = MessageType.fromWireValue(rawType).orElse(null);
        if (type == null) {
            throw failure(bytes, "Unknown MessageType ID: " + rawType, null);
        }

        MessageRegistry.MessageFactory factory = registry.lookup(type).orElse(null);
        if (factory == null) {
            throw failure(bytes, "No constructor defined for MessageType " + type, null);
        }

        try {
            return factory.fromMapping(mapping);
        } catch (InvalidMessageException e) {
            throw failure(bytes, "Invalid " + type + " message: " + e.getMessage(), e);
        }
    }

    private InvalidMessageException failure(byte[] bytes, String reason, Throwable cause) {
        Path saved;
        try {
            saved = archive.archive(bytes);
        } catch (IOException archiveError) {
            InvalidMessageException e = new InvalidMessageException(reason, cause);
            e.addSuppressed(archiveError);
            return e;
        }
        return new InvalidMessageException(reason + " (raw message saved to " + saved + ")", cause, saved);
    }
}
