package com.questrail.dtnclient.protocol.model;

import java.util.Map;
import java.util.Objects;

/**
 * Generic reply carrying only an error string.
 *
 * <p>dtnd answers registrations and unregistrations with this variant, and
 * uses it for errors raised before a request could be dispatched.</p>
 */
public record Response(
        MessageType type,
        String error
) implements DtnResponse
{
    public Response {
        MessageFields.requireType(type, MessageType.RESPONSE);
        Objects.requireNonNull(error, "error");
    }

    /**
     * Creates a successful reply.
     */
    public static Response ok() {
        return new Response(MessageType.RESPONSE, "");
    }

    /**
     * Creates a reply reporting {@code error}.
     */
    public static Response failure(String error) {
        return new Response(MessageType.RESPONSE, error);
    }

    @Override
    public Map<String, Object> toMapping() {
        return MessageFields.responseBase(type, error);
    }

    public static Response fromMapping(Map<String, Object> mapping) {
        return new Response(
                MessageFields.type(mapping),
                MessageFields.optionalString(mapping, MessageFields.ERROR)
        );
    }
}
