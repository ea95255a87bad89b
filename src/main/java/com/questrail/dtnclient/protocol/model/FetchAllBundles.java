package com.questrail.dtnclient.protocol.model;

import com.questrail.dtnclient.eid.EndpointId;

import java.util.Map;

/**
 * Request for the content of every bundle in a mailbox.
 */
public record FetchAllBundles(
        MessageType type,
        EndpointId mailbox,
        boolean newOnly,
        boolean remove
) implements DtnRequest
{
    public FetchAllBundles {
        MessageFields.requireType(type, MessageType.FETCH_ALL_BUNDLES);
        MessageFields.requirePresent(mailbox, MessageFields.MAILBOX);
    }

    public static FetchAllBundles of(EndpointId mailbox, boolean newOnly, boolean remove) {
        return new FetchAllBundles(MessageType.FETCH_ALL_BUNDLES, mailbox, newOnly, remove);
    }

    @Override
    public Map<String, Object> toMapping() {
        Map<String, Object> mapping = MessageFields.base(type);
        mapping.put(MessageFields.MAILBOX, mailbox.toString());
        mapping.put(MessageFields.NEW, newOnly);
        mapping.put(MessageFields.REMOVE, remove);
        return mapping;
    }

    public static FetchAllBundles fromMapping(Map<String, Object> mapping) {
        return new FetchAllBundles(
                MessageFields.type(mapping),
                MessageFields.requireEndpoint(mapping, MessageFields.MAILBOX),
                MessageFields.requireBoolean(mapping, MessageFields.NEW),
                MessageFields.requireBoolean(mapping, MessageFields.REMOVE)
        );
    }
}
