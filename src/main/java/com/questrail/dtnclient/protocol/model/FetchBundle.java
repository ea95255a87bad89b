package com.questrail.dtnclient.protocol.model;

import com.questrail.dtnclient.eid.EndpointId;

import java.util.Map;

/**
 * Request for the content of one bundle in a mailbox.
 *
 * <p>With {@code remove} set, dtnd deletes the bundle once it has been
 * delivered.</p>
 */
public record FetchBundle(
        MessageType type,
        EndpointId mailbox,
        String bundleId,
        boolean remove
) implements DtnRequest
{
    public FetchBundle {
        MessageFields.requireType(type, MessageType.FETCH_BUNDLE);
        MessageFields.requirePresent(mailbox, MessageFields.MAILBOX);
        MessageFields.requireNonEmpty(bundleId, MessageFields.BUNDLE_ID);
    }

    public static FetchBundle of(EndpointId mailbox, String bundleId, boolean remove) {
        return new FetchBundle(MessageType.FETCH_BUNDLE, mailbox, bundleId, remove);
    }

    @Override
    public Map<String, Object> toMapping() {
        Map<String, Object> mapping = MessageFields.base(type);
        mapping.put(MessageFields.MAILBOX, mailbox.toString());
        mapping.put(MessageFields.BUNDLE_ID, bundleId);
        mapping.put(MessageFields.REMOVE, remove);
        return mapping;
    }

    public static FetchBundle fromMapping(Map<String, Object> mapping) {
        return new FetchBundle(
                MessageFields.type(mapping),
                MessageFields.requireEndpoint(mapping, MessageFields.MAILBOX),
                MessageFields.requireString(mapping, MessageFields.BUNDLE_ID),
                MessageFields.requireBoolean(mapping, MessageFields.REMOVE)
        );
    }
}
