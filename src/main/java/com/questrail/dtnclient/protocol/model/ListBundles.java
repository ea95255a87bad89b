package com.questrail.dtnclient.protocol.model;

import com.questrail.dtnclient.eid.EndpointId;

import java.util.Map;

/**
 * Request to enumerate the bundles stored in a mailbox.
 *
 * <p>With {@code newOnly} set, only bundles that have never been fetched are
 * listed.</p>
 */
public record ListBundles(
        MessageType type,
        EndpointId mailbox,
        boolean newOnly
) implements DtnRequest
{
    public ListBundles {
        MessageFields.requireType(type, MessageType.LIST_BUNDLES);
        MessageFields.requirePresent(mailbox, MessageFields.MAILBOX);
    }

    public static ListBundles of(EndpointId mailbox, boolean newOnly) {
        return new ListBundles(MessageType.LIST_BUNDLES, mailbox, newOnly);
    }

    @Override
    public Map<String, Object> toMapping() {
        Map<String, Object> mapping = MessageFields.base(type);
        mapping.put(MessageFields.MAILBOX, mailbox.toString());
        mapping.put(MessageFields.NEW, newOnly);
        return mapping;
    }

    public static ListBundles fromMapping(Map<String, Object> mapping) {
        return new ListBundles(
                MessageFields.type(mapping),
                MessageFields.requireEndpoint(mapping, MessageFields.MAILBOX),
                MessageFields.requireBoolean(mapping, MessageFields.NEW)
        );
    }
}
