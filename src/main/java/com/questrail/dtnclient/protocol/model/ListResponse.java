package com.questrail.dtnclient.protocol.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reply to {@link ListBundles}: bundle identifiers in the order dtnd sent them.
 */
public record ListResponse(
        MessageType type,
        String error,
        List<String> bundleIds
) implements DtnResponse
{
    public ListResponse {
        MessageFields.requireType(type, MessageType.LIST_RESPONSE);
        Objects.requireNonNull(error, "error");
        bundleIds = List.copyOf(Objects.requireNonNull(bundleIds, "bundleIds"));
    }

    public static ListResponse of(List<String> bundleIds) {
        return new ListResponse(MessageType.LIST_RESPONSE, "", bundleIds);
    }

    @Override
    public Map<String, Object> toMapping() {
        Map<String, Object> mapping = MessageFields.responseBase(type, error);
        mapping.put(MessageFields.BUNDLES, bundleIds);
        return mapping;
    }

    public static ListResponse fromMapping(Map<String, Object> mapping) {
        return new ListResponse(
                MessageFields.type(mapping),
                MessageFields.optionalString(mapping, MessageFields.ERROR),
                MessageFields.stringList(mapping, MessageFields.BUNDLES)
        );
    }
}
