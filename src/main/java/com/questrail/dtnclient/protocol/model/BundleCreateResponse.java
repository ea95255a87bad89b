package com.questrail.dtnclient.protocol.model;

import java.util.Map;
import java.util.Objects;

/**
 * Reply to {@link BundleCreate} carrying the identifier of the new bundle.
 */
public record BundleCreateResponse(
        MessageType type,
        String error,
        String bundleId
) implements DtnResponse
{
    public BundleCreateResponse {
        MessageFields.requireType(type, MessageType.BUNDLE_CREATE_RESPONSE);
        Objects.requireNonNull(error, "error");
        MessageFields.requireNonEmpty(bundleId, MessageFields.BUNDLE_ID);
    }

    public static BundleCreateResponse of(String bundleId) {
        return new BundleCreateResponse(MessageType.BUNDLE_CREATE_RESPONSE, "", bundleId);
    }

    @Override
    public Map<String, Object> toMapping() {
        Map<String, Object> mapping = MessageFields.responseBase(type, error);
        mapping.put(MessageFields.BUNDLE_ID, bundleId);
        return mapping;
    }

    public static BundleCreateResponse fromMapping(Map<String, Object> mapping) {
        return new BundleCreateResponse(
                MessageFields.type(mapping),
                MessageFields.optionalString(mapping, MessageFields.ERROR),
                MessageFields.requireString(mapping, MessageFields.BUNDLE_ID)
        );
    }
}
