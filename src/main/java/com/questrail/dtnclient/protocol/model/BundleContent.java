package com.questrail.dtnclient.protocol.model;

import com.questrail.dtnclient.eid.EndpointId;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A bundle as delivered by dtnd: identifier, endpoints and payload.
 *
 * <p>Unlike the message variants, the mapping of a {@code BundleContent} omits
 * every field holding an empty value (empty string, empty payload,
 * {@code dtn:none}). Decoding supplies those defaults for absent keys.</p>
 */
public record BundleContent(
        String bundleId,
        EndpointId source,
        EndpointId destination,
        byte[] payload
) {
    public BundleContent {
        Objects.requireNonNull(bundleId, "bundleId");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        payload = payload == null ? new byte[0] : payload.clone();
    }

    public BundleContent(String bundleId, EndpointId source, EndpointId destination) {
        this(bundleId, source, destination, new byte[0]);
    }

    /**
     * Returns a copy of the payload bytes.
     */
    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public Map<String, Object> toMapping() {
        Map<String, Object> mapping = new LinkedHashMap<>();
        if (!bundleId.isEmpty()) {
            mapping.put(MessageFields.BUNDLE_ID, bundleId);
        }
        if (!source.isNone()) {
            mapping.put(MessageFields.SOURCE_ID, source.toString());
        }
        if (!destination.isNone()) {
            mapping.put(MessageFields.DESTINATION_ID, destination.toString());
        }
        if (payload.length > 0) {
            mapping.put(MessageFields.PAYLOAD, payload.clone());
        }
        return mapping;
    }

    public static BundleContent fromMapping(Map<String, Object> mapping) {
        return new BundleContent(
                MessageFields.optionalString(mapping, MessageFields.BUNDLE_ID),
                MessageFields.optionalEndpoint(mapping, MessageFields.SOURCE_ID),
                MessageFields.optionalEndpoint(mapping, MessageFields.DESTINATION_ID),
                MessageFields.optionalBytes(mapping, MessageFields.PAYLOAD)
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BundleContent that)) return false;
        return bundleId.equals(that.bundleId)
                && source.equals(that.source)
                && destination.equals(that.destination)
                && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bundleId, source, destination) * 31 + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "BundleContent[bundleId=" + bundleId
                + ", source=" + source
                + ", destination=" + destination
                + ", payload=" + payload.length + " bytes]";
    }
}
