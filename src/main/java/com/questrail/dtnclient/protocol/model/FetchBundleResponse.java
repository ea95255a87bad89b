package com.questrail.dtnclient.protocol.model;

import java.util.Map;
import java.util.Objects;

/**
 * Reply to {@link FetchBundle}.
 */
public record FetchBundleResponse(
        MessageType type,
        String error,
        BundleContent content
) implements DtnResponse
{
    public FetchBundleResponse {
        MessageFields.requireType(type, MessageType.FETCH_BUNDLE_RESPONSE);
        Objects.requireNonNull(error, "error");
        if (content == null) {
            throw new InvalidMessageException(MessageFields.BUNDLE_CONTENT + " must not be missing");
        }
    }

    public static FetchBundleResponse of(BundleContent content) {
        return new FetchBundleResponse(MessageType.FETCH_BUNDLE_RESPONSE, "", content);
    }

    @Override
    public Map<String, Object> toMapping() {
        Map<String, Object> mapping = MessageFields.responseBase(type, error);
        mapping.put(MessageFields.BUNDLE_CONTENT, content.toMapping());
        return mapping;
    }

    public static FetchBundleResponse fromMapping(Map<String, Object> mapping) {
        return new FetchBundleResponse(
                MessageFields.type(mapping),
                MessageFields.optionalString(mapping, MessageFields.ERROR),
                BundleContent.fromMapping(
                        MessageFields.requireMap(mapping, MessageFields.BUNDLE_CONTENT))
        );
    }
}
