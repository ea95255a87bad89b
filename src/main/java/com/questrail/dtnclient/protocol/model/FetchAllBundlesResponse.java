package com.questrail.dtnclient.protocol.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reply to {@link FetchAllBundles}: bundle contents in the order dtnd sent them.
 */
public record FetchAllBundlesResponse(
        MessageType type,
        String error,
        List<BundleContent> contents
) implements DtnResponse
{
    public FetchAllBundlesResponse {
        MessageFields.requireType(type, MessageType.FETCH_ALL_BUNDLES_RESPONSE);
        Objects.requireNonNull(error, "error");
        contents = List.copyOf(Objects.requireNonNull(contents, "contents"));
    }

    public static FetchAllBundlesResponse of(List<BundleContent> contents) {
        return new FetchAllBundlesResponse(MessageType.FETCH_ALL_BUNDLES_RESPONSE, "", contents);
    }

    @Override
    public Map<String, Object> toMapping() {
        Map<String, Object> mapping = MessageFields.responseBase(type, error);
        List<Map<String, Object>> bundles = new ArrayList<>(contents.size());
        for (BundleContent content : contents) {
            bundles.add(content.toMapping());
        }
        mapping.put(MessageFields.BUNDLES, bundles);
        return mapping;
    }

    public static FetchAllBundlesResponse fromMapping(Map<String, Object> mapping) {
        List<BundleContent> contents = new ArrayList<>();
        for (Object element : MessageFields.optionalList(mapping, MessageFields.BUNDLES)) {
            contents.add(BundleContent.fromMapping(
                    MessageFields.asStringKeyedMap(MessageFields.BUNDLES, element)));
        }
        return new FetchAllBundlesResponse(
                MessageFields.type(mapping),
                MessageFields.optionalString(mapping, MessageFields.ERROR),
                contents
        );
    }
}
