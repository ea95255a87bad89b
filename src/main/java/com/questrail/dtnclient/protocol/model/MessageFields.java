package com.questrail.dtnclient.protocol.model;

import com.questrail.dtnclient.eid.EidException;
import com.questrail.dtnclient.eid.EndpointId;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Wire field names and typed field access for message mappings.
 *
 * <p>Field names follow dtnd's message structs, which are serialized with
 * their exported (capitalised) Go field names.</p>
 */
public final class MessageFields
{
    /** Discriminant field present in every message. */
    public static final String TYPE = "Type";

    public static final String ERROR = "Error";
    public static final String ENDPOINT_ID = "EndpointID";
    public static final String ARGS = "Args";
    public static final String BUNDLE_ID = "BundleID";
    public static final String MAILBOX = "Mailbox";
    public static final String NEW = "New";
    public static final String REMOVE = "Remove";
    public static final String BUNDLES = "Bundles";
    public static final String BUNDLE_CONTENT = "BundleContent";
    public static final String SOURCE_ID = "SourceID";
    public static final String DESTINATION_ID = "DestinationID";
    public static final String PAYLOAD = "Payload";

    private MessageFields() {}

    // ------------------------------------------------------------------------
    // Encoding side
    // ------------------------------------------------------------------------

    static Map<String, Object> base(MessageType type) {
        Map<String, Object> mapping = new LinkedHashMap<>();
        mapping.put(TYPE, type.id());
        return mapping;
    }

    static Map<String, Object> responseBase(MessageType type, String error) {
        Map<String, Object> mapping = base(type);
        mapping.put(ERROR, error);
        return mapping;
    }

    // ------------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------------

    static void requireType(MessageType actual, MessageType... allowed) {
        Objects.requireNonNull(actual, "type");
        for (MessageType candidate : allowed) {
            if (candidate == actual) {
                return;
            }
        }
        String expected = allowed.length == 1
                ? allowed[0].toString()
                : String.join(" or ", Arrays.stream(allowed).map(MessageType::toString).toList());
        throw new InvalidMessageException(
                "Message needs MessageType " + expected + ", but has " + actual);
    }

    static void requirePresent(EndpointId endpoint, String field) {
        if (endpoint == null || endpoint.isNone()) {
            throw new InvalidMessageException(field + " must not be none/empty");
        }
    }

    static void requireNonEmpty(String value, String field) {
        if (value == null || value.isEmpty()) {
            throw new InvalidMessageException(field + " must not be empty");
        }
    }

    // ------------------------------------------------------------------------
    // Decoding side
    // ------------------------------------------------------------------------

    static MessageType type(Map<String, ?> mapping) {
        if (!mapping.containsKey(TYPE)) {
            throw new InvalidMessageException("Message missing '" + TYPE + "' field");
        }
        Object raw = mapping.get(TYPE);
        return MessageType.fromWireValue(raw)
                .orElseThrow(() -> new InvalidMessageException("Unknown MessageType ID: " + raw));
    }

    static Object require(Map<String, ?> mapping, String key) {
        if (!mapping.containsKey(key)) {
            throw new InvalidMessageException("Message missing '" + key + "' field");
        }
        return mapping.get(key);
    }

    static String requireString(Map<String, ?> mapping, String key) {
        Object value = require(mapping, key);
        if (!(value instanceof String s)) {
            throw mistyped(key, "a string", value);
        }
        return s;
    }

    static String optionalString(Map<String, ?> mapping, String key) {
        Object value = mapping.get(key);
        if (value == null) {
            return "";
        }
        if (!(value instanceof String s)) {
            throw mistyped(key, "a string", value);
        }
        return s;
    }

    static boolean requireBoolean(Map<String, ?> mapping, String key) {
        Object value = require(mapping, key);
        if (!(value instanceof Boolean b)) {
            throw mistyped(key, "a boolean", value);
        }
        return b;
    }

    static EndpointId requireEndpoint(Map<String, ?> mapping, String key) {
        return toEndpoint(key, requireString(mapping, key));
    }

    static EndpointId optionalEndpoint(Map<String, ?> mapping, String key) {
        String text = optionalString(mapping, key);
        return text.isEmpty() ? EndpointId.none() : toEndpoint(key, text);
    }

    static byte[] optionalBytes(Map<String, ?> mapping, String key) {
        Object value = mapping.get(key);
        if (value == null) {
            return new byte[0];
        }
        if (!(value instanceof byte[] bytes)) {
            throw mistyped(key, "a byte string", value);
        }
        return bytes;
    }

    static Map<String, Object> requireMap(Map<String, ?> mapping, String key) {
        return asStringKeyedMap(key, require(mapping, key));
    }

    static List<Object> optionalList(Map<String, ?> mapping, String key) {
        Object value = require(mapping, key);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List<?> list)) {
            throw mistyped(key, "an array", value);
        }
        return new ArrayList<>(list);
    }

    static List<String> stringList(Map<String, ?> mapping, String key) {
        List<String> result = new ArrayList<>();
        for (Object element : optionalList(mapping, key)) {
            if (!(element instanceof String s)) {
                throw mistyped(key, "an array of strings", element);
            }
            result.add(s);
        }
        return result;
    }

    static Map<String, Object> asStringKeyedMap(String key, Object value) {
        if (!(value instanceof Map<?, ?> raw)) {
            throw mistyped(key, "a map", value);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (!(entry.getKey() instanceof String name)) {
                throw new InvalidMessageException(
                        "Field '" + key + "' must only have string keys, found " + entry.getKey());
            }
            result.put(name, entry.getValue());
        }
        return result;
    }

    private static EndpointId toEndpoint(String key, String text) {
        try {
            return EndpointId.parse(text);
        } catch (EidException e) {
            throw new InvalidMessageException(
                    "Field '" + key + "' is not a valid EndpointID: " + e.getMessage(), e);
        }
    }

    private static InvalidMessageException mistyped(String key, String expected, Object actual) {
        String actualType = actual == null ? "nil" : actual.getClass().getSimpleName();
        return new InvalidMessageException(
                "Field '" + key + "' must be " + expected + ", was " + actualType);
    }
}
