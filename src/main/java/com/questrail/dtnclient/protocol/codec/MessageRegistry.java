package com.questrail.dtnclient.protocol.codec;

import com.questrail.dtnclient.protocol.model.BundleCreate;
import com.questrail.dtnclient.protocol.model.BundleCreateResponse;
import com.questrail.dtnclient.protocol.model.DtnMessage;
import com.questrail.dtnclient.protocol.model.FetchAllBundles;
import com.questrail.dtnclient.protocol.model.FetchAllBundlesResponse;
import com.questrail.dtnclient.protocol.model.FetchBundle;
import com.questrail.dtnclient.protocol.model.FetchBundleResponse;
import com.questrail.dtnclient.protocol.model.ListBundles;
import com.questrail.dtnclient.protocol.model.ListResponse;
import com.questrail.dtnclient.protocol.model.MessageType;
import com.questrail.dtnclient.protocol.model.RegisterUnregister;
import com.questrail.dtnclient.protocol.model.Response;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Table mapping each discriminant to the function that rebuilds its variant
 * from a decoded field mapping.
 *
 * <p>Decoders dispatch through this table rather than inspecting runtime
 * types. {@link #defaults()} covers every {@link MessageType}; custom
 * registries exist so that a decoder can be restricted, e.g. to replies.</p>
 */
public final class MessageRegistry
{
    /**
     * Rebuilds a message variant from its decoded field mapping.
     */
    @FunctionalInterface
    public interface MessageFactory {
        DtnMessage fromMapping(Map<String, Object> mapping);
    }

    private static final MessageRegistry DEFAULTS = builder()
            .register(MessageType.RESPONSE, Response::fromMapping)
            .register(MessageType.REGISTER_EID, RegisterUnregister::fromMapping)
            .register(MessageType.UNREGISTER_EID, RegisterUnregister::fromMapping)
            .register(MessageType.BUNDLE_CREATE, BundleCreate::fromMapping)
            .register(MessageType.BUNDLE_CREATE_RESPONSE, BundleCreateResponse::fromMapping)
            .register(MessageType.LIST_BUNDLES, ListBundles::fromMapping)
            .register(MessageType.LIST_RESPONSE, ListResponse::fromMapping)
            .register(MessageType.FETCH_BUNDLE, FetchBundle::fromMapping)
            .register(MessageType.FETCH_BUNDLE_RESPONSE, FetchBundleResponse::fromMapping)
            .register(MessageType.FETCH_ALL_BUNDLES, FetchAllBundles::fromMapping)
            .register(MessageType.FETCH_ALL_BUNDLES_RESPONSE, FetchAllBundlesResponse::fromMapping)
            .build();

    private final Map<MessageType, MessageFactory> factories;

    private MessageRegistry(Map<MessageType, MessageFactory> factories) {
        this.factories = Collections.unmodifiableMap(new EnumMap<>(factories));
    }

    /**
     * Returns the registry covering every message type.
     */
    public static MessageRegistry defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<MessageFactory> lookup(MessageType type) {
        return Optional.ofNullable(factories.get(type));
    }

    public Set<MessageType> registeredTypes() {
        return factories.keySet();
    }

    public static final class Builder {
        private final Map<MessageType, MessageFactory> factories = new EnumMap<>(MessageType.class);

        public Builder register(MessageType type, MessageFactory factory) {
            factories.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(factory, "factory"));
            return this;
        }

        public MessageRegistry build() {
            return new MessageRegistry(factories);
        }
    }
}
