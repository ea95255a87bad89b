package com.questrail.dtnclient.protocol.model;

import com.questrail.dtnclient.eid.EndpointId;

import java.util.Map;

/**
 * Request to add or remove a local registration of an endpoint.
 *
 * <p>The tag selects the direction: {@link MessageType#REGISTER_EID} or
 * {@link MessageType#UNREGISTER_EID}. dtnd replies with {@link Response}.</p>
 */
public record RegisterUnregister(
        MessageType type,
        EndpointId endpointId
) implements DtnRequest
{
    public RegisterUnregister {
        MessageFields.requireType(type, MessageType.REGISTER_EID, MessageType.UNREGISTER_EID);
        MessageFields.requirePresent(endpointId, MessageFields.ENDPOINT_ID);
    }

    public static RegisterUnregister register(EndpointId endpointId) {
        return new RegisterUnregister(MessageType.REGISTER_EID, endpointId);
    }

    public static RegisterUnregister unregister(EndpointId endpointId) {
        return new RegisterUnregister(MessageType.UNREGISTER_EID, endpointId);
    }

    public boolean isRegistration() {
        return type == MessageType.REGISTER_EID;
    }

    @Override
    public Map<String, Object> toMapping() {
        Map<String, Object> mapping = MessageFields.base(type);
        mapping.put(MessageFields.ENDPOINT_ID, endpointId.toString());
        return mapping;
    }

    public static RegisterUnregister fromMapping(Map<String, Object> mapping) {
        return new RegisterUnregister(
                MessageFields.type(mapping),
                MessageFields.requireEndpoint(mapping, MessageFields.ENDPOINT_ID)
        );
    }
}
