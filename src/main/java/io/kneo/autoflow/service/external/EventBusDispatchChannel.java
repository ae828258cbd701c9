package io.kneo.autoflow.service.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kneo.autoflow.config.AutoFlowConfig;
import io.kneo.autoflow.model.action.FlowAction;
import io.kneo.autoflow.service.exceptions.ActionDispatchException;
import io.quarkus.arc.DefaultBean;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.eventbus.EventBus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.UUID;

@DefaultBean
@ApplicationScoped
public class EventBusDispatchChannel implements ActionDispatchChannel {
    private static final Logger LOGGER = LoggerFactory.getLogger(EventBusDispatchChannel.class);

    private final EventBus eventBus;
    private final ObjectMapper objectMapper;
    private final String address;

    @Inject
    public EventBusDispatchChannel(EventBus eventBus, ObjectMapper objectMapper, AutoFlowConfig config) {
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
        this.address = config.getDispatchAddress();
    }

    @Override
    public void emit(UUID flowId, FlowAction action, Instant occurredAt) {
        JsonObject payload;
        try {
            payload = new JsonObject()
                    .put("flowId", flowId.toString())
                    .put("actionType", action.type().getValue())
                    .put("occurredAt", occurredAt.toString())
                    .put("action", new JsonObject(objectMapper.writeValueAsString(action)));
        } catch (JsonProcessingException e) {
            throw new ActionDispatchException("Cannot serialize " + action.type().getValue() + " for flow " + flowId, e);
        }
        eventBus.publish(address, payload);
        LOGGER.debug("Published {} for flow {} to {}", action.type().getValue(), flowId, address);
    }
}
