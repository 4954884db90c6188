package com.ryuqq.statetree.device;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Feeds raw registration responses into a {@link Device}.
 *
 * <p>The transport hands over the response body as text; this handler deserialises it into the
 * plain map shape the state tree consumes and applies it in one dispatch pass.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * DeviceRegistrationHandler handler = new DeviceRegistrationHandler(device);
 * handler.onRegistrationSuccess(response.body());
 * </pre>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public final class DeviceRegistrationHandler {

    private static final Logger log = LoggerFactory.getLogger(DeviceRegistrationHandler.class);
    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {
    };

    private final Device device;
    private final ObjectMapper objectMapper;

    /**
     * Creates a handler with a default {@link ObjectMapper}.
     *
     * @param device device to update
     */
    public DeviceRegistrationHandler(Device device) {
        this(device, new ObjectMapper());
    }

    /**
     * @param device device to update
     * @param objectMapper mapper used to read response bodies
     * @throws IllegalArgumentException if either argument is null
     */
    public DeviceRegistrationHandler(Device device, ObjectMapper objectMapper) {
        if (device == null) {
            throw new IllegalArgumentException("device cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.device = device;
        this.objectMapper = objectMapper;
    }

    /**
     * Applies a successful registration response.
     *
     * @param body JSON object text
     * @throws RegistrationException if the body is not a JSON object
     * @throws com.ryuqq.statetree.core.exception.ValidationException if the body does not fit the device model
     */
    public void onRegistrationSuccess(String body) {
        device.processRegistrationSuccess(parse(body));
        log.info("Device registration processed (registered={})", device.isRegistered());
    }

    /**
     * Clears the device after an unregister or a failed refresh.
     */
    public void onUnregistered() {
        device.clear();
        log.info("Device unregistered");
    }

    /**
     * Reads a response body into the snapshot shape.
     *
     * @param body JSON object text
     * @return deserialised body
     * @throws RegistrationException if the body is blank or not a JSON object
     */
    public Map<String, Object> parse(String body) {
        if (body == null || body.isBlank()) {
            throw new RegistrationException("Registration response body is empty");
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(body, BODY_TYPE);
            if (parsed == null) {
                throw new RegistrationException("Registration response body is JSON null");
            }
            return parsed;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable registration response: {}", e.getOriginalMessage());
            throw new RegistrationException("Registration response is not a JSON object", e);
        }
    }
}
