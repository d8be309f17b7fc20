package com.webservice.customerio.customer;

import com.fasterxml.jackson.databind.JsonNode;
import com.webservice.customerio.CustomerIo;
import com.webservice.customerio.error.Outcome;
import com.webservice.customerio.util.UrlUtil;
import io.vertx.core.Future;
import io.vertx.core.http.HttpMethod;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Customer profile managed through the Tracking API. Not thread-safe.
 */
@Getter
@Setter
@Accessors(chain = true)
public class Customer {

    private final CustomerIo client;
    private final String id;
    @Nullable
    private String email;
    /**
     * Unix timestamp in seconds.
     */
    @Nullable
    private Long createdAt;
    private Map<String, Object> attributes = new LinkedHashMap<>();

    public Customer(CustomerIo client, String id) {
        this.client = Objects.requireNonNull(client, "client");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Missing required attribute: id");
        }
        this.id = id;
    }

    /**
     * Creates or updates the customer with its email, creation time and all attributes.
     */
    public Future<JsonNode> upsert() {
        Map<String, Object> data = new LinkedHashMap<>(attributes);
        if (email != null) {
            data.put("email", email);
        }
        if (createdAt != null) {
            data.put("created_at", createdAt);
        }
        return request(HttpMethod.PUT, path(), data);
    }

    /**
     * Updates a single attribute, the rest of the profile is left as is.
     */
    public Future<JsonNode> setAttribute(String name, Object value) {
        Objects.requireNonNull(name, "name");
        attributes.put(name, value);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(name, value);
        return request(HttpMethod.PUT, path(), data);
    }

    /**
     * Customer.io removes an attribute when it is set to an empty string.
     */
    public Future<JsonNode> unsetAttribute(String name) {
        Future<JsonNode> result = setAttribute(name, "");
        attributes.remove(name);
        return result;
    }

    public Future<JsonNode> remove() {
        return request(HttpMethod.DELETE, path(), null);
    }

    public Future<JsonNode> suppress() {
        return request(HttpMethod.POST, path() + "/suppress", null);
    }

    public Future<JsonNode> unsuppress() {
        return request(HttpMethod.POST, path() + "/unsuppress", null);
    }

    /**
     * @param platform - ios or android
     * @param lastUsed - unix timestamp in seconds, null if unknown
     */
    public Future<JsonNode> upsertDevice(String deviceId, String platform, @Nullable Long lastUsed) {
        requireValue(deviceId, "device_id");
        requireValue(platform, "platform");
        Map<String, Object> device = new LinkedHashMap<>();
        device.put("id", deviceId);
        device.put("platform", platform);
        if (lastUsed != null) {
            device.put("last_used", lastUsed);
        }
        return request(HttpMethod.PUT, path() + "/devices", Map.of("device", device));
    }

    public Future<JsonNode> deleteDevice(String deviceId) {
        requireValue(deviceId, "device_id");
        return request(HttpMethod.DELETE, path() + "/devices/" + UrlUtil.encodePathSegment(deviceId), null);
    }

    public Future<JsonNode> emitEvent(String name, @Nullable Map<String, Object> data) {
        requireValue(name, "name");
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("name", name);
        if (data != null) {
            event.put("data", data);
        }
        return request(HttpMethod.POST, path() + "/events", event);
    }

    private String path() {
        return "customers/" + UrlUtil.encodePathSegment(id);
    }

    private Future<JsonNode> request(HttpMethod method, String path, @Nullable Object body) {
        return client.trackingRequest(method, path, body).compose(Outcome::toFuture);
    }

    private static void requireValue(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required attribute: " + name);
        }
    }
}
