package com.webservice.customerio.trigger;

import com.fasterxml.jackson.databind.JsonNode;
import com.webservice.customerio.CustomerIo;
import com.webservice.customerio.error.Outcome;
import com.webservice.customerio.util.UrlUtil;
import io.vertx.core.Future;
import io.vertx.core.http.HttpMethod;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * API triggered broadcast of a campaign. A trigger gets its id once activated. Not thread-safe.
 */
@Getter
@Setter
@Accessors(chain = true)
public class Trigger {

    private final CustomerIo client;
    private final String campaignId;
    @Nullable
    @Setter(AccessLevel.NONE)
    private String id;
    @Nullable
    private Map<String, Object> data;
    @Nullable
    private Map<String, Object> recipients;
    @Nullable
    private List<String> ids;
    @Nullable
    private List<String> emails;
    @Nullable
    private List<Map<String, Object>> perUserData;
    @Nullable
    private String dataFileUrl;

    public Trigger(CustomerIo client, String campaignId) {
        this.client = Objects.requireNonNull(client, "client");
        if (campaignId == null || campaignId.isBlank()) {
            throw new IllegalArgumentException("Missing required attribute: campaign_id");
        }
        this.campaignId = campaignId;
    }

    /**
     * Loads a trigger previously activated for the campaign.
     */
    public static Future<Trigger> find(CustomerIo client, String campaignId, String triggerId) {
        if (triggerId == null || triggerId.isBlank()) {
            throw new IllegalArgumentException("Missing required attribute: trigger_id");
        }
        Trigger trigger = new Trigger(client, campaignId);
        trigger.id = triggerId;
        return trigger.status().map(trigger::load);
    }

    /**
     * Starts the broadcast and remembers the id returned by Customer.io.
     *
     * @throws IllegalStateException if the trigger is already activated
     */
    public Future<String> activate() {
        if (id != null) {
            throw new IllegalStateException("This trigger is already activated: " + id);
        }
        return request(HttpMethod.POST, campaignPath(), body()).map(payload -> {
            JsonNode node = payload.get("id");
            if (node == null || node.isNull()) {
                throw new IllegalStateException("Trigger id is missing in response: " + payload);
            }
            id = node.asText();
            return id;
        });
    }

    public Future<JsonNode> status() {
        return request(HttpMethod.GET, triggerPath(), null);
    }

    public Future<JsonNode> errors() {
        return request(HttpMethod.GET, triggerPath() + "/errors", null);
    }

    private Trigger load(JsonNode payload) {
        JsonNode trigger = payload.has("trigger") ? payload.get("trigger") : payload;
        JsonNode triggerId = trigger.get("id");
        if (triggerId != null && !triggerId.isNull()) {
            id = triggerId.asText();
        }
        return this;
    }

    private Map<String, Object> body() {
        Map<String, Object> body = new LinkedHashMap<>();
        putIfPresent(body, "data", data);
        putIfPresent(body, "recipients", recipients);
        putIfPresent(body, "ids", ids);
        putIfPresent(body, "emails", emails);
        putIfPresent(body, "per_user_data", perUserData);
        putIfPresent(body, "data_file_url", dataFileUrl);
        return body;
    }

    private String campaignPath() {
        return "campaigns/" + UrlUtil.encodePathSegment(campaignId) + "/triggers";
    }

    private String triggerPath() {
        if (id == null) {
            throw new IllegalStateException("This trigger is not activated yet");
        }
        return campaignPath() + "/" + UrlUtil.encodePathSegment(id);
    }

    private Future<JsonNode> request(HttpMethod method, String path, @Nullable Object body) {
        return client.apiRequest(method, path, body).compose(Outcome::toFuture);
    }

    private static void putIfPresent(Map<String, Object> body, String key, @Nullable Object value) {
        if (value != null) {
            body.put(key, value);
        }
    }
}
