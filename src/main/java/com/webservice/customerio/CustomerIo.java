package com.webservice.customerio;

import com.fasterxml.jackson.databind.JsonNode;
import com.webservice.customerio.config.ClientSettings;
import com.webservice.customerio.config.RateLimitSettings;
import com.webservice.customerio.config.Settings;
import com.webservice.customerio.customer.Customer;
import com.webservice.customerio.error.ErrorClassifier;
import com.webservice.customerio.error.Outcome;
import com.webservice.customerio.http.ApiRequest;
import com.webservice.customerio.http.EndpointClass;
import com.webservice.customerio.http.EndpointRoute;
import com.webservice.customerio.http.HttpExecutor;
import com.webservice.customerio.http.PendingRequest;
import com.webservice.customerio.http.RequestDispatcher;
import com.webservice.customerio.http.VertxHttpExecutor;
import com.webservice.customerio.limiter.RateLimiter;
import com.webservice.customerio.service.ScheduledService;
import com.webservice.customerio.service.VertxScheduledService;
import com.webservice.customerio.trigger.Trigger;
import com.webservice.customerio.util.UrlUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Client for the two stable Customer.io APIs:
 * <ul>
 * <li>Tracking API - behavioral tracking API used to identify and track customer data.</li>
 * <li>Regular API - currently only used for sending API triggered broadcasts.</li>
 * </ul>
 * Each API has its own rate limiter, requests beyond the limit wait for a free slot instead of failing.
 */
@Slf4j
public class CustomerIo {

    private final String siteId;
    private final String apiKey;
    private final RateLimiter trackingRateLimiter;
    private final RateLimiter apiRateLimiter;
    private final RequestDispatcher dispatcher;
    @Nullable
    private final HttpClient client;

    /**
     * Creates a client on top of the given transport and scheduler, mainly for testing.
     *
     * @throws IllegalArgumentException if site id or api key is missing
     */
    public CustomerIo(ClientSettings settings, HttpExecutor executor, ScheduledService scheduler) {
        this(settings, executor, scheduler, null);
    }

    private CustomerIo(ClientSettings settings, HttpExecutor executor, ScheduledService scheduler, @Nullable HttpClient client) {
        validate(settings);
        this.siteId = settings.getSiteId();
        this.apiKey = settings.getApiKey();
        this.trackingRateLimiter = rateLimiter("tracking", settings.getTrackingLimit(), scheduler);
        this.apiRateLimiter = rateLimiter("api", settings.getApiLimit(), scheduler);

        Map<EndpointClass, EndpointRoute> routes = new EnumMap<>(EndpointClass.class);
        routes.put(EndpointClass.TRACKING, new EndpointRoute(settings.getTrackingEndpoint(), trackingRateLimiter));
        routes.put(EndpointClass.API, new EndpointRoute(settings.getApiEndpoint(), apiRateLimiter));

        this.dispatcher = new RequestDispatcher(executor, new ErrorClassifier(), siteId, apiKey, routes);
        this.client = client;
        log.info("Customer.io client created. Site: {}. Tracking limiter: {}. Api limiter: {}",
                siteId, trackingRateLimiter, apiRateLimiter);
    }

    /**
     * Creates a client with settings from the default resource, settings file and environment.
     */
    public static CustomerIo create(Vertx vertx) throws IOException {
        JsonObject settings = Settings.settings();
        return create(vertx, Settings.clientSettings(settings), Settings.httpClientOptions(settings));
    }

    public static CustomerIo create(Vertx vertx, ClientSettings settings, HttpClientOptions options) {
        validate(settings);
        HttpClient client = vertx.createHttpClient(options);
        HttpExecutor executor = new VertxHttpExecutor(client, settings.getUserAgent());
        try {
            return new CustomerIo(settings, executor, new VertxScheduledService(vertx), client);
        } catch (RuntimeException e) {
            client.close();
            throw e;
        }
    }

    public String siteId() {
        return siteId;
    }

    public String apiKey() {
        return apiKey;
    }

    public RateLimiter trackingRateLimiter() {
        return trackingRateLimiter;
    }

    public RateLimiter apiRateLimiter() {
        return apiRateLimiter;
    }

    /**
     * Sends a request to the Tracking API end point.
     */
    public Future<Outcome> trackingRequest(HttpMethod method, String path, @Nullable Object body) {
        return dispatcher.dispatch(EndpointClass.TRACKING, method, path, body);
    }

    /**
     * Sends a request to the Regular API end point.
     */
    public Future<Outcome> apiRequest(HttpMethod method, String path, @Nullable Object body) {
        return dispatcher.dispatch(EndpointClass.API, method, path, body);
    }

    /**
     * Sends a request and returns a handle that can withdraw it while it waits for its rate limiter.
     */
    public PendingRequest submit(EndpointClass endpointClass, HttpMethod method, String path, @Nullable Object body) {
        return dispatcher.submit(new ApiRequest(endpointClass, method, path, body));
    }

    public Customer newCustomer(String id) {
        return new Customer(this, id);
    }

    public Trigger newTrigger(String campaignId) {
        return new Trigger(this, campaignId);
    }

    /**
     * Retrieves a trigger previously activated for the campaign.
     */
    public Future<Trigger> findTrigger(String campaignId, String triggerId) {
        return Trigger.find(this, campaignId, triggerId);
    }

    /**
     * Sends an anonymous event, e.g. {@code {"name": "purchase", "data": {...}}}.
     */
    public Future<JsonNode> emitEvent(Map<String, Object> event) {
        Objects.requireNonNull(event, "event");
        return trackingRequest(HttpMethod.POST, "events", event).compose(Outcome::toFuture);
    }

    /**
     * Adds people to a manual segment.
     */
    public Future<JsonNode> addToSegment(String segmentId, Collection<String> customerIds) {
        return segmentRequest(segmentId, "add_customers", customerIds);
    }

    /**
     * Removes people from a manual segment.
     */
    public Future<JsonNode> removeFromSegment(String segmentId, Collection<String> customerIds) {
        return segmentRequest(segmentId, "remove_customers", customerIds);
    }

    /**
     * Closes the underlying http client if this instance created it.
     */
    public Future<Void> close() {
        log.info("Customer.io client closed. Site: {}", siteId);
        return (client == null) ? Future.succeededFuture() : client.close();
    }

    private Future<JsonNode> segmentRequest(String segmentId, String action, Collection<String> customerIds) {
        if (segmentId == null || segmentId.isBlank()) {
            throw new IllegalArgumentException("Missing required attribute: segment_id");
        }
        if (customerIds == null) {
            throw new IllegalArgumentException("Invalid value for customers_ids");
        }
        String path = "segments/%s/%s".formatted(UrlUtil.encodePathSegment(segmentId), action);
        return trackingRequest(HttpMethod.POST, path, Map.of("ids", customerIds)).compose(Outcome::toFuture);
    }

    private static RateLimiter rateLimiter(String name, RateLimitSettings limit, ScheduledService scheduler) {
        return new RateLimiter(name, limit.getLimit(), limit.getInterval(), limit.getPolicy(), scheduler);
    }

    private static void validate(ClientSettings settings) {
        Objects.requireNonNull(settings, "settings");
        requireArgument(settings.getSiteId(), "siteId");
        requireArgument(settings.getApiKey(), "apiKey");
        if (!UrlUtil.isAbsoluteUrl(requireArgument(settings.getTrackingEndpoint(), "trackingEndpoint"))) {
            throw new IllegalArgumentException("Tracking endpoint must be an absolute url: " + settings.getTrackingEndpoint());
        }
        if (!UrlUtil.isAbsoluteUrl(requireArgument(settings.getApiEndpoint(), "apiEndpoint"))) {
            throw new IllegalArgumentException("Api endpoint must be an absolute url: " + settings.getApiEndpoint());
        }
        requirePositive(settings.getTrackingLimit(), "trackingLimit");
        requirePositive(settings.getApiLimit(), "apiLimit");
    }

    private static void requirePositive(RateLimitSettings limit, String name) {
        if (limit == null || !limit.isPositive()) {
            throw new IllegalArgumentException("Rate limit must be positive for: " + name);
        }
    }

    private static String requireArgument(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required argument: " + name);
        }
        return value;
    }
}
