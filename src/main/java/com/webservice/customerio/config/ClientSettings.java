package com.webservice.customerio.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.webservice.customerio.limiter.ReplenishPolicy;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientSettings {
    public static final String TRACKING_END_POINT = "https://track.customer.io/api/v1";
    public static final String API_END_POINT = "https://api.customer.io/v1/api";
    public static final int REQUEST_PER_SECOND_LIMIT_TRACKING = 30;
    public static final int REQUEST_PER_SECOND_LIMIT_API = 10;
    public static final String DEFAULT_USER_AGENT = "WebService-Async-CustomerIO-Java";

    private String siteId;
    private String apiKey;
    private String trackingEndpoint = TRACKING_END_POINT;
    private String apiEndpoint = API_END_POINT;
    private String userAgent = DEFAULT_USER_AGENT;
    private RateLimitSettings trackingLimit = new RateLimitSettings(REQUEST_PER_SECOND_LIMIT_TRACKING, 1000, ReplenishPolicy.ROLLING);
    private RateLimitSettings apiLimit = new RateLimitSettings(REQUEST_PER_SECOND_LIMIT_API, 1000, ReplenishPolicy.ROLLING);
}
