package com.webservice.customerio.http;

import com.webservice.customerio.limiter.RateLimiter;

public record EndpointRoute(String baseUrl, RateLimiter limiter) {
}
