package com.webservice.customerio.error;

import io.vertx.core.http.HttpMethod;

import javax.annotation.Nullable;

/**
 * What was asked for, kept with every classified error so the caller can diagnose or retry.
 *
 * @param path - the path relative to the endpoint class base url
 * @param body - the logical request body before encoding, null if none
 */
public record RequestContext(HttpMethod method, String path, @Nullable Object body) {
}
