package com.webservice.customerio.http;

import io.vertx.core.buffer.Buffer;

import javax.annotation.Nullable;

/**
 * Raw HTTP response as received from the transport, whatever its status code.
 */
public record HttpResult(int statusCode, @Nullable String statusMessage, Buffer body) {
}
