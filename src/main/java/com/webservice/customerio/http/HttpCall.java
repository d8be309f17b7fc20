package com.webservice.customerio.http;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpMethod;

import javax.annotation.Nullable;

/**
 * Fully built outgoing request handed to the {@link HttpExecutor}.
 *
 * @param body - encoded body; null means the request carries no body at all,
 *               an empty buffer means an empty body that is still sent
 */
public record HttpCall(HttpMethod method, String uri, String user, String password, @Nullable Buffer body) {

    public boolean hasBody() {
        return body != null;
    }
}
