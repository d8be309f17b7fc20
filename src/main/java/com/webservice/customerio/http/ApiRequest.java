package com.webservice.customerio.http;

import com.webservice.customerio.error.RequestContext;
import io.vertx.core.http.HttpMethod;

import java.util.Objects;
import java.util.Set;
import javax.annotation.Nullable;

public record ApiRequest(EndpointClass endpointClass, HttpMethod method, String path, @Nullable Object body) {

    private static final Set<HttpMethod> SUPPORTED_METHODS = Set.of(HttpMethod.GET, HttpMethod.POST, HttpMethod.PUT, HttpMethod.DELETE);

    public ApiRequest {
        Objects.requireNonNull(endpointClass, "endpointClass");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        if (!SUPPORTED_METHODS.contains(method)) {
            throw new IllegalArgumentException("Unsupported method: " + method);
        }
    }

    /**
     * Whether the method sends a body even when there is no logical one.
     */
    public boolean requiresBody() {
        return HttpMethod.POST.equals(method) || HttpMethod.PUT.equals(method);
    }

    public RequestContext context() {
        return new RequestContext(method, path, body);
    }
}
