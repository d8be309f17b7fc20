package com.webservice.customerio.http;

import com.webservice.customerio.error.ErrorClassifier;
import com.webservice.customerio.error.Outcome;
import com.webservice.customerio.error.RequestContext;
import com.webservice.customerio.limiter.RateLimiter;
import com.webservice.customerio.util.JsonUtil;
import com.webservice.customerio.util.UrlUtil;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpMethod;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Sends every request through the rate limiter of its endpoint class, then the transport, then the classifier.
 * A request is never retried here: each call to {@link #dispatch(ApiRequest)} leads to exactly one admission
 * and at most one HTTP exchange.
 */
@Slf4j
public class RequestDispatcher {

    private final HttpExecutor executor;
    private final ErrorClassifier classifier;
    private final String user;
    private final String password;
    private final Map<EndpointClass, EndpointRoute> routes;

    public RequestDispatcher(HttpExecutor executor, ErrorClassifier classifier, String user, String password,
                             Map<EndpointClass, EndpointRoute> routes) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.user = Objects.requireNonNull(user, "user");
        this.password = Objects.requireNonNull(password, "password");
        this.routes = new EnumMap<>(routes);

        for (EndpointClass endpointClass : EndpointClass.values()) {
            if (!this.routes.containsKey(endpointClass)) {
                throw new IllegalArgumentException("No route for endpoint class: " + endpointClass);
            }
        }
    }

    public Future<Outcome> dispatch(EndpointClass endpointClass, HttpMethod method, String path, @Nullable Object body) {
        return dispatch(new ApiRequest(endpointClass, method, path, body));
    }

    public Future<Outcome> dispatch(ApiRequest request) {
        return submit(request).result();
    }

    /**
     * Same as {@link #dispatch(ApiRequest)} but returns a handle that can withdraw the request while it waits.
     */
    public PendingRequest submit(ApiRequest request) {
        EndpointRoute route = routes.get(request.endpointClass());
        RateLimiter limiter = route.limiter();
        String uri = UrlUtil.join(route.baseUrl(), request.path());
        RequestContext context = request.context();
        Buffer body;
        try {
            body = encode(request);
        } catch (IllegalArgumentException e) {
            // unencodable body fails before admission
            Future<Void> rejected = Future.failedFuture(e);
            return new PendingRequest(rejected, Future.failedFuture(e), limiter);
        }

        log.debug("Request {}. Limiter: {}. Method: {}. Uri: {}", RequestState.PENDING, limiter.name(), request.method(), uri);

        Future<Void> admission = limiter.acquire();
        Future<Outcome> result = admission.compose(ignore -> {
            log.debug("Request {}. Limiter: {}. Method: {}. Uri: {}", RequestState.ADMITTED, limiter.name(), request.method(), uri);
            HttpCall call = new HttpCall(request.method(), uri, user, password, body);
            return send(call);
        }).transform(response -> {
            if (admission.failed()) {
                log.debug("Request {}. Limiter: {}. Method: {}. Uri: {}", RequestState.CANCELLED, limiter.name(), request.method(), uri);
            } else if (response.failed()) {
                log.warn("Request {}. Method: {}. Uri: {}. Transport error:", RequestState.FAILED, request.method(), uri, response.cause());
            }
            return classifier.classify(context, response);
        }).onSuccess(outcome -> {
            if (outcome.isSuccess()) {
                log.debug("Request {}. Method: {}. Uri: {}", RequestState.SUCCEEDED, request.method(), uri);
            } else {
                log.warn("Request {}. Method: {}. Uri: {}. Status: {}. Error: {}", RequestState.FAILED,
                        request.method(), uri, outcome.error().getStatusCode(), outcome.error().message());
            }
        });

        return new PendingRequest(admission, result, limiter);
    }

    private Future<HttpResult> send(HttpCall call) {
        Future<HttpResult> response;
        try {
            response = executor.execute(call);
        } catch (Throwable e) {
            return Future.failedFuture(e);
        }
        log.debug("Request {}. Method: {}. Uri: {}. Body: {}", RequestState.SENT, call.method(), call.uri(),
                call.hasBody() ? call.body().length() : "none");
        return response;
    }

    @Nullable
    private static Buffer encode(ApiRequest request) {
        if (request.body() != null) {
            return JsonUtil.encode(request.body());
        }
        return request.requiresBody() ? Buffer.buffer() : null;
    }
}
