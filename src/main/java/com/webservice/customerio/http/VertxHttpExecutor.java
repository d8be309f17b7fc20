package com.webservice.customerio.http;

import io.vertx.core.Future;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.RequestOptions;
import lombok.RequiredArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

@RequiredArgsConstructor
public class VertxHttpExecutor implements HttpExecutor {

    public static final String HEADER_CONTENT_TYPE_APPLICATION_JSON = "application/json";

    private final HttpClient client;
    private final String userAgent;

    @Override
    public Future<HttpResult> execute(HttpCall call) {
        RequestOptions options = new RequestOptions()
                .setAbsoluteURI(call.uri())
                .setMethod(call.method())
                .putHeader(HttpHeaders.AUTHORIZATION, basicAuth(call.user(), call.password()))
                .putHeader(HttpHeaders.ACCEPT, HEADER_CONTENT_TYPE_APPLICATION_JSON)
                .putHeader(HttpHeaders.USER_AGENT, userAgent);

        return client.request(options).compose(request -> send(request, call));
    }

    private static Future<HttpResult> send(HttpClientRequest request, HttpCall call) {
        Future<HttpClientResponse> response;
        if (call.hasBody()) {
            request.putHeader(HttpHeaders.CONTENT_TYPE, HEADER_CONTENT_TYPE_APPLICATION_JSON);
            request.putHeader(HttpHeaders.CONTENT_LENGTH, Integer.toString(call.body().length()));
            response = request.send(call.body());
        } else {
            response = request.send();
        }

        return response.compose(result -> result.body()
                .map(body -> new HttpResult(result.statusCode(), result.statusMessage(), body)));
    }

    private static String basicAuth(String user, String password) {
        String credentials = user + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }
}
