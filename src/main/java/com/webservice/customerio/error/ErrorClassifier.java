package com.webservice.customerio.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.webservice.customerio.http.HttpResult;
import com.webservice.customerio.util.HttpStatus;
import com.webservice.customerio.util.JsonUtil;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;

import java.nio.charset.StandardCharsets;
import javax.annotation.Nullable;

/**
 * Maps a transport outcome to an {@link Outcome}. Stateless, the same input always gives an equal result.
 */
public class ErrorClassifier {

    /**
     * A failed transport result is returned as is: it never became an HTTP response, so it is not classified.
     */
    public Future<Outcome> classify(RequestContext context, AsyncResult<HttpResult> result) {
        if (result.failed()) {
            return Future.failedFuture(result.cause());
        }
        return Future.succeededFuture(classify(context, result.result()));
    }

    public Outcome classify(RequestContext context, HttpResult response) {
        int code = response.statusCode();
        if (!HttpStatus.isSuccess(code)) {
            return Outcome.failure(new ApiError(kind(code), context, code, response.statusMessage(), text(response), null));
        }

        try {
            JsonNode payload = JsonUtil.decode(response.body());
            return Outcome.success(payload);
        } catch (JsonProcessingException e) {
            return Outcome.failure(new ApiError(ErrorKind.UNEXPECTED_RESPONSE_FORMAT, context, code,
                    response.statusMessage(), text(response), e.getOriginalMessage()));
        }
    }

    static ErrorKind kind(int code) {
        HttpStatus status = HttpStatus.fromCode(code);
        if (status == null) {
            return ErrorKind.UNEXPECTED_HTTP_CODE;
        }
        return switch (status) {
            case NOT_FOUND -> ErrorKind.RESOURCE_NOT_FOUND;
            case BAD_REQUEST -> ErrorKind.INVALID_REQUEST;
            case UNAUTHORIZED -> ErrorKind.INVALID_API_KEY;
            case INTERNAL_SERVER_ERROR, BAD_GATEWAY, SERVICE_UNAVAILABLE, GATEWAY_TIMEOUT -> ErrorKind.INTERNAL_SERVER_ERR;
            default -> ErrorKind.UNEXPECTED_HTTP_CODE;
        };
    }

    @Nullable
    private static String text(HttpResult response) {
        return (response.body() == null) ? null : response.body().toString(StandardCharsets.UTF_8);
    }
}
