package com.webservice.customerio.error;

import com.fasterxml.jackson.databind.JsonNode;
import io.vertx.core.Future;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Result of one dispatched request: either the decoded response payload or a classified error.
 */
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Outcome {

    @Nullable
    private final JsonNode payload;
    @Nullable
    private final ApiError error;

    public static Outcome success(JsonNode payload) {
        return new Outcome(Objects.requireNonNull(payload, "payload"), null);
    }

    public static Outcome failure(ApiError error) {
        return new Outcome(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws IllegalStateException if the outcome is an error
     */
    public JsonNode payload() {
        if (error != null) {
            throw new IllegalStateException("Outcome is an error: " + error.message());
        }
        return payload;
    }

    /**
     * @throws IllegalStateException if the outcome is a success
     */
    public ApiError error() {
        if (error == null) {
            throw new IllegalStateException("Outcome is a success");
        }
        return error;
    }

    /**
     * Turns the outcome into a future: the payload, or a failure carrying {@link ApiException}.
     */
    public Future<JsonNode> toFuture() {
        return (error == null) ? Future.succeededFuture(payload) : Future.failedFuture(new ApiException(error));
    }
}
