package com.webservice.customerio.error;

import lombok.AllArgsConstructor;
import lombok.Value;

import javax.annotation.Nullable;

@Value
@AllArgsConstructor
public class ApiError {

    public static final String SOURCE = "customerio";

    ErrorKind kind;
    String source;
    RequestContext context;
    /**
     * HTTP status code, always present as the error is derived from an HTTP response.
     */
    int statusCode;
    @Nullable
    String statusMessage;
    /**
     * Raw response body as received.
     */
    @Nullable
    String responseBody;
    /**
     * Decode failure detail, only for {@link ErrorKind#UNEXPECTED_RESPONSE_FORMAT}.
     */
    @Nullable
    String detail;

    public ApiError(ErrorKind kind, RequestContext context, int statusCode, @Nullable String statusMessage,
                    @Nullable String responseBody, @Nullable String detail) {
        this(kind, SOURCE, context, statusCode, statusMessage, responseBody, detail);
    }

    public String message() {
        return switch (kind) {
            case UNEXPECTED_HTTP_CODE -> "%s: %d %s".formatted(kind, statusCode, statusMessage);
            case UNEXPECTED_RESPONSE_FORMAT -> "%s: %s".formatted(kind, detail);
            default -> kind.name();
        };
    }
}
