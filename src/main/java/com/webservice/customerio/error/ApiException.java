package com.webservice.customerio.error;

import lombok.Getter;

@Getter
public class ApiException extends RuntimeException {
    private final ApiError error;

    public ApiException(ApiError error) {
        super(error.message() + ". Method: " + error.getContext().method() + ". Path: " + error.getContext().path());
        this.error = error;
    }

    public ErrorKind getKind() {
        return error.getKind();
    }
}
