package com.webservice.customerio.error;

public enum ErrorKind {
    RESOURCE_NOT_FOUND,
    INVALID_REQUEST,
    INVALID_API_KEY,
    INTERNAL_SERVER_ERR,
    UNEXPECTED_HTTP_CODE,
    UNEXPECTED_RESPONSE_FORMAT
}
