package com.webservice.customerio.http;

public enum RequestState {
    PENDING, ADMITTED, SENT, SUCCEEDED, FAILED, CANCELLED
}
