package com.webservice.customerio.http;

/**
 * Group of routes sharing one base url and one rate limit budget.
 */
public enum EndpointClass {
    /**
     * Behavioral tracking API, used to identify and track customer data.
     */
    TRACKING,
    /**
     * Regular API, used for API triggered broadcasts.
     */
    API
}
