package com.webservice.customerio.http;

import io.vertx.core.Future;

/**
 * Transport capability. The returned future fails only if no HTTP response was received
 * (connection refused, timeout, DNS failure), any response including non-2xx ones succeeds.
 */
public interface HttpExecutor {

    Future<HttpResult> execute(HttpCall call);

}
