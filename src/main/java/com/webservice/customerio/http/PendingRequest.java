package com.webservice.customerio.http;

import com.webservice.customerio.error.Outcome;
import com.webservice.customerio.limiter.RateLimiter;
import io.vertx.core.Future;

/**
 * Handle of a dispatched request.
 *
 * @param admission completes when the rate limiter lets the request through
 * @param result the classified outcome, fails with {@link java.util.concurrent.CancellationException} once cancelled
 */
public record PendingRequest(Future<Void> admission, Future<Outcome> result, RateLimiter limiter) {

    /**
     * Abandons the request if it still waits for admission: it leaves the queue without consuming a slot
     * and is never sent. Has no effect once the request is admitted.
     */
    public void cancel() {
        limiter.cancel(admission);
    }
}
