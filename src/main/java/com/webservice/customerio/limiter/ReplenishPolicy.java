package com.webservice.customerio.limiter;

public enum ReplenishPolicy {
    /**
     * Every grant returns its slot to the bucket one interval after it was granted.
     */
    ROLLING,
    /**
     * The whole bucket refills one interval after the first grant of the current window.
     */
    FIXED_WINDOW
}
