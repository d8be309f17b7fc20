package com.webservice.customerio.config;

import com.webservice.customerio.limiter.ReplenishPolicy;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class RateLimitSettings {
    /**
     * Admissions per interval.
     */
    private int limit;
    /**
     * Interval in milliseconds.
     */
    private long interval = 1000;
    private ReplenishPolicy policy = ReplenishPolicy.ROLLING;

    public boolean isPositive() {
        return limit > 0 && interval > 0;
    }
}
