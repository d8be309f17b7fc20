package com.webservice.customerio.limiter;

import com.webservice.customerio.service.ScheduledService;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Token bucket admission gate. At most {@code capacity} admissions are granted per {@code interval},
 * callers that find the bucket empty wait in arrival order.
 * <p>
 * Not thread-safe by itself: {@code available} and {@code waiters} are only touched from tasks run by
 * the {@link ScheduledService}, which never runs two tasks at once.
 */
@Slf4j
public class RateLimiter {

    private final String name;
    private final int capacity;
    private final long interval;
    private final ReplenishPolicy policy;
    private final ScheduledService scheduler;

    private final ArrayDeque<Promise<Void>> waiters = new ArrayDeque<>();
    private int available;
    private boolean windowOpen;

    public RateLimiter(String name, int capacity, long interval, ScheduledService scheduler) {
        this(name, capacity, interval, ReplenishPolicy.ROLLING, scheduler);
    }

    public RateLimiter(String name, int capacity, long interval, ReplenishPolicy policy, ScheduledService scheduler) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Rate limiter capacity must be positive: " + capacity);
        }
        if (interval <= 0) {
            throw new IllegalArgumentException("Rate limiter interval must be positive: " + interval);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
        this.interval = interval;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.available = capacity;
    }

    /**
     * Consumes one slot. The returned future completes once the slot is granted,
     * right away if the bucket is not empty and nobody is waiting ahead.
     */
    public Future<Void> acquire() {
        Promise<Void> promise = Promise.promise();
        scheduler.execute(() -> {
            if (available > 0 && waiters.isEmpty()) {
                grant(promise);
            } else {
                waiters.addLast(promise);
                log.debug("Admission queued. Limiter: {}. Waiting: {}", name, waiters.size());
            }
        });
        return promise.future();
    }

    /**
     * Withdraws an admission that is still waiting: it leaves the queue without consuming a slot and its
     * future fails with {@link CancellationException}. An admission that was already granted is not refunded.
     */
    public void cancel(Future<Void> admission) {
        scheduler.execute(() -> {
            Iterator<Promise<Void>> iterator = waiters.iterator();
            while (iterator.hasNext()) {
                Promise<Void> waiter = iterator.next();
                if (waiter.future() == admission) {
                    iterator.remove();
                    waiter.tryFail(new CancellationException("Admission cancelled. Limiter: " + name));
                    log.debug("Admission cancelled. Limiter: {}. Waiting: {}", name, waiters.size());
                    return;
                }
            }
        });
    }

    public String name() {
        return name;
    }

    public int capacity() {
        return capacity;
    }

    public long interval() {
        return interval;
    }

    public ReplenishPolicy policy() {
        return policy;
    }

    /**
     * @return the number of free slots, meaningful only when read from the scheduler.
     */
    public int available() {
        return available;
    }

    /**
     * @return the number of queued admissions, meaningful only when read from the scheduler.
     */
    public int waiting() {
        return waiters.size();
    }

    private void grant(Promise<Void> promise) {
        available--;
        if (policy == ReplenishPolicy.ROLLING) {
            scheduler.schedule(interval, this::replenish);
        } else if (!windowOpen) {
            windowOpen = true;
            scheduler.schedule(interval, this::refill);
        }
        promise.complete();
    }

    private void replenish() {
        available = Math.min(capacity, available + 1);
        drain();
    }

    private void refill() {
        windowOpen = false;
        available = capacity;
        drain();
    }

    private void drain() {
        while (available > 0 && !waiters.isEmpty()) {
            grant(waiters.pollFirst());
        }
    }

    @Override
    public String toString() {
        return String.format("%s(capacity: %d, interval: %d ms, policy: %s)", name, capacity, interval, policy);
    }
}
