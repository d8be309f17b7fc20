package com.webservice.customerio.service;

/**
 * A single-threaded scheduler: tasks submitted through {@link #execute(Runnable)} and
 * {@link #schedule(long, Runnable)} never run concurrently with each other, so state touched only
 * from these tasks needs no locking.
 */
public interface ScheduledService {

    /**
     * Runs the task on the scheduler. If the caller is already on the scheduler, the task runs inline.
     *
     * @param task - the task to execute
     */
    void execute(Runnable task);

    /**
     * Runs the task on the scheduler once the given delay has elapsed.
     * Tasks that become due at the same instant run in the order they were scheduled.
     *
     * @param delay - the delay in milliseconds
     * @param task - the task to execute
     */
    void schedule(long delay, Runnable task);

}
