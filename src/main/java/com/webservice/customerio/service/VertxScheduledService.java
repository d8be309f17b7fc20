package com.webservice.customerio.service;

import io.vertx.core.Context;
import io.vertx.core.Vertx;

public class VertxScheduledService implements ScheduledService {

    private final Vertx vertx;

    private final Context context;

    public VertxScheduledService(Vertx vertx) {
        this(vertx, vertx.getOrCreateContext());
    }

    public VertxScheduledService(Vertx vertx, Context context) {
        this.vertx = vertx;
        this.context = context;
    }

    @Override
    public void execute(Runnable task) {
        if (Vertx.currentContext() == context) {
            task.run();
        } else {
            context.runOnContext(ignore -> task.run());
        }
    }

    @Override
    public void schedule(long delay, Runnable task) {
        // timers created on the context fire on the same context, vertx rejects delays below 1 ms
        execute(() -> vertx.setTimer(Math.max(1, delay), timerId -> task.run()));
    }
}
