package com.signals.arena.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class SingleThreadArenaEventLoop implements ArenaEventLoop, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(SingleThreadArenaEventLoop.class);

    static final String THREAD_NAME_PREFIX = "arena-core-";

    private final ThreadPoolTaskScheduler scheduler;
    private final Clock clock;
    private final Duration queryTimeout;
    private volatile Thread loopThread;

    public SingleThreadArenaEventLoop(Clock clock, Duration queryTimeout) {
        this.clock = clock;
        this.queryTimeout = queryTimeout;
        this.scheduler = new ThreadPoolTaskScheduler();
        this.scheduler.setPoolSize(1);
        this.scheduler.setThreadNamePrefix(THREAD_NAME_PREFIX);
        this.scheduler.setRemoveOnCancelPolicy(true);
        this.scheduler.setErrorHandler(ex -> log.error("Unhandled failure on arena core thread", ex));
        this.scheduler.initialize();
        this.scheduler.execute(() -> loopThread = Thread.currentThread());
    }

    @Override
    public void execute(Runnable task) {
        scheduler.execute(guarded(task));
    }

    @Override
    public ArenaTimer schedule(Duration delay, Runnable task) {
        ScheduledFuture<?> future = scheduler.schedule(guarded(task), clock.instant().plus(delay));
        return new FutureTimer(future);
    }

    @Override
    public <T> T call(Callable<T> query) {
        if (Thread.currentThread() == loopThread) {
            try {
                return query.call();
            } catch (RuntimeException ex) {
                throw ex;
            } catch (Exception ex) {
                throw new IllegalStateException("Arena query failed", ex);
            }
        }

        Future<T> future = scheduler.submit(query);
        try {
            return future.get(queryTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for arena query", ex);
        } catch (TimeoutException ex) {
            future.cancel(false);
            throw new IllegalStateException("Arena core did not answer within " + queryTimeout, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Arena query failed", cause);
        }
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public void destroy() {
        scheduler.shutdown();
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException ex) {
                log.error("Arena core task failed; continuing with next task", ex);
            }
        };
    }

    private record FutureTimer(ScheduledFuture<?> future) implements ArenaTimer {

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
