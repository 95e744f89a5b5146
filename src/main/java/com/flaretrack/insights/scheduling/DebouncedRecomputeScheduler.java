package com.flaretrack.insights.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class DebouncedRecomputeScheduler {
    private static final Logger log = LoggerFactory.getLogger(DebouncedRecomputeScheduler.class);

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration quietPeriod;
    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public DebouncedRecomputeScheduler(@Qualifier("insightsRecomputeScheduler") TaskScheduler scheduler,
                                       Clock clock,
                                       @Value("${insights.recompute.quiet-period-ms:500}") long quietPeriodMs) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.quietPeriod = Duration.ofMillis(quietPeriodMs);
    }

    public void trigger(String key, Runnable task) {
        pending.compute(key, (k, previous) -> {
            if (previous != null) {
                previous.cancel(false);
            }
            AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
            ScheduledFuture<?> future = scheduler.schedule(() -> run(k, task, self), clock.instant().plus(quietPeriod));
            self.set(future);
            return future;
        });
    }

    public boolean isPending(String key) {
        ScheduledFuture<?> future = pending.get(key);
        return future != null && !future.isDone();
    }

    public int trackedKeys() {
        return pending.size();
    }

    public void cancel(String key) {
        ScheduledFuture<?> future = pending.remove(key);
        if (future != null) {
            future.cancel(false);
        }
    }

    private void run(String key, Runnable task, AtomicReference<ScheduledFuture<?>> self) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Debounced recompute for {} failed", key, e);
        } finally {
            // a newer trigger may already have replaced this entry
            ScheduledFuture<?> future = self.get();
            if (future != null) {
                pending.remove(key, future);
            }
        }
    }
}
