package com.watchwise.backend.pairing.service;

import com.watchwise.backend.pairing.repo.PairingCodeRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * One deferred task per issued code that flips it to expired at its deadline.
 * The code sweep covers whatever a restart drops from here.
 */
@Slf4j
@Component
public class PairingCodeExpiryScheduler {

    private final TaskScheduler scheduler;
    private final PairingCodeRepo codes;
    private final TransactionTemplate tx;
    private final Clock clock;

    private final Map<Long, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public PairingCodeExpiryScheduler(TaskScheduler scheduler,
                                      PairingCodeRepo codes,
                                      TransactionTemplate tx,
                                      Clock clock) {
        this.scheduler = scheduler;
        this.codes = codes;
        this.tx = tx;
        this.clock = clock;
    }

    public void schedule(Long codeId, Instant deadline) {
        // the deadline is on the application clock, the scheduler runs on its own
        Duration delay = Duration.between(Instant.now(clock), deadline);
        if (delay.isNegative()) delay = Duration.ZERO;

        ScheduledFuture<?> future = scheduler.schedule(
                () -> expire(codeId),
                scheduler.getClock().instant().plus(delay)
        );
        ScheduledFuture<?> previous = pending.put(codeId, future);
        if (previous != null) previous.cancel(false);
    }

    /** Stops a future run; never interrupts one already executing. */
    public boolean cancel(Long codeId) {
        ScheduledFuture<?> f = pending.remove(codeId);
        return f != null && f.cancel(false);
    }

    public int pendingCount() {
        return pending.size();
    }

    void expire(Long codeId) {
        try {
            Integer n = tx.execute(s -> codes.markExpired(codeId, Instant.now(clock)));
            if (n != null && n > 0) {
                log.info("pairing code expired. codeId={}", codeId);
            }
        } catch (Exception e) {
            log.warn("pairing code expiry failed, sweep will retry. codeId={}", codeId, e);
        } finally {
            pending.remove(codeId);
        }
    }
}
