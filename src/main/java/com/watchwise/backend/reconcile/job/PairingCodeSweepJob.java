package com.watchwise.backend.reconcile.job;

import com.watchwise.backend.pairing.repo.PairingCodeRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Flags codes whose deadline passed but whose deferred expiry never ran (restart, failure).
 * Re-running is a no-op for codes already flagged.
 */
@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "app.reconcile", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PairingCodeSweepJob {

    private final PairingCodeRepo codes;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.reconcile.code-sweep-ms:600000}",
               initialDelayString = "${app.reconcile.code-sweep-ms:600000}")
    @Transactional
    public int runOnce() {
        int n = codes.expireOverdue(Instant.now(clock));
        if (n > 0) {
            log.info("code sweep done. expired={}", n);
        }
        return n;
    }
}
