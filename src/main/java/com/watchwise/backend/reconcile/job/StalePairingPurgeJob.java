package com.watchwise.backend.reconcile.job;

import com.watchwise.backend.pairing.config.PairingProperties;
import com.watchwise.backend.pairing.repo.PairingCodeRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/** Storage hygiene: old codes go away whatever their state. */
@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "app.reconcile", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StalePairingPurgeJob {

    private final PairingCodeRepo codes;
    private final PairingProperties pairingProps;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.reconcile.stale-purge-ms:3600000}",
               initialDelayString = "${app.reconcile.stale-purge-ms:3600000}")
    @Transactional
    public int runOnce() {
        Instant cutoff = Instant.now(clock).minus(pairingProps.getStaleAfter());
        int n = codes.deleteCreatedBefore(cutoff);
        if (n > 0) {
            log.info("stale pairing purge done. deleted={} cutoff={}", n, cutoff);
        }
        return n;
    }
}
