package com.watchwise.backend.restriction.job;

import com.watchwise.backend.restriction.entity.BedtimeSettings;
import com.watchwise.backend.restriction.repo.BedtimeSettingsRepo;
import com.watchwise.backend.restriction.service.BedtimeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "app.reconcile", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BedtimeEnforcementJob {

    private final BedtimeSettingsRepo repo;
    private final BedtimeService bedtime;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.reconcile.bedtime-check-ms:60000}",
               initialDelayString = "${app.reconcile.bedtime-check-ms:60000}")
    public int runOnce() {
        final Instant now = Instant.now(clock);
        List<BedtimeSettings> schedules = repo.findEvaluable();

        int pushed = 0;
        for (BedtimeSettings s : schedules) {
            try {
                if (bedtime.evaluate(s.getId(), now)) pushed++;
            } catch (Exception e) {
                log.warn("bedtime check failed. settingsId={} parentId={}", s.getId(), s.getUserId(), e);
            }
        }
        log.debug("bedtime check done. schedules={} pushed={}", schedules.size(), pushed);
        return pushed;
    }
}
