package com.watchwise.backend.reconcile.job;

import com.watchwise.backend.heartbeat.config.HeartbeatProperties;
import com.watchwise.backend.notification.entity.NotificationType;
import com.watchwise.backend.notification.service.NotificationDispatcher;
import com.watchwise.backend.notification.service.NotificationEvent;
import com.watchwise.backend.reconcile.config.ReconcileProperties;
import com.watchwise.backend.reconcile.model.MissedHeartbeatLevel;
import com.watchwise.backend.relationship.entity.Relationship;
import com.watchwise.backend.relationship.repo.RelationshipRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Escalates silent child devices one level per missed heartbeat interval.
 * <p>
 * A level is announced at most once: the stored counter is raised with a conditional
 * update in the same transaction as the notification, and only when the counter is
 * lower and the heartbeat the sweep looked at is still the latest one.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.reconcile", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MissedHeartbeatSweepJob {

    private final RelationshipRepo relationships;
    private final NotificationDispatcher notifications;
    private final HeartbeatProperties heartbeatProps;
    private final ReconcileProperties props;
    private final TransactionTemplate tx;
    private final Clock clock;

    public MissedHeartbeatSweepJob(RelationshipRepo relationships,
                                   NotificationDispatcher notifications,
                                   HeartbeatProperties heartbeatProps,
                                   ReconcileProperties props,
                                   TransactionTemplate tx,
                                   Clock clock) {
        this.relationships = relationships;
        this.notifications = notifications;
        this.heartbeatProps = heartbeatProps;
        this.props = props;
        this.tx = tx;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.reconcile.missed-heartbeat-sweep-ms:1200000}",
               initialDelayString = "${app.reconcile.missed-heartbeat-sweep-ms:1200000}")
    public int runOnce() {
        final Instant now = Instant.now(clock);
        final Instant cutoff = now.minus(heartbeatProps.getGracePeriod());
        final int batch = Math.max(1, props.getBatchSize());

        int silent = 0;
        int notified = 0;
        Long afterId = 0L;
        while (true) {
            List<Relationship> page = relationships.findSilentSince(cutoff, afterId, PageRequest.of(0, batch));
            if (page.isEmpty()) break;
            silent += page.size();

            for (Relationship r : page) {
                try {
                    if (Boolean.TRUE.equals(tx.execute(s -> escalate(r, now)))) notified++;
                } catch (Exception e) {
                    log.warn("missed heartbeat escalation failed. relationshipId={}", r.getId(), e);
                }
            }
            if (page.size() < batch) break;
            afterId = page.get(page.size() - 1).getId();
        }

        if (notified > 0) {
            log.info("missed heartbeat sweep done. silent={} notified={}", silent, notified);
        }
        return notified;
    }

    static int missedIntervals(Instant lastHeartbeatAt, Instant now, Duration interval) {
        long elapsed = Duration.between(lastHeartbeatAt, now).toMillis();
        if (elapsed <= 0) return 0;
        return (int) Math.min(Integer.MAX_VALUE, elapsed / interval.toMillis());
    }

    private boolean escalate(Relationship r, Instant now) {
        int missed = missedIntervals(r.getLastHeartbeatAt(), now, heartbeatProps.getMissInterval());
        if (missed <= r.getMissedHeartbeats()) return false;

        // 0 rows: a heartbeat, shutdown or another sweep got there first
        if (relationships.escalate(r.getId(), missed, r.getLastHeartbeatAt()) != 1) return false;

        MissedHeartbeatLevel level = MissedHeartbeatLevel.of(missed);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("relationshipId", r.getId());
        data.put("parentUserId", r.getParentUserId());
        data.put("childUserId", r.getChildUserId());
        data.put("childName", r.getChildName());
        data.put("missedHeartbeats", missed);
        data.put("level", level.name());

        notifications.dispatch(new NotificationEvent(
                r.getParentUserId(),
                NotificationType.MISSED_HEARTBEAT,
                level.title(),
                level.message(r.getChildName(), missed),
                data,
                now
        ));
        return true;
    }
}
