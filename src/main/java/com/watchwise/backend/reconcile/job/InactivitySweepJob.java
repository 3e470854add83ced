package com.watchwise.backend.reconcile.job;

import com.watchwise.backend.notification.entity.NotificationType;
import com.watchwise.backend.notification.service.NotificationDispatcher;
import com.watchwise.backend.notification.service.NotificationEvent;
import com.watchwise.backend.reconcile.config.ReconcileProperties;
import com.watchwise.backend.relationship.entity.Relationship;
import com.watchwise.backend.relationship.repo.RelationshipRepo;
import com.watchwise.backend.users.user.entity.User;
import com.watchwise.backend.users.user.repo.UserRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tells every linked parent about a child device that has not been used for a while.
 * Repeats on every run while the condition holds; within one run a parent hears about
 * a given child once.
 */
@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "app.reconcile", name = "enabled", havingValue = "true", matchIfMissing = true)
public class InactivitySweepJob {

    private final ReconcileProperties props;
    private final UserRepo users;
    private final RelationshipRepo relationships;
    private final NotificationDispatcher notifications;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.reconcile.inactivity-sweep-ms:21600000}",
               initialDelayString = "${app.reconcile.inactivity-sweep-ms:21600000}")
    public int runOnce() {
        final Instant now = Instant.now(clock);
        final Instant cutoff = now.minus(props.getInactivityThreshold());
        final int batch = Math.max(1, props.getBatchSize());

        Set<String> notified = new HashSet<>();
        int page = 0;
        int failed = 0;
        while (true) {
            List<User> children = users.findInactiveChildren(cutoff, PageRequest.of(page++, batch));
            if (children.isEmpty()) break;

            for (User child : children) {
                try {
                    notifyParents(child, now, notified);
                } catch (Exception e) {
                    failed++;
                    log.warn("inactivity alert failed. childId={}", child.getId(), e);
                }
            }
            if (children.size() < batch) break;
        }

        if (!notified.isEmpty() || failed > 0) {
            log.info("inactivity sweep done. notified={} failed={}", notified.size(), failed);
        }
        return notified.size();
    }

    private void notifyParents(User child, Instant now, Set<String> notified) {
        for (Relationship r : relationships.findByChildUserIdAndActiveTrueOrderByCreatedAtAsc(child.getId())) {
            if (!notified.add(r.getParentUserId() + ":" + child.getId())) continue;

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("parentUserId", r.getParentUserId());
            data.put("childUserId", child.getId());
            data.put("childName", r.getChildName());
            data.put("lastActiveAt", child.getLastActiveAt() == null ? null : child.getLastActiveAt().toString());

            notifications.dispatch(new NotificationEvent(
                    r.getParentUserId(),
                    NotificationType.INACTIVITY_ALERT,
                    "Child Device Inactive",
                    r.getChildName() + " hasn't opened WatchWise in " + props.getInactivityThreshold().toDays()
                            + " days. Please check on their device.",
                    data,
                    now
            ));
        }
    }
}
