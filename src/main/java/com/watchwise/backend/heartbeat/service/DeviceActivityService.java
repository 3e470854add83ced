package com.watchwise.backend.heartbeat.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.watchwise.backend.heartbeat.dto.RecordActivityResponse;
import com.watchwise.backend.heartbeat.entity.HeartbeatRecord;
import com.watchwise.backend.heartbeat.model.ActivityType;
import com.watchwise.backend.heartbeat.repo.HeartbeatRecordRepo;
import com.watchwise.backend.relationship.entity.Relationship;
import com.watchwise.backend.relationship.repo.RelationshipRepo;
import com.watchwise.backend.users.user.entity.User;
import com.watchwise.backend.users.user.repo.UserRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Sole writer of liveness fields.
 * <p>
 * Signals can arrive out of order after network retries, so every field is compare-and-set
 * on the signal time: an older signal never moves a stored timestamp backwards. The child's
 * user row is locked first, which serializes concurrent signals of one device.
 * <p>
 * Liveness is best effort. A failed write is logged and reported as {@code success=false};
 * the next heartbeat supersedes it.
 */
@Slf4j
@Service
public class DeviceActivityService {

    private final UserRepo users;
    private final HeartbeatRecordRepo heartbeats;
    private final RelationshipRepo relationships;
    private final TransactionTemplate tx;
    private final Clock clock;

    public DeviceActivityService(UserRepo users,
                                 HeartbeatRecordRepo heartbeats,
                                 RelationshipRepo relationships,
                                 TransactionTemplate tx,
                                 Clock clock) {
        this.users = users;
        this.heartbeats = heartbeats;
        this.relationships = relationships;
        this.tx = tx;
        this.clock = clock;
    }

    public RecordActivityResponse recordActivity(Long childUserId,
                                                 ActivityType type,
                                                 JsonNode deviceInfo,
                                                 Instant occurredAt) {
        final Instant now = Instant.now(clock);
        final Instant ts = (occurredAt == null || occurredAt.isAfter(now)) ? now : occurredAt;

        try {
            Integer touched = tx.execute(s -> apply(childUserId, type, deviceInfo, ts));
            int n = touched == null ? 0 : touched;
            log.debug("activity recorded. userId={} type={} at={} relationships={}", childUserId, type.wire(), ts, n);
            return new RecordActivityResponse(true, n);
        } catch (RuntimeException e) {
            log.warn("activity not recorded, next signal supersedes it. userId={} type={}", childUserId, type.wire(), e);
            return RecordActivityResponse.failed();
        }
    }

    private int apply(Long childUserId, ActivityType type, JsonNode deviceInfo, Instant ts) {
        touchUser(childUserId, type, deviceInfo, ts);
        upsertHeartbeat(childUserId, type, deviceInfo, ts);

        List<Relationship> links = relationships.findActiveByChildForUpdate(childUserId);
        int touched = 0;
        for (Relationship r : links) {
            if (applyToRelationship(r, type, deviceInfo, ts)) {
                relationships.save(r);
                touched++;
            }
        }
        return touched;
    }

    private void touchUser(Long userId, ActivityType type, JsonNode deviceInfo, Instant ts) {
        User u = users.findByIdForUpdate(userId);
        if (u == null || !isNewer(ts, u.getLastActiveAt())) return;

        u.setLastActiveAt(ts);
        u.setLastActivityType(type.wire());
        if (deviceInfo != null) u.setDeviceInfo(deviceInfo);
        if (type == ActivityType.APP_SHUTDOWN) u.setLastGracefulShutdownAt(ts);
        users.save(u);
    }

    private void upsertHeartbeat(Long childUserId, ActivityType type, JsonNode deviceInfo, Instant ts) {
        HeartbeatRecord hb = heartbeats.findByChildUserId(childUserId).orElse(null);
        if (hb == null) {
            hb = new HeartbeatRecord();
            hb.setChildUserId(childUserId);
        } else if (!isNewer(ts, hb.getTimestamp())) {
            return;
        }
        hb.setTimestamp(ts);
        hb.setActivityType(type.wire());
        if (deviceInfo != null) hb.setDeviceInfo(deviceInfo);
        hb.setActive(type != ActivityType.APP_SHUTDOWN);
        heartbeats.save(hb);
    }

    /**
     * @return whether anything on the link changed
     */
    boolean applyToRelationship(Relationship r, ActivityType type, JsonNode deviceInfo, Instant ts) {
        boolean changed = false;

        if (isNewer(ts, r.getLastSyncAt())) {
            r.setLastSyncAt(ts);
            if (deviceInfo != null) r.setChildDeviceInfo(deviceInfo);
            changed = true;
        }

        switch (type) {
            case HEARTBEAT -> {
                if (isNewer(ts, r.getLastHeartbeatAt())) {
                    r.setLastHeartbeatAt(ts);
                    r.setMissedHeartbeats(0);
                    changed = true;
                }
                // running again after a graceful exit
                if (r.isNormalClosure() && isNewer(ts, r.getLastGracefulShutdownAt())) {
                    r.setNormalClosure(false);
                    changed = true;
                }
            }
            case APP_SHUTDOWN -> {
                boolean notBeforeHeartbeat = r.getLastHeartbeatAt() == null || !ts.isBefore(r.getLastHeartbeatAt());
                if (notBeforeHeartbeat && isNewer(ts, r.getLastGracefulShutdownAt())) {
                    r.setLastGracefulShutdownAt(ts);
                    r.setNormalClosure(true);
                    r.setMissedHeartbeats(0);
                    changed = true;
                }
            }
            default -> {
                // device info and sync time only
            }
        }
        return changed;
    }

    private static boolean isNewer(Instant ts, Instant stored) {
        return stored == null || ts.isAfter(stored);
    }
}
