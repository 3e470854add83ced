package com.watchwise.backend.pairing.service;

import com.watchwise.backend.common.web.ApiErrorCode;
import com.watchwise.backend.common.web.ApiException;
import com.watchwise.backend.notification.entity.NotificationType;
import com.watchwise.backend.notification.service.NotificationDispatcher;
import com.watchwise.backend.notification.service.NotificationEvent;
import com.watchwise.backend.pairing.config.PairingProperties;
import com.watchwise.backend.pairing.dto.PairResponse;
import com.watchwise.backend.pairing.dto.UnpairResponse;
import com.watchwise.backend.pairing.entity.PairingCode;
import com.watchwise.backend.pairing.repo.PairingCodeRepo;
import com.watchwise.backend.relationship.entity.Relationship;
import com.watchwise.backend.relationship.repo.RelationshipRepo;
import com.watchwise.backend.users.user.entity.User;
import com.watchwise.backend.users.user.repo.UserRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns a submitted code into a relationship.
 * <p>
 * Consuming the code, creating the relationship and flagging the child's profile commit
 * together or not at all. Two parents racing on one code may both read it as unconsumed;
 * the conditional consume lets exactly one through and the loser re-runs the lookup,
 * which then answers CODE_NOT_FOUND or ALREADY_PAIRED.
 */
@Slf4j
@Service
public class PairingService {

    private final PairingCodeRepo codes;
    private final RelationshipRepo relationships;
    private final UserRepo users;
    private final PairingCodeExpiryScheduler expiryScheduler;
    private final NotificationDispatcher notifications;
    private final TransactionTemplate tx;
    private final PairingProperties props;
    private final Clock clock;
    private final Pattern codeFormat;

    public PairingService(PairingCodeRepo codes,
                          RelationshipRepo relationships,
                          UserRepo users,
                          PairingCodeExpiryScheduler expiryScheduler,
                          NotificationDispatcher notifications,
                          TransactionTemplate tx,
                          PairingProperties props,
                          Clock clock) {
        this.codes = codes;
        this.relationships = relationships;
        this.users = users;
        this.expiryScheduler = expiryScheduler;
        this.notifications = notifications;
        this.tx = tx;
        this.props = props;
        this.clock = clock;
        this.codeFormat = Pattern.compile("\\d{" + props.getCodeLength() + "}");
    }

    public PairResponse pair(String rawCode, Long parentUserId) {
        final String code = rawCode == null ? null : rawCode.trim();
        if (code == null || !codeFormat.matcher(code).matches()) {
            throw new ApiException(ApiErrorCode.INVALID_FORMAT);
        }

        final int maxAttempts = Math.max(1, props.getMaxPairAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                PairOutcome out = tx.execute(s -> pairOnce(code, parentUserId));
                // committed: the deferred expiry has nothing left to do
                expiryScheduler.cancel(out.codeId());
                log.info("pairing ok. relationshipId={} parentId={} childId={} attempt={}",
                        out.response().relationshipId(), parentUserId, out.response().childUserId(), attempt);
                return out.response();
            } catch (ConcurrentPairingException | DataAccessException e) {
                if (attempt >= maxAttempts) {
                    log.warn("pairing gave up after {} attempts. parentId={}", attempt, parentUserId, e);
                    throw new ApiException(ApiErrorCode.TRANSIENT_STORE_FAILURE,
                            ApiErrorCode.TRANSIENT_STORE_FAILURE.userMessage(), e);
                }
                log.info("pairing lost a race, retrying. parentId={} attempt={} cause={}",
                        parentUserId, attempt, e.getClass().getSimpleName());
            }
        }
    }

    private PairOutcome pairOnce(String code, Long parentUserId) {
        final Instant now = Instant.now(clock);

        List<PairingCode> candidates = codes.findUnconsumed(code);
        if (candidates.isEmpty()) {
            if (consumedByThisParentAndStillLinked(code, parentUserId)) {
                throw new ApiException(ApiErrorCode.ALREADY_PAIRED);
            }
            // the expiry task or the sweep may already have flagged it
            if (codes.countLapsed(code, now) > 0) {
                throw new ApiException(ApiErrorCode.CODE_EXPIRED);
            }
            throw new ApiException(ApiErrorCode.CODE_NOT_FOUND);
        }

        PairingCode pc = candidates.get(0);

        // the expiry flag may lag behind the deadline
        if (pc.isPastDeadline(now)) {
            throw new ApiException(ApiErrorCode.CODE_EXPIRED);
        }

        if (relationships.existsByParentUserIdAndChildUserIdAndActiveTrue(parentUserId, pc.getChildUserId())) {
            throw new ApiException(ApiErrorCode.ALREADY_PAIRED);
        }

        if (codes.consume(pc.getId(), parentUserId, now) != 1) {
            throw new ConcurrentPairingException(code);
        }

        Relationship rel = relationships.saveAndFlush(Relationship.open(
                parentUserId, pc.getChildUserId(), pc.getChildName(), pc.getDeviceName(), pc.getCode(), now));

        User child = users.findByIdForUpdate(pc.getChildUserId());
        if (child == null) {
            throw new ApiException(ApiErrorCode.NOT_FOUND, "Child account not found.");
        }
        if (child.getUserType() == null) child.setUserType(User.UserType.CHILD);
        child.setDevicePaired(true);
        child.setPairedWithParentId(parentUserId);
        child.setPairedAt(now);
        child.setUnlinkedAt(null);
        users.save(child);

        return new PairOutcome(pc.getId(), new PairResponse(
                rel.getId(), rel.getChildUserId(), rel.getChildName(), rel.getDeviceName()));
    }

    private boolean consumedByThisParentAndStillLinked(String code, Long parentUserId) {
        for (PairingCode used : codes.findConsumed(code)) {
            if (parentUserId.equals(used.getParentUserId())
                    && relationships.existsByParentUserIdAndChildUserIdAndActiveTrue(parentUserId, used.getChildUserId())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Either party may unlink. Unlinking is final; calling it again on the same link is a no-op.
     */
    @Transactional
    public UnpairResponse unpair(Long relationshipId, Long requestingUserId) {
        Relationship rel = relationships.findByIdForUpdate(relationshipId)
                .orElseThrow(() -> new ApiException(ApiErrorCode.NOT_FOUND, "Relationship not found."));

        if (!rel.involves(requestingUserId)) {
            throw new ApiException(ApiErrorCode.PERMISSION_DENIED, "Not authorized to unlink this device.");
        }
        if (!rel.isActive()) {
            return new UnpairResponse(true, true);
        }

        final Instant now = Instant.now(clock);
        rel.unlink(requestingUserId, now);
        relationships.saveAndFlush(rel);

        clearChildPairingIfLast(rel, now);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("relationshipId", rel.getId());
        data.put("parentUserId", rel.getParentUserId());
        data.put("childUserId", rel.getChildUserId());
        data.put("childName", rel.getChildName());
        data.put("unlinkedBy", requestingUserId);

        notifications.dispatch(new NotificationEvent(
                rel.otherParty(requestingUserId),
                NotificationType.DEVICE_UNLINKED,
                "Device Unlinked",
                rel.getChildName() + "'s device has been unlinked from your account.",
                data,
                now
        ));

        log.info("unlink ok. relationshipId={} by={}", relationshipId, requestingUserId);
        return new UnpairResponse(true, false);
    }

    private void clearChildPairingIfLast(Relationship rel, Instant now) {
        User child = users.findByIdForUpdate(rel.getChildUserId());
        if (child == null) return;

        List<Relationship> remaining = relationships.findByChildUserIdAndActiveTrueOrderByCreatedAtAsc(child.getId());
        if (remaining.isEmpty()) {
            child.setDevicePaired(false);
            child.setPairedWithParentId(null);
            child.setUnlinkedAt(now);
        } else if (rel.getParentUserId().equals(child.getPairedWithParentId())) {
            child.setPairedWithParentId(remaining.get(remaining.size() - 1).getParentUserId());
        }
        users.save(child);
    }

    private record PairOutcome(Long codeId, PairResponse response) {}
}
