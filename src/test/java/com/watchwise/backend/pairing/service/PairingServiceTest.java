package com.watchwise.backend.pairing.service;

import com.watchwise.backend.common.web.ApiErrorCode;
import com.watchwise.backend.common.web.ApiException;
import com.watchwise.backend.notification.entity.NotificationType;
import com.watchwise.backend.notification.service.NotificationDispatcher;
import com.watchwise.backend.pairing.config.PairingProperties;
import com.watchwise.backend.pairing.dto.PairResponse;
import com.watchwise.backend.pairing.dto.UnpairResponse;
import com.watchwise.backend.pairing.entity.PairingCode;
import com.watchwise.backend.pairing.repo.PairingCodeRepo;
import com.watchwise.backend.relationship.entity.Relationship;
import com.watchwise.backend.relationship.repo.RelationshipRepo;
import com.watchwise.backend.users.user.entity.User;
import com.watchwise.backend.users.user.repo.UserRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PairingServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-10T09:05:00Z");
    private static final Long PARENT = 1L;
    private static final Long OTHER_PARENT = 2L;
    private static final Long CHILD = 10L;

    private PairingCodeRepo codes;
    private RelationshipRepo relationships;
    private UserRepo users;
    private PairingCodeExpiryScheduler expiryScheduler;
    private NotificationDispatcher notifications;
    private PairingService service;

    @BeforeEach
    void setUp() {
        codes = mock(PairingCodeRepo.class);
        relationships = mock(RelationshipRepo.class);
        users = mock(UserRepo.class);
        expiryScheduler = mock(PairingCodeExpiryScheduler.class);
        notifications = mock(NotificationDispatcher.class);

        when(relationships.saveAndFlush(any(Relationship.class))).thenAnswer(inv -> {
            Relationship r = inv.getArgument(0);
            if (r.getId() == null) r.setId(500L);
            return r;
        });

        service = new PairingService(
                codes, relationships, users, expiryScheduler, notifications,
                new TransactionTemplate(mock(PlatformTransactionManager.class)),
                new PairingProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    private static PairingCode code(Long id, Instant created) {
        PairingCode pc = new PairingCode();
        pc.setId(id);
        pc.setCode("482913");
        pc.setChildUserId(CHILD);
        pc.setChildName("Mia");
        pc.setDeviceName("Mia's iPhone");
        pc.setCreatedAt(created);
        pc.setExpiresAt(created.plus(Duration.ofMinutes(10)));
        return pc;
    }

    private static User child() {
        User u = new User();
        u.setId(CHILD);
        return u;
    }

    private static ApiErrorCode errorOf(Runnable r) {
        return assertThrows(ApiException.class, r::run).code();
    }

    @Test
    void pair_should_reject_malformed_code_without_touching_store() {
        assertEquals(ApiErrorCode.INVALID_FORMAT, errorOf(() -> service.pair("48291", PARENT)));
        assertEquals(ApiErrorCode.INVALID_FORMAT, errorOf(() -> service.pair("48a913", PARENT)));
        assertEquals(ApiErrorCode.INVALID_FORMAT, errorOf(() -> service.pair(null, PARENT)));

        verifyNoInteractions(codes);
    }

    @Test
    void pair_should_link_parent_and_flag_child() {
        PairingCode pc = code(7L, NOW.minus(Duration.ofMinutes(5)));
        when(codes.findUnconsumed("482913")).thenReturn(List.of(pc));
        when(codes.consume(7L, PARENT, NOW)).thenReturn(1);
        User child = child();
        when(users.findByIdForUpdate(CHILD)).thenReturn(child);

        PairResponse res = service.pair(" 482913 ", PARENT);

        assertEquals(500L, res.relationshipId());
        assertEquals(CHILD, res.childUserId());
        assertEquals("Mia", res.childName());
        assertEquals("Mia's iPhone", res.deviceName());

        verify(relationships).saveAndFlush(argThat(r ->
                r.isActive()
                        && PARENT.equals(r.getParentUserId())
                        && NOW.equals(r.getLastHeartbeatAt())
                        && r.getMissedHeartbeats() == 0));
        assertTrue(child.isDevicePaired());
        assertEquals(PARENT, child.getPairedWithParentId());
        assertEquals(User.UserType.CHILD, child.getUserType());
        verify(expiryScheduler).cancel(7L);
    }

    @Test
    void pair_should_answer_not_found_for_unknown_code() {
        when(codes.findUnconsumed("482913")).thenReturn(List.of());
        when(codes.findConsumed("482913")).thenReturn(List.of());

        assertEquals(ApiErrorCode.CODE_NOT_FOUND, errorOf(() -> service.pair("482913", PARENT)));
    }

    @Test
    void pair_should_answer_already_paired_on_replay_by_same_parent() {
        PairingCode used = code(7L, NOW.minus(Duration.ofMinutes(5)));
        used.setActive(true);
        used.setParentUserId(PARENT);
        when(codes.findUnconsumed("482913")).thenReturn(List.of());
        when(codes.findConsumed("482913")).thenReturn(List.of(used));
        when(relationships.existsByParentUserIdAndChildUserIdAndActiveTrue(PARENT, CHILD)).thenReturn(true);

        assertEquals(ApiErrorCode.ALREADY_PAIRED, errorOf(() -> service.pair("482913", PARENT)));
    }

    @Test
    void pair_should_answer_not_found_when_another_parent_consumed_code() {
        PairingCode used = code(7L, NOW.minus(Duration.ofMinutes(5)));
        used.setActive(true);
        used.setParentUserId(OTHER_PARENT);
        when(codes.findUnconsumed("482913")).thenReturn(List.of());
        when(codes.findConsumed("482913")).thenReturn(List.of(used));

        assertEquals(ApiErrorCode.CODE_NOT_FOUND, errorOf(() -> service.pair("482913", PARENT)));
    }

    @Test
    void pair_should_answer_expired_past_deadline_even_if_flag_lags() {
        PairingCode pc = code(7L, NOW.minus(Duration.ofMinutes(11)));
        when(codes.findUnconsumed("482913")).thenReturn(List.of(pc));

        assertEquals(ApiErrorCode.CODE_EXPIRED, errorOf(() -> service.pair("482913", PARENT)));
        verify(codes, never()).consume(any(), any(), any());
    }

    @Test
    void pair_should_answer_expired_once_code_was_flagged() {
        when(codes.findUnconsumed("482913")).thenReturn(List.of());
        when(codes.findConsumed("482913")).thenReturn(List.of());
        when(codes.countLapsed("482913", NOW)).thenReturn(1L);

        assertEquals(ApiErrorCode.CODE_EXPIRED, errorOf(() -> service.pair("482913", PARENT)));
        verify(codes, never()).consume(any(), any(), any());
    }

    @Test
    void pair_should_accept_code_exactly_at_deadline() {
        PairingCode pc = code(7L, NOW.minus(Duration.ofMinutes(10)));
        when(codes.findUnconsumed("482913")).thenReturn(List.of(pc));
        when(codes.consume(7L, PARENT, NOW)).thenReturn(1);
        when(users.findByIdForUpdate(CHILD)).thenReturn(child());

        assertEquals(CHILD, service.pair("482913", PARENT).childUserId());
    }

    @Test
    void pair_should_answer_already_paired_when_link_exists_and_leave_code_unconsumed() {
        PairingCode pc = code(7L, NOW.minus(Duration.ofMinutes(1)));
        when(codes.findUnconsumed("482913")).thenReturn(List.of(pc));
        when(relationships.existsByParentUserIdAndChildUserIdAndActiveTrue(PARENT, CHILD)).thenReturn(true);

        assertEquals(ApiErrorCode.ALREADY_PAIRED, errorOf(() -> service.pair("482913", PARENT)));
        verify(codes, never()).consume(any(), any(), any());
    }

    @Test
    void pair_should_rerun_lookup_after_losing_race() {
        PairingCode pc = code(7L, NOW.minus(Duration.ofMinutes(1)));
        PairingCode used = code(7L, NOW.minus(Duration.ofMinutes(1)));
        used.setActive(true);
        used.setParentUserId(OTHER_PARENT);

        when(codes.findUnconsumed("482913")).thenReturn(List.of(pc), List.of());
        when(codes.consume(7L, PARENT, NOW)).thenReturn(0);
        when(codes.findConsumed("482913")).thenReturn(List.of(used));

        assertEquals(ApiErrorCode.CODE_NOT_FOUND, errorOf(() -> service.pair("482913", PARENT)));
        verify(codes, times(2)).findUnconsumed("482913");
        verify(relationships, never()).saveAndFlush(any());
    }

    @Test
    void pair_should_report_transient_failure_when_store_keeps_failing() {
        when(codes.findUnconsumed("482913")).thenThrow(new CannotAcquireLockException("lock wait timeout"));

        ApiException ex = assertThrows(ApiException.class, () -> service.pair("482913", PARENT));

        assertEquals(ApiErrorCode.TRANSIENT_STORE_FAILURE, ex.code());
        assertInstanceOf(CannotAcquireLockException.class, ex.getCause());
        verify(codes, times(3)).findUnconsumed("482913");
    }

    @Test
    void pair_should_fail_when_child_account_is_missing() {
        PairingCode pc = code(7L, NOW.minus(Duration.ofMinutes(1)));
        when(codes.findUnconsumed("482913")).thenReturn(List.of(pc));
        when(codes.consume(7L, PARENT, NOW)).thenReturn(1);
        when(users.findByIdForUpdate(CHILD)).thenReturn(null);

        assertEquals(ApiErrorCode.NOT_FOUND, errorOf(() -> service.pair("482913", PARENT)));
        verify(expiryScheduler, never()).cancel(any());
    }

    // ===== unpair =====

    private static Relationship activeLink() {
        Relationship r = Relationship.open(PARENT, CHILD, "Mia", "Mia's iPhone", "482913", NOW.minus(Duration.ofDays(1)));
        r.setId(500L);
        return r;
    }

    @Test
    void unpair_by_parent_should_deactivate_notify_child_and_clear_child_flag() {
        Relationship rel = activeLink();
        when(relationships.findByIdForUpdate(500L)).thenReturn(Optional.of(rel));
        User child = child();
        child.setDevicePaired(true);
        child.setPairedWithParentId(PARENT);
        when(users.findByIdForUpdate(CHILD)).thenReturn(child);
        when(relationships.findByChildUserIdAndActiveTrueOrderByCreatedAtAsc(CHILD)).thenReturn(List.of());

        UnpairResponse res = service.unpair(500L, PARENT);

        assertTrue(res.success());
        assertFalse(res.alreadyUnlinked());
        assertFalse(rel.isActive());
        assertNull(rel.getActivePairKey());
        assertEquals(PARENT, rel.getUnlinkedBy());
        assertFalse(child.isDevicePaired());
        assertNull(child.getPairedWithParentId());

        verify(notifications).dispatch(argThat(e ->
                e.recipientId().equals(CHILD)
                        && e.type() == NotificationType.DEVICE_UNLINKED
                        && e.message().equals("Mia's device has been unlinked from your account.")));
    }

    @Test
    void unpair_by_child_should_notify_parent_and_keep_flag_while_other_links_remain() {
        Relationship rel = activeLink();
        when(relationships.findByIdForUpdate(500L)).thenReturn(Optional.of(rel));
        User child = child();
        child.setDevicePaired(true);
        child.setPairedWithParentId(PARENT);
        when(users.findByIdForUpdate(CHILD)).thenReturn(child);
        Relationship remaining = Relationship.open(OTHER_PARENT, CHILD, "Mia", "Mia's iPhone", "111111", NOW);
        when(relationships.findByChildUserIdAndActiveTrueOrderByCreatedAtAsc(CHILD)).thenReturn(List.of(remaining));

        service.unpair(500L, CHILD);

        assertTrue(child.isDevicePaired());
        assertEquals(OTHER_PARENT, child.getPairedWithParentId());
        verify(notifications).dispatch(argThat(e -> e.recipientId().equals(PARENT)));
    }

    @Test
    void unpair_should_be_noop_on_already_unlinked() {
        Relationship rel = activeLink();
        rel.unlink(PARENT, NOW.minus(Duration.ofHours(1)));
        when(relationships.findByIdForUpdate(500L)).thenReturn(Optional.of(rel));

        UnpairResponse res = service.unpair(500L, PARENT);

        assertTrue(res.success());
        assertTrue(res.alreadyUnlinked());
        verifyNoInteractions(notifications);
        verify(relationships, never()).saveAndFlush(any());
    }

    @Test
    void unpair_should_deny_third_party() {
        when(relationships.findByIdForUpdate(500L)).thenReturn(Optional.of(activeLink()));

        assertEquals(ApiErrorCode.PERMISSION_DENIED, errorOf(() -> service.unpair(500L, 99L)));
        verifyNoInteractions(notifications);
    }

    @Test
    void unpair_should_answer_not_found_for_unknown_relationship() {
        when(relationships.findByIdForUpdate(eq(404L))).thenReturn(Optional.empty());

        assertEquals(ApiErrorCode.NOT_FOUND, errorOf(() -> service.unpair(404L, PARENT)));
    }
}
