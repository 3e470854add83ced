package com.watchwise.backend.reconcile.job;

import com.watchwise.backend.notification.entity.NotificationType;
import com.watchwise.backend.notification.service.NotificationDispatcher;
import com.watchwise.backend.reconcile.config.ReconcileProperties;
import com.watchwise.backend.relationship.entity.Relationship;
import com.watchwise.backend.relationship.repo.RelationshipRepo;
import com.watchwise.backend.users.user.entity.User;
import com.watchwise.backend.users.user.repo.UserRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class InactivitySweepJobTest {

    private static final Instant NOW = Instant.parse("2025-03-10T09:00:00Z");

    private UserRepo users;
    private RelationshipRepo relationships;
    private NotificationDispatcher notifications;
    private InactivitySweepJob job;

    @BeforeEach
    void setUp() {
        users = mock(UserRepo.class);
        relationships = mock(RelationshipRepo.class);
        notifications = mock(NotificationDispatcher.class);

        ReconcileProperties props = new ReconcileProperties();
        props.setBatchSize(2);

        job = new InactivitySweepJob(props, users, relationships, notifications, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static User child(Long id) {
        User u = new User();
        u.setId(id);
        u.setUserType(User.UserType.CHILD);
        u.setLastActiveAt(NOW.minus(Duration.ofDays(4)));
        return u;
    }

    @Test
    void sweep_should_alert_every_linked_parent_of_inactive_child() {
        when(users.findInactiveChildren(eq(NOW.minus(Duration.ofDays(3))), any(Pageable.class)))
                .thenReturn(List.of(child(10L)), List.of());
        when(relationships.findByChildUserIdAndActiveTrueOrderByCreatedAtAsc(10L)).thenReturn(List.of(
                Relationship.open(1L, 10L, "Mia", "iPhone", "111111", NOW),
                Relationship.open(2L, 10L, "Mia", "iPhone", "222222", NOW)
        ));

        assertEquals(2, job.runOnce());

        verify(notifications).dispatch(argThat(e -> e.recipientId().equals(1L)
                && e.type() == NotificationType.INACTIVITY_ALERT
                && e.message().equals("Mia hasn't opened WatchWise in 3 days. Please check on their device.")));
        verify(notifications).dispatch(argThat(e -> e.recipientId().equals(2L)));
    }

    @Test
    void sweep_should_page_through_all_candidates() {
        when(users.findInactiveChildren(any(), any(Pageable.class)))
                .thenReturn(List.of(child(10L), child(11L)), List.of(child(12L)));
        when(relationships.findByChildUserIdAndActiveTrueOrderByCreatedAtAsc(any()))
                .thenAnswer(inv -> List.of(Relationship.open(1L, inv.getArgument(0), "Kid", "iPad", "000000", NOW)));

        assertEquals(3, job.runOnce());
        verify(users, times(2)).findInactiveChildren(any(), any(Pageable.class));
    }

    @Test
    void sweep_should_continue_after_one_child_fails() {
        when(users.findInactiveChildren(any(), any(Pageable.class)))
                .thenReturn(List.of(child(10L), child(11L)), List.of());
        when(relationships.findByChildUserIdAndActiveTrueOrderByCreatedAtAsc(10L))
                .thenThrow(new IllegalStateException("boom"));
        when(relationships.findByChildUserIdAndActiveTrueOrderByCreatedAtAsc(11L))
                .thenReturn(List.of(Relationship.open(1L, 11L, "Leo", "iPad", "000000", NOW)));

        assertEquals(1, job.runOnce());
    }

    @Test
    void sweep_should_skip_children_without_active_links() {
        when(users.findInactiveChildren(any(), any(Pageable.class))).thenReturn(List.of(child(10L)));
        when(relationships.findByChildUserIdAndActiveTrueOrderByCreatedAtAsc(10L)).thenReturn(List.of());

        assertEquals(0, job.runOnce());
        verifyNoInteractions(notifications);
    }
}
