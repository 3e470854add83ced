package com.watchwise.backend.notification.service;

import com.watchwise.backend.common.web.ApiErrorCode;
import com.watchwise.backend.common.web.ApiException;
import com.watchwise.backend.notification.entity.NotificationEntity;
import com.watchwise.backend.notification.entity.NotificationType;
import com.watchwise.backend.notification.repo.NotificationRepository;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class NotificationInboxServiceTest {

    private final NotificationRepository repo = mock(NotificationRepository.class);
    private final NotificationInboxService service = new NotificationInboxService(repo);

    private static NotificationEntity entity() {
        NotificationEntity n = new NotificationEntity();
        n.setId(8L);
        n.setRecipientId(1L);
        n.setType(NotificationType.MISSED_HEARTBEAT);
        n.setTitle("First Heartbeat Missed");
        n.setMessage("...");
        n.setCreatedAt(Instant.parse("2025-03-10T09:00:00Z"));
        return n;
    }

    @Test
    void list_should_clamp_page_size() {
        when(repo.findByRecipientIdOrderByCreatedAtDesc(eq(1L), any(Pageable.class))).thenReturn(List.of(entity()));

        assertEquals("missed_heartbeat", service.list(1L, 5000).get(0).type());
        verify(repo).findByRecipientIdOrderByCreatedAtDesc(eq(1L), argThat(p -> p.getPageSize() == 100));

        service.list(1L, 0);
        verify(repo).findByRecipientIdOrderByCreatedAtDesc(eq(1L), argThat(p -> p.getPageSize() == 1));
    }

    @Test
    void markRead_should_flag_own_notification() {
        NotificationEntity n = entity();
        when(repo.findByIdAndRecipientId(8L, 1L)).thenReturn(Optional.of(n));
        when(repo.save(n)).thenReturn(n);

        assertTrue(service.markRead(1L, 8L).read());
    }

    @Test
    void markRead_should_hide_other_recipients_notifications() {
        when(repo.findByIdAndRecipientId(8L, 2L)).thenReturn(Optional.empty());

        ApiException ex = assertThrows(ApiException.class, () -> service.markRead(2L, 8L));
        assertEquals(ApiErrorCode.NOT_FOUND, ex.code());
    }
}
