package com.watchwise.backend.notification.service;

import com.watchwise.backend.common.web.ApiErrorCode;
import com.watchwise.backend.common.web.ApiException;
import com.watchwise.backend.notification.dto.NotificationDto;
import com.watchwise.backend.notification.entity.NotificationEntity;
import com.watchwise.backend.notification.repo.NotificationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class NotificationInboxService {

    private static final int MAX_PAGE = 100;

    private final NotificationRepository repo;

    @Transactional(readOnly = true)
    public List<NotificationDto> list(Long recipientId, int limit) {
        int size = Math.min(Math.max(limit, 1), MAX_PAGE);
        return repo.findByRecipientIdOrderByCreatedAtDesc(recipientId, PageRequest.of(0, size))
                .stream()
                .map(NotificationInboxService::toDto)
                .toList();
    }

    @Transactional
    public NotificationDto markRead(Long recipientId, Long notificationId) {
        NotificationEntity n = repo.findByIdAndRecipientId(notificationId, recipientId)
                .orElseThrow(() -> new ApiException(ApiErrorCode.NOT_FOUND));
        n.setRead(true);
        return toDto(repo.save(n));
    }

    static NotificationDto toDto(NotificationEntity n) {
        return new NotificationDto(
                n.getId(),
                n.getRecipientId(),
                n.getType().wire(),
                n.getTitle(),
                n.getMessage(),
                n.getData(),
                n.getCreatedAt(),
                n.isRead()
        );
    }
}
