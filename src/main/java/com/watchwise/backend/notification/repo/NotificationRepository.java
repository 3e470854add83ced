package com.watchwise.backend.notification.repo;

import com.watchwise.backend.notification.entity.NotificationEntity;
import com.watchwise.backend.notification.entity.NotificationType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface NotificationRepository extends JpaRepository<NotificationEntity, Long> {

    List<NotificationEntity> findByRecipientIdOrderByCreatedAtDesc(Long recipientId, Pageable page);

    Optional<NotificationEntity> findByIdAndRecipientId(Long id, Long recipientId);

    long countByRecipientIdAndType(Long recipientId, NotificationType type);
}
