package com.watchwise.backend.notification.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchwise.backend.notification.entity.NotificationEntity;
import com.watchwise.backend.notification.repo.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes every event to the recipient's inbox table; the push sender polls from there.
 * Joins the caller's transaction, so a rolled back sweep item leaves no notification behind.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InboxNotificationDispatcher implements NotificationDispatcher {

    private final NotificationRepository repo;
    private final ObjectMapper om;

    @Override
    @Transactional
    public void dispatch(NotificationEvent event) {
        NotificationEntity n = new NotificationEntity();
        n.setRecipientId(event.recipientId());
        n.setType(event.type());
        n.setTitle(event.title());
        n.setMessage(event.message());
        n.setData(om.valueToTree(event.data()));
        n.setCreatedAt(event.timestamp());
        n.setRead(false);
        repo.save(n);

        log.info("notification queued. recipientId={} type={} title={}",
                event.recipientId(), event.type().wire(), event.title());
    }
}
