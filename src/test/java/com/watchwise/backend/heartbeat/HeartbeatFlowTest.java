package com.watchwise.backend.heartbeat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchwise.backend.heartbeat.model.ActivityType;
import com.watchwise.backend.heartbeat.repo.HeartbeatRecordRepo;
import com.watchwise.backend.heartbeat.service.DeviceActivityService;
import com.watchwise.backend.notification.entity.NotificationEntity;
import com.watchwise.backend.notification.entity.NotificationType;
import com.watchwise.backend.notification.repo.NotificationRepository;
import com.watchwise.backend.reconcile.job.InactivitySweepJob;
import com.watchwise.backend.reconcile.job.MissedHeartbeatSweepJob;
import com.watchwise.backend.relationship.dto.RelationshipDtos.ChildDeviceDto;
import com.watchwise.backend.relationship.dto.RelationshipDtos.DeviceStatus;
import com.watchwise.backend.relationship.entity.Relationship;
import com.watchwise.backend.relationship.repo.RelationshipRepo;
import com.watchwise.backend.relationship.service.RelationshipQueryService;
import com.watchwise.backend.testsupport.BaseSpringTest;
import com.watchwise.backend.testsupport.MutableClock;
import com.watchwise.backend.testsupport.TestClockConfig;
import com.watchwise.backend.users.user.entity.User;
import com.watchwise.backend.users.user.repo.UserRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@Import(TestClockConfig.class)
class HeartbeatFlowTest extends BaseSpringTest {

    private static final Instant T = TestClockConfig.START;

    @Autowired DeviceActivityService activity;
    @Autowired MissedHeartbeatSweepJob missedSweep;
    @Autowired InactivitySweepJob inactivitySweep;
    @Autowired RelationshipQueryService relationshipQuery;
    @Autowired RelationshipRepo relationships;
    @Autowired HeartbeatRecordRepo heartbeats;
    @Autowired UserRepo users;
    @Autowired NotificationRepository notifications;
    @Autowired MutableClock clock;
    @Autowired ObjectMapper om;

    private Long parentId;
    private Long childId;
    private Long relId;

    @BeforeEach
    void setUp() {
        notifications.deleteAll();
        heartbeats.deleteAll();
        relationships.deleteAll();
        users.deleteAll();
        clock.set(T);

        User parent = new User();
        parent.setUserType(User.UserType.PARENT);
        parentId = users.save(parent).getId();

        User child = new User();
        child.setUserType(User.UserType.CHILD);
        child.setDevicePaired(true);
        child.setLastActiveAt(T);
        childId = users.save(child).getId();

        relId = relationships.save(Relationship.open(parentId, childId, "Mia", "Mia's iPhone", "482913", T)).getId();
    }

    private Relationship rel() {
        return relationships.findById(relId).orElseThrow();
    }

    private List<NotificationEntity> parentInbox() {
        return notifications.findByRecipientIdOrderByCreatedAtDesc(parentId, PageRequest.of(0, 50));
    }

    @Test
    void late_heartbeat_should_not_move_liveness_backwards() {
        clock.set(T.plus(Duration.ofMinutes(15)));

        assertThat(activity.recordActivity(childId, ActivityType.HEARTBEAT, null, T.plus(Duration.ofMinutes(10))).success()).isTrue();
        assertThat(activity.recordActivity(childId, ActivityType.HEARTBEAT, null, T.plus(Duration.ofMinutes(5))).relationshipsUpdated()).isZero();

        assertThat(rel().getLastHeartbeatAt()).isEqualTo(T.plus(Duration.ofMinutes(10)));
        assertThat(users.findById(childId).orElseThrow().getLastActiveAt()).isEqualTo(T.plus(Duration.ofMinutes(10)));
        assertThat(heartbeats.findByChildUserId(childId).orElseThrow().getTimestamp()).isEqualTo(T.plus(Duration.ofMinutes(10)));
    }

    @Test
    void silence_should_escalate_once_per_level() {
        clock.set(T.plus(Duration.ofMinutes(21)));
        assertThat(missedSweep.runOnce()).isEqualTo(1);
        assertThat(missedSweep.runOnce()).isZero();

        clock.set(T.plus(Duration.ofMinutes(42)));
        assertThat(missedSweep.runOnce()).isEqualTo(1);

        assertThat(rel().getMissedHeartbeats()).isEqualTo(2);
        assertThat(parentInbox())
                .extracting(NotificationEntity::getTitle)
                .containsExactlyInAnyOrder("First Heartbeat Missed", "Second Heartbeat Missed");
        assertThat(parentInbox()).allMatch(n -> n.getType() == NotificationType.MISSED_HEARTBEAT);
    }

    @Test
    void graceful_shutdown_should_silence_sweep_until_device_returns() {
        clock.set(T.plus(Duration.ofMinutes(21)));
        assertThat(missedSweep.runOnce()).isEqualTo(1);

        activity.recordActivity(childId, ActivityType.APP_SHUTDOWN, null, null);
        Relationship closed = rel();
        assertThat(closed.isNormalClosure()).isTrue();
        assertThat(closed.getMissedHeartbeats()).isZero();

        clock.set(T.plus(Duration.ofHours(5)));
        assertThat(missedSweep.runOnce()).isZero();

        Instant back = T.plus(Duration.ofHours(5));
        activity.recordActivity(childId, ActivityType.HEARTBEAT, null, back);
        assertThat(rel().isNormalClosure()).isFalse();

        clock.set(back.plus(Duration.ofMinutes(21)));
        assertThat(missedSweep.runOnce()).isEqualTo(1);
        assertThat(rel().getMissedHeartbeats()).isEqualTo(1);
        assertThat(parentInbox())
                .filteredOn(n -> n.getTitle().equals("First Heartbeat Missed"))
                .hasSize(2);
    }

    @Test
    void device_info_should_follow_latest_signal_and_drive_status() throws Exception {
        clock.set(T.plus(Duration.ofMinutes(2)));
        activity.recordActivity(childId, ActivityType.APP_OPENED,
                om.readTree("{\"model\":\"iPhone15,2\",\"osVersion\":\"17.4\"}"), null);

        List<ChildDeviceDto> children = relationshipQuery.listChildren(parentId);
        assertThat(children).hasSize(1);
        ChildDeviceDto dto = children.get(0);
        assertThat(dto.online()).isTrue();
        assertThat(dto.status()).isEqualTo(DeviceStatus.ONLINE);
        assertThat(dto.deviceInfo().get("model").asText()).isEqualTo("iPhone15,2");

        clock.set(T.plus(Duration.ofHours(25)));
        ChildDeviceDto later = relationshipQuery.listChildren(parentId).get(0);
        assertThat(later.online()).isFalse();
        assertThat(later.status()).isEqualTo(DeviceStatus.OFFLINE);
    }

    @Test
    void inactive_child_should_alert_parent_on_every_run() {
        clock.set(T.plus(Duration.ofDays(3)).plusSeconds(60));

        assertThat(inactivitySweep.runOnce()).isEqualTo(1);
        assertThat(inactivitySweep.runOnce()).isEqualTo(1);

        assertThat(notifications.countByRecipientIdAndType(parentId, NotificationType.INACTIVITY_ALERT)).isEqualTo(2);

        activity.recordActivity(childId, ActivityType.APP_OPENED, null, null);
        assertThat(inactivitySweep.runOnce()).isZero();
    }
}
