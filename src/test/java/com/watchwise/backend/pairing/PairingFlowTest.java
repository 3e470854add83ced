package com.watchwise.backend.pairing;

import com.watchwise.backend.common.web.ApiErrorCode;
import com.watchwise.backend.common.web.ApiException;
import com.watchwise.backend.notification.entity.NotificationEntity;
import com.watchwise.backend.notification.entity.NotificationType;
import com.watchwise.backend.notification.repo.NotificationRepository;
import com.watchwise.backend.pairing.dto.GenerateCodeResponse;
import com.watchwise.backend.pairing.dto.PairResponse;
import com.watchwise.backend.pairing.entity.PairingCode;
import com.watchwise.backend.pairing.repo.PairingCodeRepo;
import com.watchwise.backend.pairing.service.PairingCodeGenerator;
import com.watchwise.backend.pairing.service.PairingCodeService;
import com.watchwise.backend.pairing.service.PairingService;
import com.watchwise.backend.reconcile.job.PairingCodeSweepJob;
import com.watchwise.backend.reconcile.job.StalePairingPurgeJob;
import com.watchwise.backend.relationship.entity.Relationship;
import com.watchwise.backend.relationship.repo.RelationshipRepo;
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
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

@SpringBootTest
@Import(TestClockConfig.class)
class PairingFlowTest extends BaseSpringTest {

    @Autowired PairingCodeService codeService;
    @Autowired PairingService pairingService;
    @Autowired PairingCodeSweepJob codeSweep;
    @Autowired StalePairingPurgeJob stalePurge;
    @Autowired PairingCodeRepo codes;
    @Autowired RelationshipRepo relationships;
    @Autowired UserRepo users;
    @Autowired NotificationRepository notifications;
    @Autowired MutableClock clock;

    @MockitoBean PairingCodeGenerator generator;

    private Long childId;
    private Long parentId;
    private Long otherParentId;

    @BeforeEach
    void setUp() {
        notifications.deleteAll();
        relationships.deleteAll();
        codes.deleteAll();
        users.deleteAll();

        clock.set(TestClockConfig.START);
        when(generator.next()).thenReturn("482913");

        childId = newUser(User.UserType.CHILD);
        parentId = newUser(User.UserType.PARENT);
        otherParentId = newUser(User.UserType.PARENT);
    }

    private Long newUser(User.UserType type) {
        User u = new User();
        u.setUserType(type);
        return users.save(u).getId();
    }

    private static ApiErrorCode errorOf(Runnable r) {
        return assertThrows(ApiException.class, r::run).code();
    }

    @Test
    void code_should_pair_within_ttl_and_replay_should_answer_already_paired() {
        GenerateCodeResponse issued = codeService.generate(childId, "Mia", "Mia's iPhone");
        assertEquals("482913", issued.code());
        assertEquals(TestClockConfig.START.plus(Duration.ofMinutes(10)), issued.expiresAt());

        clock.advance(Duration.ofMinutes(5));
        PairResponse paired = pairingService.pair("482913", parentId);

        assertThat(paired.childUserId()).isEqualTo(childId);
        assertThat(paired.childName()).isEqualTo("Mia");

        Relationship rel = relationships.findById(paired.relationshipId()).orElseThrow();
        assertThat(rel.isActive()).isTrue();
        assertThat(rel.getLastHeartbeatAt()).isEqualTo(TestClockConfig.START.plus(Duration.ofMinutes(5)));

        User child = users.findById(childId).orElseThrow();
        assertThat(child.isDevicePaired()).isTrue();
        assertThat(child.getPairedWithParentId()).isEqualTo(parentId);

        PairingCode used = codes.findConsumed("482913").get(0);
        assertThat(used.getParentUserId()).isEqualTo(parentId);

        clock.advance(Duration.ofMinutes(1));
        assertEquals(ApiErrorCode.ALREADY_PAIRED, errorOf(() -> pairingService.pair("482913", parentId)));
        assertEquals(ApiErrorCode.CODE_NOT_FOUND, errorOf(() -> pairingService.pair("482913", otherParentId)));
    }

    @Test
    void code_past_ttl_should_stay_expired_after_sweep_until_purged() {
        codeService.generate(childId, "Mia", "Mia's iPhone");

        clock.advance(Duration.ofMinutes(11));
        assertEquals(ApiErrorCode.CODE_EXPIRED, errorOf(() -> pairingService.pair("482913", parentId)));

        assertThat(codeSweep.runOnce()).isEqualTo(1);
        assertThat(codes.findAll()).allSatisfy(c -> assertThat(c.isExpired()).isTrue());
        assertEquals(ApiErrorCode.CODE_EXPIRED, errorOf(() -> pairingService.pair("482913", parentId)));
        assertEquals(ApiErrorCode.CODE_EXPIRED, errorOf(() -> pairingService.pair("482913", otherParentId)));
        assertThat(relationships.existsByChildUserIdAndActiveTrue(childId)).isFalse();

        clock.advance(Duration.ofHours(25));
        assertThat(stalePurge.runOnce()).isEqualTo(1);
        assertEquals(ApiErrorCode.CODE_NOT_FOUND, errorOf(() -> pairingService.pair("482913", parentId)));
    }

    @Test
    void new_code_should_retire_previous_one() {
        when(generator.next()).thenReturn("111111", "222222");
        codeService.generate(childId, "Mia", "Mia's iPhone");
        codeService.generate(childId, "Mia", "Mia's iPhone");

        assertEquals(ApiErrorCode.CODE_NOT_FOUND, errorOf(() -> pairingService.pair("111111", parentId)));
        assertThat(pairingService.pair("222222", parentId).childUserId()).isEqualTo(childId);

        // retired before its deadline, so it never reads as expired
        clock.advance(Duration.ofMinutes(11));
        assertEquals(ApiErrorCode.CODE_NOT_FOUND, errorOf(() -> pairingService.pair("111111", otherParentId)));
    }

    @Test
    void stale_purge_should_drop_codes_older_than_a_day() {
        codeService.generate(childId, "Mia", "Mia's iPhone");

        clock.advance(Duration.ofHours(23));
        assertThat(stalePurge.runOnce()).isZero();

        clock.advance(Duration.ofHours(2));
        assertThat(stalePurge.runOnce()).isEqualTo(1);
        assertThat(codes.count()).isZero();
    }

    @Test
    void racing_parents_should_produce_exactly_one_link() throws Exception {
        codeService.generate(childId, "Mia", "Mia's iPhone");
        clock.advance(Duration.ofMinutes(1));

        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Object> outcomes = Collections.synchronizedList(new ArrayList<>());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Long p : List.of(parentId, otherParentId)) {
                futures.add(pool.submit(() -> {
                    go.await();
                    try {
                        outcomes.add(pairingService.pair("482913", p));
                    } catch (ApiException e) {
                        outcomes.add(e.code());
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(outcomes).hasSize(2);
        assertThat(outcomes).filteredOn(o -> o instanceof PairResponse).hasSize(1);
        assertThat(outcomes).contains(ApiErrorCode.CODE_NOT_FOUND);
        assertThat(relationships.findByChildUserIdAndActiveTrueOrderByCreatedAtAsc(childId)).hasSize(1);
    }

    @Test
    void unlink_should_notify_other_party_and_allow_fresh_pairing() {
        codeService.generate(childId, "Mia", "Mia's iPhone");
        Long relId = pairingService.pair("482913", parentId).relationshipId();

        clock.advance(Duration.ofMinutes(30));
        assertThat(pairingService.unpair(relId, parentId).alreadyUnlinked()).isFalse();
        assertThat(pairingService.unpair(relId, parentId).alreadyUnlinked()).isTrue();

        User child = users.findById(childId).orElseThrow();
        assertThat(child.isDevicePaired()).isFalse();

        List<NotificationEntity> inbox = notifications.findByRecipientIdOrderByCreatedAtDesc(childId, PageRequest.of(0, 10));
        assertThat(inbox).hasSize(1);
        assertThat(inbox.get(0).getType()).isEqualTo(NotificationType.DEVICE_UNLINKED);
        assertThat(inbox.get(0).getData().get("unlinkedBy").asLong()).isEqualTo(parentId);

        // the old row stays inactive; a new code links again
        when(generator.next()).thenReturn("765432");
        codeService.generate(childId, "Mia", "Mia's iPhone");
        Long again = pairingService.pair("765432", parentId).relationshipId();

        assertThat(again).isNotEqualTo(relId);
        assertThat(relationships.findById(relId).orElseThrow().isActive()).isFalse();
    }
}
