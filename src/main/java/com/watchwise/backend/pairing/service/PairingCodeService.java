package com.watchwise.backend.pairing.service;

import com.watchwise.backend.common.persistence.AfterCommit;
import com.watchwise.backend.pairing.config.PairingProperties;
import com.watchwise.backend.pairing.dto.GenerateCodeResponse;
import com.watchwise.backend.pairing.entity.PairingCode;
import com.watchwise.backend.pairing.repo.PairingCodeRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class PairingCodeService {

    private final PairingCodeRepo codes;
    private final PairingCodeGenerator generator;
    private final PairingCodeExpiryScheduler expiryScheduler;
    private final PairingProperties props;
    private final Clock clock;

    /**
     * Issues a code for the calling child device. Uniqueness against other live codes is
     * attempted, not guaranteed: after the configured attempts the last candidate is used.
     */
    @Transactional
    public GenerateCodeResponse generate(Long childUserId, String childName, String deviceName) {
        final Instant now = Instant.now(clock);

        codes.retireUnconsumedForChild(childUserId, now);

        String code = generator.next();
        int attempts = Math.max(1, props.getGenerationAttempts());
        for (int i = 1; i < attempts && codes.countLive(code, now) > 0; i++) {
            code = generator.next();
        }

        PairingCode pc = new PairingCode();
        pc.setCode(code);
        pc.setChildUserId(childUserId);
        pc.setChildName(childName.trim());
        pc.setDeviceName(deviceName.trim());
        pc.setCreatedAt(now);
        pc.setExpiresAt(now.plus(props.getCodeTtl()));
        pc.setActive(false);
        pc.setExpired(false);
        PairingCode saved = codes.save(pc);

        // schedule only once the row is visible to the expiry task
        AfterCommit.run(() -> expiryScheduler.schedule(saved.getId(), saved.getExpiresAt()));

        log.info("pairing code issued. codeId={} childId={} expiresAt={}",
                saved.getId(), childUserId, saved.getExpiresAt());
        return new GenerateCodeResponse(saved.getCode(), saved.getExpiresAt());
    }
}
