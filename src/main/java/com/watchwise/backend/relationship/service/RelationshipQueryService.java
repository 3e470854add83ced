package com.watchwise.backend.relationship.service;

import com.watchwise.backend.heartbeat.config.HeartbeatProperties;
import com.watchwise.backend.relationship.dto.RelationshipDtos.ChildDeviceDto;
import com.watchwise.backend.relationship.dto.RelationshipDtos.DeviceStatus;
import com.watchwise.backend.relationship.dto.RelationshipDtos.LinkedParentDto;
import com.watchwise.backend.relationship.dto.RelationshipDtos.PairingStatusDto;
import com.watchwise.backend.relationship.entity.Relationship;
import com.watchwise.backend.relationship.repo.RelationshipRepo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/** Read side of the relationship store; liveness is derived here, never stored. */
@Service
@RequiredArgsConstructor
public class RelationshipQueryService {

    private final RelationshipRepo relationships;
    private final HeartbeatProperties heartbeatProps;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<ChildDeviceDto> listChildren(Long parentUserId) {
        Instant now = Instant.now(clock);
        return relationships.findByParentUserIdAndActiveTrueOrderByCreatedAtAsc(parentUserId)
                .stream()
                .map(r -> toChildDevice(r, now))
                .toList();
    }

    @Transactional(readOnly = true)
    public PairingStatusDto pairingStatus(Long childUserId) {
        List<LinkedParentDto> parents = relationships.findByChildUserIdAndActiveTrueOrderByCreatedAtAsc(childUserId)
                .stream()
                .map(r -> new LinkedParentDto(r.getId(), r.getParentUserId(), r.getCreatedAt()))
                .toList();
        return new PairingStatusDto(!parents.isEmpty(), parents);
    }

    ChildDeviceDto toChildDevice(Relationship r, Instant now) {
        return new ChildDeviceDto(
                r.getId(),
                r.getChildUserId(),
                r.getChildName(),
                r.getDeviceName(),
                r.getCreatedAt(),
                r.getLastSyncAt(),
                r.getLastHeartbeatAt(),
                r.getMissedHeartbeats(),
                r.isNormalClosure(),
                isOnline(r, now),
                status(r, now),
                r.getChildDeviceInfo()
        );
    }

    boolean isOnline(Relationship r, Instant now) {
        Instant sync = r.getLastSyncAt();
        return sync != null && !sync.isBefore(now.minus(heartbeatProps.getOnlineWindow()));
    }

    DeviceStatus status(Relationship r, Instant now) {
        Instant hb = r.getLastHeartbeatAt();
        if (hb == null || hb.isBefore(now.minus(heartbeatProps.getOfflineThreshold()))) {
            return DeviceStatus.OFFLINE;
        }
        return DeviceStatus.ONLINE;
    }
}
