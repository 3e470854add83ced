package com.watchwise.backend.restriction.entity;

import com.watchwise.backend.common.persistence.DayOfWeekSetConverter;
import com.watchwise.backend.common.persistence.LocalTimeStringConverter;
import jakarta.persistence.*;
import lombok.Data;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Set;

@Data
@Entity
@Table(
        name = "bedtime_settings",
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_bedtime_settings_user", columnNames = {"user_id"})
        }
)
public class BedtimeSettings {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** parent who owns the schedule */
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "is_enabled", nullable = false)
    private boolean enabled = false;

    @Convert(converter = LocalTimeStringConverter.class)
    @Column(name = "start_time", nullable = false, length = 5)
    private LocalTime startTime;

    @Convert(converter = LocalTimeStringConverter.class)
    @Column(name = "end_time", nullable = false, length = 5)
    private LocalTime endTime;

    @Convert(converter = DayOfWeekSetConverter.class)
    @Column(name = "enabled_days", nullable = false, length = 20)
    private Set<DayOfWeek> enabledDays = EnumSet.noneOf(DayOfWeek.class);

    /** zone the HH:mm times are read in */
    @Column(name = "timezone", nullable = false, length = 64)
    private String timezone;

    /** last state pushed to the devices by the bedtime check */
    @Column(name = "bedtime_active", nullable = false)
    private boolean bedtimeActive = false;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
