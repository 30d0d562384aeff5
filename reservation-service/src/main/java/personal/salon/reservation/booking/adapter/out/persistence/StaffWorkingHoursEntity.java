package personal.salon.reservation.booking.adapter.out.persistence;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.salon.reservation.booking.domain.model.TimeWindow;
import personal.salon.reservation.booking.domain.model.WorkingHours;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Staff Working Hours JPA Entity
 * 직원 요일별 근무 시간과 휴게 시간
 */
@Entity
@Table(name = "staff_working_hours",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_staff_day",
                columnNames = {"staff_id", "day_of_week"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StaffWorkingHoursEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "staff_id", nullable = false)
    private UUID staffId;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, length = 10)
    private DayOfWeek dayOfWeek;

    @Column(name = "open_time", nullable = false)
    private LocalTime openTime;

    @Column(name = "close_time", nullable = false)
    private LocalTime closeTime;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "staff_break_windows", joinColumns = @JoinColumn(name = "working_hours_id"))
    @AttributeOverrides({
            @AttributeOverride(name = "startTime", column = @Column(name = "break_start", nullable = false)),
            @AttributeOverride(name = "endTime", column = @Column(name = "break_end", nullable = false))
    })
    private List<BreakWindow> breaks = new ArrayList<>();

    public static StaffWorkingHoursEntity of(UUID staffId, DayOfWeek dayOfWeek, WorkingHours workingHours) {
        StaffWorkingHoursEntity entity = new StaffWorkingHoursEntity();
        entity.staffId = staffId;
        entity.dayOfWeek = dayOfWeek;
        entity.openTime = workingHours.open();
        entity.closeTime = workingHours.close();
        entity.breaks = new ArrayList<>(workingHours.breaks().stream()
                .map(window -> new BreakWindow(window.start(), window.end()))
                .toList());
        return entity;
    }

    public WorkingHours toDomain() {
        List<TimeWindow> windows = breaks.stream()
                .map(window -> new TimeWindow(window.getStartTime(), window.getEndTime()))
                .toList();
        return new WorkingHours(openTime, closeTime, windows);
    }

    @Embeddable
    @Getter
    @NoArgsConstructor(access = AccessLevel.PROTECTED)
    public static class BreakWindow {

        private LocalTime startTime;

        private LocalTime endTime;

        BreakWindow(LocalTime startTime, LocalTime endTime) {
            this.startTime = startTime;
            this.endTime = endTime;
        }
    }
}
