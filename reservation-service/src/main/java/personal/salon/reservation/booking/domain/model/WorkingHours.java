package personal.salon.reservation.booking.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Objects;

/**
 * Working Hours
 * 직원의 하루 근무 시간과 휴게 시간
 */
public record WorkingHours(
        LocalTime open,
        LocalTime close,
        List<TimeWindow> breaks
) {
    public WorkingHours {
        Objects.requireNonNull(open, "Open time cannot be null");
        Objects.requireNonNull(close, "Close time cannot be null");
        if (!open.isBefore(close)) {
            throw new IllegalArgumentException("Open time must be before close time: " + open + " >= " + close);
        }
        breaks = breaks == null ? List.of() : List.copyOf(breaks);
    }

    public static WorkingHours of(LocalTime open, LocalTime close) {
        return new WorkingHours(open, close, List.of());
    }

    public TimeRange on(LocalDate date) {
        return new TimeRange(date.atTime(open), date.atTime(close));
    }

    public List<TimeRange> breaksOn(LocalDate date) {
        return breaks.stream()
                .map(window -> window.on(date))
                .toList();
    }
}
