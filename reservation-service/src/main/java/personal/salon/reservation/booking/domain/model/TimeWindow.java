package personal.salon.reservation.booking.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Time Window
 * 하루 안의 시각 구간 (영업 시간, 휴게 시간)
 */
public record TimeWindow(LocalTime start, LocalTime end) {

    public TimeWindow {
        Objects.requireNonNull(start, "Window start cannot be null");
        Objects.requireNonNull(end, "Window end cannot be null");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Window start must be before end: " + start + " >= " + end);
        }
    }

    public TimeRange on(LocalDate date) {
        return new TimeRange(date.atTime(start), date.atTime(end));
    }
}
