package personal.salon.reservation.booking.domain.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Time Range
 * 반열림 구간 [start, end)
 */
public record TimeRange(LocalDateTime start, LocalDateTime end) {

    public TimeRange {
        Objects.requireNonNull(start, "Start time cannot be null");
        Objects.requireNonNull(end, "End time cannot be null");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Start time must be before end time: " + start + " >= " + end);
        }
    }

    /**
     * 끝점이 맞닿는 경우는 겹치지 않는다.
     */
    public boolean overlaps(TimeRange other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }
}
