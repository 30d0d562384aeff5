package personal.salon.reservation.booking.domain.model;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Available Slot
 * 조회 시마다 새로 계산되는 예약 가능 구간 (저장하지 않음)
 */
public record AvailableSlot(
        UUID staffId,
        LocalDateTime startTime,
        LocalDateTime endTime
) {
}
