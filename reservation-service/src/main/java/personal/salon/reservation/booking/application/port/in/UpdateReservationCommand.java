package personal.salon.reservation.booking.application.port.in;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Update Reservation Command
 * null 인 항목은 변경하지 않는다. 시간 변경 시 startTime, endTime 을 함께 보내야 한다.
 */
public record UpdateReservationCommand(
        UUID reservationId,
        UUID staffId,
        UUID serviceId,
        LocalDateTime startTime,
        LocalDateTime endTime,
        String notes,
        Long totalAmount,
        Long depositAmount,
        String actor
) {
    public boolean changesTime() {
        return startTime != null || endTime != null;
    }
}
