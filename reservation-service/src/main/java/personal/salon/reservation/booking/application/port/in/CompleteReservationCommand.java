package personal.salon.reservation.booking.application.port.in;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Complete Reservation Command
 *
 * @param actualEndTime 실제 종료 시각 (없으면 초과 요금 없음)
 */
public record CompleteReservationCommand(
        UUID reservationId,
        LocalDateTime actualEndTime,
        String actor
) {
}
