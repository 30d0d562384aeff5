package personal.salon.reservation.booking.application.port.in;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Create Reservation Command
 * 예약 생성 커맨드
 * endTime 이 없으면 시술 소요 시간으로, totalAmount 가 없으면 시술 가격으로 채운다.
 */
public record CreateReservationCommand(
        UUID salonId,
        UUID customerId,
        UUID staffId,
        UUID serviceId,
        LocalDateTime startTime,
        LocalDateTime endTime,
        String notes,
        Long totalAmount,
        Long depositAmount,
        String actor,
        boolean confirmImmediately
) {
}
