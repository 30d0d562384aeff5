package personal.salon.reservation.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Size;
import personal.salon.reservation.booking.application.port.in.UpdateReservationCommand;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 예약 변경 요청 DTO (부분 변경)
 */
public record UpdateReservationRequest(
        UUID staffId,
        UUID serviceId,
        LocalDateTime startTime,
        LocalDateTime endTime,
        @Size(max = 1000, message = "메모는 1000자를 넘을 수 없습니다")
        String notes,
        Long totalAmount,
        Long depositAmount
) {
    public UpdateReservationCommand toCommand(UUID reservationId, String actor) {
        return new UpdateReservationCommand(reservationId, staffId, serviceId, startTime, endTime,
                notes, totalAmount, depositAmount, actor);
    }
}
