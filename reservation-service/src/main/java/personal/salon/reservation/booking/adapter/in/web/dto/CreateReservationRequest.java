package personal.salon.reservation.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Size;
import personal.salon.reservation.booking.application.port.in.CreateReservationCommand;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 예약 생성 요청 DTO
 * 식별자/시간/금액 검증은 유스케이스에서 수행한다.
 */
public record CreateReservationRequest(
        UUID salonId,
        UUID customerId,
        UUID staffId,
        UUID serviceId,
        LocalDateTime startTime,
        LocalDateTime endTime,
        @Size(max = 1000, message = "메모는 1000자를 넘을 수 없습니다")
        String notes,
        Long totalAmount,
        Long depositAmount,
        boolean confirmImmediately
) {
    public CreateReservationCommand toCommand(String actor) {
        return new CreateReservationCommand(salonId, customerId, staffId, serviceId, startTime, endTime,
                notes, totalAmount, depositAmount, actor, confirmImmediately);
    }
}
