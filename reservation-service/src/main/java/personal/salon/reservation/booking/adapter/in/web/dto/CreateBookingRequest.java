package personal.salon.reservation.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Size;
import personal.salon.reservation.booking.application.port.in.CreateBookingCommand;
import personal.salon.reservation.booking.domain.model.PaymentMethod;

import java.util.List;
import java.util.UUID;

/**
 * 부킹 생성 요청 DTO
 */
public record CreateBookingRequest(
        UUID salonId,
        UUID customerId,
        List<UUID> reservationIds,
        long totalAmount,
        Long discountAmount,
        PaymentMethod paymentMethod,
        @Size(max = 1000, message = "메모는 1000자를 넘을 수 없습니다")
        String notes
) {
    public CreateBookingCommand toCommand(String actor) {
        return new CreateBookingCommand(salonId, customerId, reservationIds, totalAmount, discountAmount,
                paymentMethod, notes, actor);
    }
}
