package personal.salon.reservation.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Size;
import personal.salon.reservation.booking.application.port.in.UpdateBookingCommand;
import personal.salon.reservation.booking.domain.model.PaymentMethod;

import java.util.UUID;

/**
 * 부킹 변경 요청 DTO (부분 변경)
 */
public record UpdateBookingRequest(
        @Size(max = 1000, message = "메모는 1000자를 넘을 수 없습니다")
        String notes,
        Long discountAmount,
        PaymentMethod paymentMethod
) {
    public UpdateBookingCommand toCommand(UUID bookingId, String actor) {
        return new UpdateBookingCommand(bookingId, notes, discountAmount, paymentMethod, actor);
    }
}
