package personal.salon.reservation.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/**
 * 부킹 예약 추가 요청 DTO
 */
public record AddBookingReservationRequest(
        @NotNull(message = "예약 ID는 필수입니다")
        UUID reservationId
) {
}
