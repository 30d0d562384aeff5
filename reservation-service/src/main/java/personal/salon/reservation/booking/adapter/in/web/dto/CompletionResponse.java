package personal.salon.reservation.booking.adapter.in.web.dto;

import personal.salon.reservation.booking.application.port.in.CompletionOutcome;

/**
 * 시술 완료 응답 DTO
 */
public record CompletionResponse(
        ReservationResponse reservation,
        long overtimeCharge
) {
    public static CompletionResponse from(CompletionOutcome outcome) {
        return new CompletionResponse(ReservationResponse.from(outcome.reservation()), outcome.overtimeCharge());
    }
}
