package personal.salon.reservation.booking.adapter.in.web.dto;

import personal.salon.reservation.booking.application.port.in.CancellationOutcome;

/**
 * 예약 취소 응답 DTO
 */
public record CancellationResponse(
        ReservationResponse reservation,
        long paidAmount,
        long refundAmount,
        long cancellationFee
) {
    public static CancellationResponse from(CancellationOutcome outcome) {
        return new CancellationResponse(
                ReservationResponse.from(outcome.reservation()),
                outcome.paidAmount(),
                outcome.refundAmount(),
                outcome.cancellationFee());
    }
}
