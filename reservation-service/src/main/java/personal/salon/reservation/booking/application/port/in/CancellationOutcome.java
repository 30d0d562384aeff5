package personal.salon.reservation.booking.application.port.in;

import personal.salon.reservation.booking.domain.model.Reservation;

/**
 * Cancellation Outcome
 * 취소된 예약과 환불/수수료 계산 결과
 */
public record CancellationOutcome(
        Reservation reservation,
        long paidAmount,
        long refundAmount,
        long cancellationFee
) {
}
