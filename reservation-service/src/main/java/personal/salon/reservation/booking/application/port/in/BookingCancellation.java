package personal.salon.reservation.booking.application.port.in;

import personal.salon.reservation.booking.domain.model.Booking;

/**
 * Booking Cancellation
 * 취소된 부킹과 환불 계산 결과
 */
public record BookingCancellation(
        Booking booking,
        long paidAmount,
        long refundAmount,
        long cancellationFee
) {
}
