package personal.salon.reservation.booking.adapter.in.web.dto;

import personal.salon.reservation.booking.application.port.in.BookingCancellation;

/**
 * 부킹 취소 응답 DTO
 */
public record BookingCancellationResponse(
        BookingResponse booking,
        long paidAmount,
        long refundAmount,
        long cancellationFee
) {
    public static BookingCancellationResponse from(BookingCancellation cancellation) {
        return new BookingCancellationResponse(
                BookingResponse.from(cancellation.booking()),
                cancellation.paidAmount(),
                cancellation.refundAmount(),
                cancellation.cancellationFee());
    }
}
