package personal.salon.reservation.booking.domain.model;

/**
 * Booking Changes
 * 부킹 변경 요청 값 (null 인 항목은 변경하지 않음)
 */
public record BookingChanges(
        String notes,
        Long discountAmount,
        PaymentMethod paymentMethod
) {
}
