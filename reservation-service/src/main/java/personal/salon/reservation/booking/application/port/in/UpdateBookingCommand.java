package personal.salon.reservation.booking.application.port.in;

import personal.salon.reservation.booking.domain.model.BookingChanges;
import personal.salon.reservation.booking.domain.model.PaymentMethod;

import java.util.UUID;

/**
 * Update Booking Command
 * null 인 항목은 변경하지 않는다.
 */
public record UpdateBookingCommand(
        UUID bookingId,
        String notes,
        Long discountAmount,
        PaymentMethod paymentMethod,
        String actor
) {
    public BookingChanges toChanges() {
        return new BookingChanges(notes, discountAmount, paymentMethod);
    }
}
