package personal.salon.reservation.booking.application.port.in;

import personal.salon.reservation.booking.domain.model.PaymentMethod;

import java.util.List;
import java.util.UUID;

/**
 * Create Booking Command
 */
public record CreateBookingCommand(
        UUID salonId,
        UUID customerId,
        List<UUID> reservationIds,
        long totalAmount,
        Long discountAmount,
        PaymentMethod paymentMethod,
        String notes,
        String actor
) {
}
