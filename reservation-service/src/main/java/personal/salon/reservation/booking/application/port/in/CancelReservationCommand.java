package personal.salon.reservation.booking.application.port.in;

import java.util.UUID;

/**
 * Cancel Reservation Command
 */
public record CancelReservationCommand(
        UUID reservationId,
        String reason,
        String actor
) {
}
