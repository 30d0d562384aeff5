package personal.salon.reservation.booking.application.port.in;

import personal.salon.reservation.booking.domain.model.Reservation;

/**
 * Completion Outcome
 */
public record CompletionOutcome(
        Reservation reservation,
        long overtimeCharge
) {
}
