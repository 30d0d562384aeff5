package personal.salon.reservation.booking.application.port.in;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Find Available Slots Query
 */
public record FindAvailableSlotsQuery(
        UUID staffId,
        LocalDate date,
        UUID serviceId
) {
}
