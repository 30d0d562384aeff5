package personal.salon.reservation.booking.domain.model;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Reservation Search Criteria
 * null 인 조건은 적용하지 않음
 */
public record ReservationSearchCriteria(
        UUID salonId,
        UUID customerId,
        UUID staffId,
        ReservationStatus status,
        LocalDateTime startFrom,
        LocalDateTime startTo
) {
    public static ReservationSearchCriteria all() {
        return new ReservationSearchCriteria(null, null, null, null, null, null);
    }
}
