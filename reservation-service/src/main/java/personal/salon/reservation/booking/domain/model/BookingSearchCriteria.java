package personal.salon.reservation.booking.domain.model;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Booking Search Criteria
 * null 인 조건은 적용하지 않음. 금액 조건은 최종 금액 기준
 */
public record BookingSearchCriteria(
        UUID salonId,
        UUID customerId,
        BookingStatus status,
        LocalDateTime createdFrom,
        LocalDateTime createdTo,
        Long minAmount,
        Long maxAmount
) {
    public static BookingSearchCriteria all() {
        return new BookingSearchCriteria(null, null, null, null, null, null, null);
    }
}
