package personal.salon.reservation.booking.domain.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Service Offering
 * 시술 메뉴 (소요 시간, 가격, 분당 초과 요금)
 */
public record ServiceOffering(
        UUID id,
        UUID salonId,
        String name,
        int durationMinutes,
        long price,
        long overtimeRatePerMinute
) {
    public ServiceOffering {
        Objects.requireNonNull(id, "Service ID cannot be null");
        if (durationMinutes <= 0) {
            throw new IllegalArgumentException("Service duration must be positive: " + durationMinutes);
        }
        if (price < 0 || overtimeRatePerMinute < 0) {
            throw new IllegalArgumentException("Service price and overtime rate cannot be negative");
        }
    }
}
