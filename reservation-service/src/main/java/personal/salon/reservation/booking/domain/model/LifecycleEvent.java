package personal.salon.reservation.booking.domain.model;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Lifecycle Event
 * 감사 추적용 이벤트 페이로드
 */
public record LifecycleEvent(
        UUID eventId,
        LifecycleEventType type,
        UUID aggregateId,
        UUID salonId,
        UUID customerId,
        String status,
        String actor,
        LocalDateTime occurredAt
) {
    public static LifecycleEvent of(LifecycleEventType type, Reservation reservation) {
        return new LifecycleEvent(UUID.randomUUID(), type, reservation.id(), reservation.salonId(),
                reservation.customerId(), reservation.status().name(), reservation.updatedBy(),
                reservation.updatedAt());
    }

    public static LifecycleEvent of(LifecycleEventType type, Booking booking) {
        return new LifecycleEvent(UUID.randomUUID(), type, booking.id(), booking.salonId(),
                booking.customerId(), booking.status().name(), booking.updatedBy(), booking.updatedAt());
    }
}
