package personal.salon.reservation.booking.domain.model;

import java.util.UUID;

/**
 * Reservation Changes
 * 예약 변경 요청 값 (null 인 항목은 변경하지 않음)
 */
public record ReservationChanges(
        UUID staffId,
        UUID serviceId,
        TimeRange timeRange,
        String notes,
        Long totalAmount,
        Long depositAmount
) {
    public boolean reschedules() {
        return staffId != null || timeRange != null;
    }
}
