package personal.salon.reservation.booking.adapter.in.web.dto;

import java.time.LocalDate;
import java.util.UUID;

/**
 * 날짜별 예약 수 응답 DTO
 */
public record ReservationCountResponse(
        LocalDate date,
        UUID salonId,
        long count
) {
}
