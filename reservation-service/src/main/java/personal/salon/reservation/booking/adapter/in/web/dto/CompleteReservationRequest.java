package personal.salon.reservation.booking.adapter.in.web.dto;

import java.time.LocalDateTime;

/**
 * 시술 완료 요청 DTO
 *
 * @param actualEndTime 실제 종료 시각 (선택)
 */
public record CompleteReservationRequest(
        LocalDateTime actualEndTime
) {
}
