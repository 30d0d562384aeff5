package personal.salon.reservation.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Size;

/**
 * 취소 요청 DTO (예약, 부킹 공용)
 */
public record CancelRequest(
        @Size(max = 500, message = "취소 사유는 500자를 넘을 수 없습니다")
        String reason
) {
}
