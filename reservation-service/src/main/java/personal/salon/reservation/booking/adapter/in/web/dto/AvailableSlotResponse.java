package personal.salon.reservation.booking.adapter.in.web.dto;

import personal.salon.reservation.booking.domain.model.AvailableSlot;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 예약 가능 슬롯 응답 DTO
 */
public record AvailableSlotResponse(
        UUID staffId,
        LocalDateTime startTime,
        LocalDateTime endTime
) {
    public static AvailableSlotResponse from(AvailableSlot slot) {
        return new AvailableSlotResponse(slot.staffId(), slot.startTime(), slot.endTime());
    }
}
