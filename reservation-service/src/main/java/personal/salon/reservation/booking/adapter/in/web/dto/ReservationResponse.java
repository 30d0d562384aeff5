package personal.salon.reservation.booking.adapter.in.web.dto;

import personal.salon.reservation.booking.domain.model.Reservation;
import personal.salon.reservation.booking.domain.model.ReservationState;
import personal.salon.reservation.booking.domain.model.ReservationStatus;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 예약 응답 DTO
 */
public record ReservationResponse(
        UUID id,
        UUID salonId,
        UUID customerId,
        UUID staffId,
        UUID serviceId,
        LocalDateTime startTime,
        LocalDateTime endTime,
        ReservationStatus status,
        String notes,
        long totalAmount,
        Long depositAmount,
        boolean paid,
        String cancellationReason,
        LocalDateTime createdAt,
        String createdBy,
        LocalDateTime updatedAt,
        String updatedBy
) {
    public static ReservationResponse from(Reservation reservation) {
        String reason = reservation.state() instanceof ReservationState.Cancelled cancelled
                ? cancelled.reason()
                : null;
        return new ReservationResponse(
                reservation.id(),
                reservation.salonId(),
                reservation.customerId(),
                reservation.staffId(),
                reservation.serviceId(),
                reservation.startTime(),
                reservation.endTime(),
                reservation.status(),
                reservation.notes(),
                reservation.totalAmount(),
                reservation.depositAmount(),
                reservation.paid(),
                reason,
                reservation.createdAt(),
                reservation.createdBy(),
                reservation.updatedAt(),
                reservation.updatedBy()
        );
    }
}
