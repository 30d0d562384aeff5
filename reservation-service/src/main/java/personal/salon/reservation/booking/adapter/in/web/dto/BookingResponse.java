package personal.salon.reservation.booking.adapter.in.web.dto;

import personal.salon.reservation.booking.domain.model.Booking;
import personal.salon.reservation.booking.domain.model.BookingState;
import personal.salon.reservation.booking.domain.model.BookingStatus;
import personal.salon.reservation.booking.domain.model.PaymentMethod;
import personal.salon.reservation.booking.domain.model.PaymentStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * 부킹 응답 DTO
 */
public record BookingResponse(
        UUID id,
        UUID salonId,
        UUID customerId,
        List<UUID> reservationIds,
        long totalAmount,
        Long discountAmount,
        long finalAmount,
        PaymentMethod paymentMethod,
        PaymentStatus paymentStatus,
        BookingStatus status,
        String notes,
        String cancellationReason,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static BookingResponse from(Booking booking) {
        String reason = booking.state() instanceof BookingState.Cancelled cancelled ? cancelled.reason() : null;
        return new BookingResponse(
                booking.id(),
                booking.salonId(),
                booking.customerId(),
                booking.reservationIds(),
                booking.totalAmount(),
                booking.discountAmount(),
                booking.finalAmount(),
                booking.paymentMethod(),
                booking.paymentStatus(),
                booking.status(),
                booking.notes(),
                reason,
                booking.createdAt(),
                booking.updatedAt()
        );
    }
}
