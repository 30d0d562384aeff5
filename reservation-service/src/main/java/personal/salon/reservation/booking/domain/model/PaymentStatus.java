package personal.salon.reservation.booking.domain.model;

/**
 * Payment Status Enum
 */
public enum PaymentStatus {
    PENDING,
    PAID,
    REFUNDED,
    FAILED
}
