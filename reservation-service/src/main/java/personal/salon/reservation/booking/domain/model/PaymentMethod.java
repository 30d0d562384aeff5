package personal.salon.reservation.booking.domain.model;

/**
 * Payment Method Enum
 */
public enum PaymentMethod {
    CASH,
    CREDIT_CARD,
    BANK_TRANSFER,
    E_MONEY,
    OTHER
}
