package personal.salon.reservation.booking.domain.model;

/**
 * Booking Status Enum
 * 부킹(결제 단위) 상태
 */
public enum BookingStatus {
    DRAFT,
    CONFIRMED,
    CANCELLED,
    COMPLETED,
    NO_SHOW;

    public boolean canTransitionTo(BookingStatus target) {
        return switch (this) {
            case DRAFT -> target == CONFIRMED || target == CANCELLED;
            case CONFIRMED -> target == COMPLETED || target == CANCELLED || target == NO_SHOW;
            case CANCELLED, COMPLETED, NO_SHOW -> false;
        };
    }

    public boolean isTerminal() {
        return this == CANCELLED || this == COMPLETED || this == NO_SHOW;
    }
}
