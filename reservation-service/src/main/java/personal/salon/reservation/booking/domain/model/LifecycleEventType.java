package personal.salon.reservation.booking.domain.model;

/**
 * Lifecycle Event Type
 * 외부로 발행되는 예약/부킹 변경 이벤트 종류
 */
public enum LifecycleEventType {
    RESERVATION_CREATED("reservation.created"),
    RESERVATION_UPDATED("reservation.updated"),
    RESERVATION_CONFIRMED("reservation.confirmed"),
    RESERVATION_CANCELLED("reservation.cancelled"),
    RESERVATION_COMPLETED("reservation.completed"),
    RESERVATION_NO_SHOW("reservation.no-show"),
    BOOKING_CREATED("booking.created"),
    BOOKING_UPDATED("booking.updated"),
    BOOKING_CONFIRMED("booking.confirmed"),
    BOOKING_CANCELLED("booking.cancelled"),
    BOOKING_COMPLETED("booking.completed"),
    BOOKING_NO_SHOW("booking.no-show"),
    BOOKING_PAYMENT_RECORDED("booking.payment-recorded");

    private final String topicSuffix;

    LifecycleEventType(String topicSuffix) {
        this.topicSuffix = topicSuffix;
    }

    public String getTopicSuffix() {
        return topicSuffix;
    }
}
