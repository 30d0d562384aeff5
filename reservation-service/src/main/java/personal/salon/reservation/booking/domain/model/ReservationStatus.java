package personal.salon.reservation.booking.domain.model;

/**
 * Reservation Status Enum
 * 예약 상태 및 전이 규칙
 */
public enum ReservationStatus {
    /**
     * 확정 대기
     */
    PENDING,

    /**
     * 확정
     */
    CONFIRMED,

    /**
     * 취소 (종료 상태)
     */
    CANCELLED,

    /**
     * 시술 완료 (종료 상태)
     */
    COMPLETED,

    /**
     * 노쇼 (종료 상태)
     */
    NO_SHOW;

    /**
     * 전이 표 기준 허용 여부
     * 추가 조건(리드 타임, 종료 시각 등)은 Reservation 의 각 전이 메서드에서 검사
     */
    public boolean canTransitionTo(ReservationStatus target) {
        return switch (this) {
            case PENDING -> target == CONFIRMED || target == CANCELLED || target == NO_SHOW;
            case CONFIRMED -> target == COMPLETED || target == CANCELLED || target == NO_SHOW;
            case CANCELLED, COMPLETED, NO_SHOW -> false;
        };
    }

    public boolean isTerminal() {
        return this == CANCELLED || this == COMPLETED || this == NO_SHOW;
    }
}
