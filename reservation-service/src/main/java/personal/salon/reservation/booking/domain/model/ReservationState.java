package personal.salon.reservation.booking.domain.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Reservation State
 * 상태와 상태별 데이터를 함께 묶은 닫힌 타입
 * 취소 상태가 아닌 예약은 취소 사유를 가질 수 없다.
 */
public sealed interface ReservationState {

    ReservationStatus status();

    static ReservationState pending() {
        return new Pending();
    }

    record Pending() implements ReservationState {
        @Override
        public ReservationStatus status() {
            return ReservationStatus.PENDING;
        }
    }

    record Confirmed(LocalDateTime confirmedAt, String confirmedBy) implements ReservationState {
        public Confirmed {
            Objects.requireNonNull(confirmedAt, "Confirmed time cannot be null");
        }

        @Override
        public ReservationStatus status() {
            return ReservationStatus.CONFIRMED;
        }
    }

    record Cancelled(LocalDateTime cancelledAt, String cancelledBy, String reason) implements ReservationState {
        public Cancelled {
            Objects.requireNonNull(cancelledAt, "Cancelled time cannot be null");
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("Cancellation reason cannot be blank");
            }
        }

        @Override
        public ReservationStatus status() {
            return ReservationStatus.CANCELLED;
        }
    }

    record Completed(LocalDateTime completedAt, String completedBy) implements ReservationState {
        public Completed {
            Objects.requireNonNull(completedAt, "Completed time cannot be null");
        }

        @Override
        public ReservationStatus status() {
            return ReservationStatus.COMPLETED;
        }
    }

    record NoShow(LocalDateTime markedAt, String markedBy) implements ReservationState {
        public NoShow {
            Objects.requireNonNull(markedAt, "Marked time cannot be null");
        }

        @Override
        public ReservationStatus status() {
            return ReservationStatus.NO_SHOW;
        }
    }
}
