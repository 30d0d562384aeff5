package personal.salon.reservation.booking.domain.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Booking State
 * 부킹 상태와 상태별 데이터
 */
public sealed interface BookingState {

    BookingStatus status();

    record Draft() implements BookingState {
        @Override
        public BookingStatus status() {
            return BookingStatus.DRAFT;
        }
    }

    record Confirmed(LocalDateTime confirmedAt, String confirmedBy) implements BookingState {
        public Confirmed {
            Objects.requireNonNull(confirmedAt, "Confirmed time cannot be null");
        }

        @Override
        public BookingStatus status() {
            return BookingStatus.CONFIRMED;
        }
    }

    record Cancelled(LocalDateTime cancelledAt, String cancelledBy, String reason) implements BookingState {
        public Cancelled {
            Objects.requireNonNull(cancelledAt, "Cancelled time cannot be null");
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("Cancellation reason cannot be blank");
            }
        }

        @Override
        public BookingStatus status() {
            return BookingStatus.CANCELLED;
        }
    }

    record Completed(LocalDateTime completedAt, String completedBy) implements BookingState {
        public Completed {
            Objects.requireNonNull(completedAt, "Completed time cannot be null");
        }

        @Override
        public BookingStatus status() {
            return BookingStatus.COMPLETED;
        }
    }

    record NoShow(LocalDateTime markedAt, String markedBy) implements BookingState {
        public NoShow {
            Objects.requireNonNull(markedAt, "Marked time cannot be null");
        }

        @Override
        public BookingStatus status() {
            return BookingStatus.NO_SHOW;
        }
    }
}
