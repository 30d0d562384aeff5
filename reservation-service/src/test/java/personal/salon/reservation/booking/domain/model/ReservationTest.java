package personal.salon.reservation.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.Result;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Reservation 도메인 모델 테스트")
class ReservationTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 30, 9, 0);
    private static final LocalDateTime START = LocalDateTime.of(2024, 6, 1, 10, 0);
    private static final LocalDateTime END = LocalDateTime.of(2024, 6, 1, 11, 0);
    private static final Duration LEAD_TIME = Duration.ofHours(1);
    private static final String ACTOR = "staff-1";

    private static Reservation pending() {
        return Reservation.create(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                UUID.randomUUID(), new TimeRange(START, END), "cut", 5000L, 1000L, "customer-1", NOW, false);
    }

    private static Reservation confirmed() {
        return pending().confirm(ACTOR, NOW).value();
    }

    @Nested
    @DisplayName("생성")
    class Create {

        @Test
        @DisplayName("기본 생성 시 PENDING 상태이며 결제 전이다")
        void create_Pending() {
            // when
            Reservation reservation = pending();

            // then
            assertThat(reservation.status()).isEqualTo(ReservationStatus.PENDING);
            assertThat(reservation.paid()).isFalse();
            assertThat(reservation.createdAt()).isEqualTo(NOW);
            assertThat(reservation.createdBy()).isEqualTo("customer-1");
        }

        @Test
        @DisplayName("즉시 확정 옵션이면 CONFIRMED 상태로 생성된다")
        void create_ConfirmImmediately() {
            // when
            Reservation reservation = Reservation.create(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                    UUID.randomUUID(), UUID.randomUUID(), new TimeRange(START, END), null, 5000L, null,
                    ACTOR, NOW, true);

            // then
            assertThat(reservation.status()).isEqualTo(ReservationStatus.CONFIRMED);
            assertThat(reservation.state()).isEqualTo(new ReservationState.Confirmed(NOW, ACTOR));
        }

        @Test
        @DisplayName("시작 시각이 종료 시각보다 늦으면 생성할 수 없다")
        void create_InvalidRange() {
            assertThatThrownBy(() -> new TimeRange(END, START))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("예약금이 총액을 넘으면 생성할 수 없다")
        void create_DepositExceedsTotal() {
            assertThatThrownBy(() -> Reservation.create(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                    UUID.randomUUID(), UUID.randomUUID(), new TimeRange(START, END), null, 5000L, 6000L,
                    ACTOR, NOW, false))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("확정")
    class Confirm {

        @Test
        @DisplayName("PENDING 예약을 확정하면 확정 시각과 처리자가 기록된다")
        void confirm_Success() {
            // when
            Result<Reservation> result = pending().confirm(ACTOR, NOW);

            // then
            assertThat(result.isOk()).isTrue();
            assertThat(result.value().state()).isEqualTo(new ReservationState.Confirmed(NOW, ACTOR));
            assertThat(result.value().updatedBy()).isEqualTo(ACTOR);
        }

        @Test
        @DisplayName("이미 확정된 예약을 다시 확정하면 INVALID_STATUS")
        void confirm_Twice() {
            // when
            Result<Reservation> result = confirmed().confirm(ACTOR, NOW);

            // then
            assertThat(result.isErr()).isTrue();
            assertThat(result.error().code()).isEqualTo(ErrorCode.INVALID_STATUS);
        }
    }

    @Nested
    @DisplayName("취소")
    class Cancel {

        @Test
        @DisplayName("마감 전 취소는 사유와 함께 CANCELLED 로 전이한다")
        void cancel_Success() {
            // when
            Result<Reservation> result = confirmed().cancel(ACTOR, "schedule conflict", NOW, LEAD_TIME);

            // then
            assertThat(result.isOk()).isTrue();
            assertThat(result.value().state())
                    .isEqualTo(new ReservationState.Cancelled(NOW, ACTOR, "schedule conflict"));
        }

        @Test
        @DisplayName("사유가 비어 있으면 INVALID_REQUEST")
        void cancel_BlankReason() {
            // when
            Result<Reservation> result = confirmed().cancel(ACTOR, "  ", NOW, LEAD_TIME);

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.INVALID_REQUEST);
        }

        @Test
        @DisplayName("시작 30분 전 취소는 CANNOT_CANCEL")
        void cancel_TooLate() {
            // given
            LocalDateTime thirtyMinutesBefore = START.minusMinutes(30);

            // when
            Result<Reservation> result = confirmed().cancel(ACTOR, "late", thirtyMinutesBefore, LEAD_TIME);

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.CANNOT_CANCEL);
        }

        @Test
        @DisplayName("정확히 마감 시각에 취소하면 CANNOT_CANCEL")
        void cancel_ExactlyAtLeadTime() {
            // when
            Result<Reservation> result = confirmed().cancel(ACTOR, "late", START.minus(LEAD_TIME), LEAD_TIME);

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.CANNOT_CANCEL);
        }

        @Test
        @DisplayName("이미 취소된 예약을 다시 취소하면 CANNOT_CANCEL")
        void cancel_Twice() {
            // given
            Reservation cancelled = confirmed().cancel(ACTOR, "first", NOW, LEAD_TIME).value();

            // when
            Result<Reservation> result = cancelled.cancel(ACTOR, "second", NOW, LEAD_TIME);

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.CANNOT_CANCEL);
        }
    }

    @Nested
    @DisplayName("완료 / 노쇼")
    class CompleteAndNoShow {

        @Test
        @DisplayName("CONFIRMED 예약은 완료할 수 있다")
        void complete_Success() {
            // when
            Result<Reservation> result = confirmed().complete(ACTOR, END);

            // then
            assertThat(result.value().status()).isEqualTo(ReservationStatus.COMPLETED);
        }

        @Test
        @DisplayName("PENDING 예약은 완료할 수 없다")
        void complete_FromPending() {
            // when
            Result<Reservation> result = pending().complete(ACTOR, END);

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.INVALID_STATUS);
        }

        @Test
        @DisplayName("종료 시각 이후에만 노쇼 처리할 수 있다")
        void noShow_AfterEnd() {
            // when
            Result<Reservation> early = confirmed().markAsNoShow(ACTOR, END.minusMinutes(1));
            Result<Reservation> onTime = confirmed().markAsNoShow(ACTOR, END);

            // then
            assertThat(early.error().code()).isEqualTo(ErrorCode.INVALID_STATUS);
            assertThat(onTime.value().state()).isEqualTo(new ReservationState.NoShow(END, ACTOR));
        }
    }

    @ParameterizedTest(name = "{0} 상태에서는 어떤 전이도 성공하지 않는다")
    @EnumSource(value = ReservationStatus.class, names = {"CANCELLED", "COMPLETED", "NO_SHOW"})
    @DisplayName("종료 상태는 다시 바뀌지 않는다")
    void terminalStates_NeverTransition(ReservationStatus terminal) {
        // given
        Reservation reservation = switch (terminal) {
            case CANCELLED -> confirmed().cancel(ACTOR, "reason", NOW, LEAD_TIME).value();
            case COMPLETED -> confirmed().complete(ACTOR, END).value();
            case NO_SHOW -> confirmed().markAsNoShow(ACTOR, END).value();
            default -> throw new IllegalArgumentException(terminal.name());
        };
        LocalDateTime later = END.plusHours(1);

        // when & then
        assertThat(reservation.isTerminal()).isTrue();
        assertThat(reservation.confirm(ACTOR, later).isErr()).isTrue();
        assertThat(reservation.cancel(ACTOR, "again", NOW, LEAD_TIME).isErr()).isTrue();
        assertThat(reservation.complete(ACTOR, later).isErr()).isTrue();
        assertThat(reservation.markAsNoShow(ACTOR, later).isErr()).isTrue();
        assertThat(reservation.checkModifiable(NOW, Duration.ZERO).error().code()).isEqualTo(ErrorCode.CANNOT_MODIFY);
        assertThat(reservation.status()).isEqualTo(terminal);
    }

    @Nested
    @DisplayName("변경")
    class Modify {

        @Test
        @DisplayName("변경하지 않은 항목과 상태는 유지된다")
        void modify_KeepsUnchangedFields() {
            // given
            Reservation original = confirmed();
            TimeRange moved = new TimeRange(START.plusHours(2), END.plusHours(2));
            ReservationChanges changes = new ReservationChanges(null, null, moved, "color", null, null);

            // when
            Result<Reservation> result = original.modify(changes, ACTOR, NOW, Duration.ZERO);

            // then
            Reservation modified = result.value();
            assertThat(modified.timeRange()).isEqualTo(moved);
            assertThat(modified.notes()).isEqualTo("color");
            assertThat(modified.staffId()).isEqualTo(original.staffId());
            assertThat(modified.totalAmount()).isEqualTo(original.totalAmount());
            assertThat(modified.state()).isEqualTo(original.state());
            assertThat(changes.reschedules()).isTrue();
        }

        @Test
        @DisplayName("총액을 예약금보다 낮게 바꾸면 INVALID_AMOUNT")
        void modify_DepositAboveNewTotal() {
            // given
            ReservationChanges changes = new ReservationChanges(null, null, null, null, 500L, null);

            // when
            Result<Reservation> result = pending().modify(changes, ACTOR, NOW, Duration.ZERO);

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.INVALID_AMOUNT);
            assertThat(changes.reschedules()).isFalse();
        }

        @Test
        @DisplayName("이미 시작한 예약은 변경할 수 없다")
        void modify_AfterStart() {
            // when
            Result<Reservation> result = pending().checkModifiable(START, Duration.ZERO);

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.CANNOT_MODIFY);
        }
    }

    @Test
    @DisplayName("지불 금액은 결제 완료면 총액, 아니면 예약금")
    void paidAmount() {
        // given
        Reservation unpaid = pending();
        Reservation paid = new Reservation(unpaid.id(), unpaid.salonId(), unpaid.customerId(), unpaid.staffId(),
                unpaid.serviceId(), START, END, null, 5000L, 1000L, true, unpaid.state(),
                NOW, ACTOR, NOW, ACTOR, null);

        // then
        assertThat(unpaid.paidAmount()).isEqualTo(1000L);
        assertThat(paid.paidAmount()).isEqualTo(5000L);
    }

    @Test
    @DisplayName("상태 전이표")
    void transitionTable() {
        assertThat(ReservationStatus.PENDING.canTransitionTo(ReservationStatus.CONFIRMED)).isTrue();
        assertThat(ReservationStatus.PENDING.canTransitionTo(ReservationStatus.COMPLETED)).isFalse();
        assertThat(ReservationStatus.CONFIRMED.canTransitionTo(ReservationStatus.COMPLETED)).isTrue();
        assertThat(ReservationStatus.CONFIRMED.canTransitionTo(ReservationStatus.PENDING)).isFalse();
        assertThat(ReservationStatus.CANCELLED.canTransitionTo(ReservationStatus.CONFIRMED)).isFalse();
    }

    @Test
    @DisplayName("취소 상태에는 사유가 반드시 있어야 한다")
    void cancelledState_RequiresReason() {
        assertThatThrownBy(() -> new ReservationState.Cancelled(NOW, ACTOR, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
