package personal.salon.reservation.booking.domain.model;

import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.DomainError;
import personal.salon.common.result.FieldError;
import personal.salon.common.result.Result;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Booking Domain Model
 * 하나 이상의 예약을 묶은 결제 단위 (불변)
 */
public record Booking(
        UUID id,
        UUID salonId,
        UUID customerId,
        List<UUID> reservationIds,
        long totalAmount,
        Long discountAmount,
        long finalAmount,
        PaymentMethod paymentMethod,
        PaymentStatus paymentStatus,
        String notes,
        BookingState state,
        LocalDateTime createdAt,
        String createdBy,
        LocalDateTime updatedAt,
        String updatedBy,
        Long version
) {
    public Booking {
        Objects.requireNonNull(id, "Booking ID cannot be null");
        Objects.requireNonNull(state, "Booking state cannot be null");
        Objects.requireNonNull(paymentStatus, "Payment status cannot be null");
        reservationIds = List.copyOf(reservationIds);
        if (reservationIds.isEmpty()) {
            throw new IllegalArgumentException("Booking must contain at least one reservation");
        }
        if (finalAmount != totalAmount - (discountAmount == null ? 0 : discountAmount)) {
            throw new IllegalArgumentException(
                    String.format("Final amount must equal total - discount. Booking ID: %s", id));
        }
        if (totalAmount < 0 || finalAmount < 0) {
            throw new IllegalArgumentException("Booking amounts cannot be negative");
        }
    }

    /**
     * 부킹 생성 (DRAFT, 결제 대기)
     * 예약 ID 목록은 비어 있지 않고 중복이 없어야 하며, 할인은 총액을 넘을 수 없다.
     */
    public static Result<Booking> create(
            UUID id,
            UUID salonId,
            UUID customerId,
            List<UUID> reservationIds,
            long totalAmount,
            Long discountAmount,
            PaymentMethod paymentMethod,
            String notes,
            String actor,
            LocalDateTime now) {
        List<FieldError> errors = new ArrayList<>();
        if (salonId == null) {
            errors.add(new FieldError("salonId", "Salon ID is required"));
        }
        if (customerId == null) {
            errors.add(new FieldError("customerId", "Customer ID is required"));
        }
        if (reservationIds == null || reservationIds.isEmpty()) {
            errors.add(new FieldError("reservationIds", "At least one reservation ID is required"));
        } else if (reservationIds.contains(null)) {
            errors.add(new FieldError("reservationIds", "Reservation ID cannot be null"));
        } else if (new HashSet<>(reservationIds).size() != reservationIds.size()) {
            errors.add(new FieldError("reservationIds", "Reservation IDs must be unique"));
        }
        if (!errors.isEmpty()) {
            return Result.err(DomainError.validation(errors));
        }

        long discount = discountAmount == null ? 0 : discountAmount;
        if (totalAmount < 0 || discount < 0) {
            return Result.err(ErrorCode.INVALID_AMOUNT, "Booking amounts cannot be negative");
        }
        if (discount > totalAmount) {
            return Result.err(ErrorCode.INVALID_AMOUNT, "Discount cannot exceed total amount");
        }

        return Result.ok(new Booking(id, salonId, customerId, reservationIds, totalAmount, discountAmount,
                totalAmount - discount, paymentMethod, PaymentStatus.PENDING, notes,
                new BookingState.Draft(), now, actor, now, actor, null));
    }

    public BookingStatus status() {
        return state.status();
    }

    /**
     * 부킹 확정 (DRAFT -> CONFIRMED)
     */
    public Result<Booking> confirm(String actor, LocalDateTime now) {
        if (!status().canTransitionTo(BookingStatus.CONFIRMED)) {
            return invalidStatus("confirm");
        }
        return Result.ok(withState(new BookingState.Confirmed(now, actor), paymentStatus, actor, now));
    }

    /**
     * 부킹 취소 (DRAFT/CONFIRMED -> CANCELLED)
     * 결제 완료 건은 환불액이 양수이면 REFUNDED 로 바뀐다.
     */
    public Result<Booking> cancel(String actor, String reason, long refundAmount, LocalDateTime now) {
        if (reason == null || reason.isBlank()) {
            return Result.err(ErrorCode.INVALID_REQUEST, "Cancellation reason is required");
        }
        if (!status().canTransitionTo(BookingStatus.CANCELLED)) {
            return invalidStatus("cancel");
        }
        PaymentStatus nextPayment = paymentStatus == PaymentStatus.PAID && refundAmount > 0
                ? PaymentStatus.REFUNDED
                : paymentStatus;
        return Result.ok(withState(new BookingState.Cancelled(now, actor, reason), nextPayment, actor, now));
    }

    /**
     * 이용 완료 (CONFIRMED -> COMPLETED)
     */
    public Result<Booking> complete(String actor, LocalDateTime now) {
        if (!status().canTransitionTo(BookingStatus.COMPLETED)) {
            return invalidStatus("complete");
        }
        return Result.ok(withState(new BookingState.Completed(now, actor), paymentStatus, actor, now));
    }

    /**
     * 노쇼 (CONFIRMED -> NO_SHOW)
     */
    public Result<Booking> markAsNoShow(String actor, LocalDateTime now) {
        if (!status().canTransitionTo(BookingStatus.NO_SHOW)) {
            return invalidStatus("mark as no-show");
        }
        return Result.ok(withState(new BookingState.NoShow(now, actor), paymentStatus, actor, now));
    }

    /**
     * 결제 기록 (PENDING/FAILED -> PAID)
     */
    public Result<Booking> recordPayment(PaymentMethod method, String actor, LocalDateTime now) {
        if (status() == BookingStatus.CANCELLED || status() == BookingStatus.NO_SHOW) {
            return invalidStatus("record payment for");
        }
        if (paymentStatus != PaymentStatus.PENDING && paymentStatus != PaymentStatus.FAILED) {
            return Result.err(ErrorCode.INVALID_STATUS,
                    String.format("Payment already %s. Booking ID: %s", paymentStatus, id));
        }
        PaymentMethod resolved = method != null ? method : paymentMethod;
        return Result.ok(new Booking(id, salonId, customerId, reservationIds, totalAmount, discountAmount,
                finalAmount, resolved, PaymentStatus.PAID, notes, state, createdAt, createdBy, now, actor, version));
    }

    /**
     * 결제 실패 기록 (PENDING -> FAILED)
     */
    public Result<Booking> markPaymentFailed(String actor, LocalDateTime now) {
        if (paymentStatus != PaymentStatus.PENDING) {
            return Result.err(ErrorCode.INVALID_STATUS,
                    String.format("Payment in %s status cannot fail. Booking ID: %s", paymentStatus, id));
        }
        return Result.ok(withState(state, PaymentStatus.FAILED, actor, now));
    }

    /**
     * 부킹 내용 변경 (메모, 할인, 결제 수단)
     * 할인이 바뀌면 최종 금액을 다시 계산한다. 결제가 끝난 뒤에는 할인과 결제 수단을 바꿀 수 없다.
     */
    public Result<Booking> update(BookingChanges changes, String actor, LocalDateTime now) {
        if (status().isTerminal()) {
            return invalidStatus("update");
        }
        boolean paymentTouched = changes.discountAmount() != null || changes.paymentMethod() != null;
        if (paymentTouched && isSettled()) {
            return Result.err(ErrorCode.INVALID_STATUS,
                    String.format("Payment already %s, discount and method are fixed. Booking ID: %s",
                            paymentStatus, id));
        }
        Long discount = changes.discountAmount() != null ? changes.discountAmount() : discountAmount;
        long effectiveDiscount = discount == null ? 0 : discount;
        if (effectiveDiscount < 0 || effectiveDiscount > totalAmount) {
            return Result.err(ErrorCode.INVALID_AMOUNT,
                    String.format("Discount must be between 0 and %d: %d", totalAmount, effectiveDiscount));
        }
        return Result.ok(new Booking(id, salonId, customerId, reservationIds, totalAmount, discount,
                totalAmount - effectiveDiscount,
                changes.paymentMethod() != null ? changes.paymentMethod() : paymentMethod,
                paymentStatus,
                changes.notes() != null ? changes.notes() : notes,
                state, createdAt, createdBy, now, actor, version));
    }

    /**
     * 예약 추가 (중복 불가)
     */
    public Result<Booking> addReservation(UUID reservationId, String actor, LocalDateTime now) {
        Result<Booking> editable = checkReservationsEditable(reservationId);
        if (editable.isErr()) {
            return editable;
        }
        if (reservationIds.contains(reservationId)) {
            return Result.err(DomainError.validation(List.of(new FieldError("reservationId",
                    "Reservation " + reservationId + " is already part of the booking"))));
        }
        List<UUID> next = new ArrayList<>(reservationIds);
        next.add(reservationId);
        return Result.ok(withReservations(next, actor, now));
    }

    /**
     * 예약 제외 (마지막 예약은 제외할 수 없다)
     */
    public Result<Booking> removeReservation(UUID reservationId, String actor, LocalDateTime now) {
        Result<Booking> editable = checkReservationsEditable(reservationId);
        if (editable.isErr()) {
            return editable;
        }
        if (!reservationIds.contains(reservationId)) {
            return Result.err(DomainError.validation(List.of(new FieldError("reservationId",
                    "Reservation " + reservationId + " is not part of the booking"))));
        }
        if (reservationIds.size() == 1) {
            return Result.err(DomainError.validation(List.of(new FieldError("reservationIds",
                    "Booking must contain at least one reservation"))));
        }
        List<UUID> next = new ArrayList<>(reservationIds);
        next.remove(reservationId);
        return Result.ok(withReservations(next, actor, now));
    }

    public long paidAmount() {
        return paymentStatus == PaymentStatus.PAID ? finalAmount : 0;
    }

    private boolean isSettled() {
        return paymentStatus == PaymentStatus.PAID || paymentStatus == PaymentStatus.REFUNDED;
    }

    private Result<Booking> checkReservationsEditable(UUID reservationId) {
        if (reservationId == null) {
            return Result.err(DomainError.validation(List.of(
                    new FieldError("reservationId", "Reservation ID is required"))));
        }
        if (status().isTerminal()) {
            return invalidStatus("change reservations of");
        }
        if (isSettled()) {
            return Result.err(ErrorCode.INVALID_STATUS,
                    String.format("Payment already %s, reservations are fixed. Booking ID: %s", paymentStatus, id));
        }
        return Result.ok(this);
    }

    private Booking withReservations(List<UUID> next, String actor, LocalDateTime now) {
        return new Booking(id, salonId, customerId, next, totalAmount, discountAmount, finalAmount,
                paymentMethod, paymentStatus, notes, state, createdAt, createdBy, now, actor, version);
    }

    private Booking withState(BookingState next, PaymentStatus nextPayment, String actor, LocalDateTime now) {
        return new Booking(id, salonId, customerId, reservationIds, totalAmount, discountAmount, finalAmount,
                paymentMethod, nextPayment, notes, next, createdAt, createdBy, now, actor, version);
    }

    private Result<Booking> invalidStatus(String action) {
        return Result.err(ErrorCode.INVALID_STATUS,
                String.format("Cannot %s booking in %s status. Booking ID: %s", action, status(), id));
    }
}
