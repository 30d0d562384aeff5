package personal.salon.reservation.booking.domain.model;

import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.Result;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Reservation Domain Model
 * 예약 도메인 모델 (불변)
 * 상태 전이 메서드는 새 인스턴스를 Result 로 반환하며, 상태 외의 데이터는 그대로 유지한다.
 */
public record Reservation(
        UUID id,
        UUID salonId,
        UUID customerId,
        UUID staffId,
        UUID serviceId,
        LocalDateTime startTime,
        LocalDateTime endTime,
        String notes,
        long totalAmount,
        Long depositAmount,
        boolean paid,
        ReservationState state,
        LocalDateTime createdAt,
        String createdBy,
        LocalDateTime updatedAt,
        String updatedBy,
        Long version
) {
    public Reservation {
        Objects.requireNonNull(id, "Reservation ID cannot be null");
        Objects.requireNonNull(staffId, "Staff ID cannot be null");
        Objects.requireNonNull(state, "Reservation state cannot be null");
        Objects.requireNonNull(startTime, "Start time cannot be null");
        Objects.requireNonNull(endTime, "End time cannot be null");
        if (!startTime.isBefore(endTime)) {
            throw new IllegalArgumentException(
                    String.format("Reservation start must be before end. Reservation ID: %s", id));
        }
        if (totalAmount < 0) {
            throw new IllegalArgumentException("Total amount cannot be negative: " + totalAmount);
        }
        if (depositAmount != null && (depositAmount < 0 || depositAmount > totalAmount)) {
            throw new IllegalArgumentException(
                    String.format("Deposit must be between 0 and %d: %d", totalAmount, depositAmount));
        }
    }

    /**
     * 예약 생성 (정적 팩토리 메서드)
     * 입력 검증과 충돌 검사는 호출 전에 끝나 있어야 한다.
     *
     * @param confirmImmediately true 이면 CONFIRMED 상태로 생성
     * @return 새로운 예약 (PENDING 또는 CONFIRMED)
     */
    public static Reservation create(
            UUID id,
            UUID salonId,
            UUID customerId,
            UUID staffId,
            UUID serviceId,
            TimeRange timeRange,
            String notes,
            long totalAmount,
            Long depositAmount,
            String actor,
            LocalDateTime now,
            boolean confirmImmediately) {
        ReservationState state = confirmImmediately
                ? new ReservationState.Confirmed(now, actor)
                : ReservationState.pending();
        return new Reservation(id, salonId, customerId, staffId, serviceId,
                timeRange.start(), timeRange.end(), notes, totalAmount, depositAmount, false,
                state, now, actor, now, actor, null);
    }

    public ReservationStatus status() {
        return state.status();
    }

    public TimeRange timeRange() {
        return new TimeRange(startTime, endTime);
    }

    public boolean isTerminal() {
        return status().isTerminal();
    }

    /**
     * 예약 확정 (PENDING -> CONFIRMED)
     */
    public Result<Reservation> confirm(String actor, LocalDateTime now) {
        if (status() != ReservationStatus.PENDING) {
            return invalidStatus("confirm");
        }
        return Result.ok(withState(new ReservationState.Confirmed(now, actor), actor, now));
    }

    /**
     * 예약 취소 (PENDING/CONFIRMED -> CANCELLED)
     * 시작 시각이 now + leadTime 보다 뒤여야 한다.
     */
    public Result<Reservation> cancel(String actor, String reason, LocalDateTime now, Duration leadTime) {
        if (reason == null || reason.isBlank()) {
            return Result.err(ErrorCode.INVALID_REQUEST, "Cancellation reason is required");
        }
        if (!status().canTransitionTo(ReservationStatus.CANCELLED)) {
            return Result.err(ErrorCode.CANNOT_CANCEL,
                    String.format("Reservation in %s status cannot be cancelled. Reservation ID: %s", status(), id));
        }
        if (!startTime.isAfter(now.plus(leadTime))) {
            return Result.err(ErrorCode.CANNOT_CANCEL,
                    String.format("Reservation must be cancelled at least %d minutes before start. Reservation ID: %s",
                            leadTime.toMinutes(), id));
        }
        return Result.ok(withState(new ReservationState.Cancelled(now, actor, reason), actor, now));
    }

    /**
     * 시술 완료 (CONFIRMED -> COMPLETED)
     */
    public Result<Reservation> complete(String actor, LocalDateTime now) {
        if (status() != ReservationStatus.CONFIRMED) {
            return invalidStatus("complete");
        }
        return Result.ok(withState(new ReservationState.Completed(now, actor), actor, now));
    }

    /**
     * 노쇼 처리 (CONFIRMED -> NO_SHOW)
     * 예약 종료 시각이 지난 뒤에만 가능
     */
    public Result<Reservation> markAsNoShow(String actor, LocalDateTime now) {
        if (status() != ReservationStatus.CONFIRMED) {
            return invalidStatus("mark as no-show");
        }
        if (now.isBefore(endTime)) {
            return Result.err(ErrorCode.INVALID_STATUS,
                    String.format("No-show cannot be declared before the reservation ends at %s. Reservation ID: %s",
                            endTime, id));
        }
        return Result.ok(withState(new ReservationState.NoShow(now, actor), actor, now));
    }

    /**
     * 변경 가능 여부 검사
     * 종료 상태이거나 변경 마감(시작 전 leadTime)이 지난 경우 CANNOT_MODIFY
     */
    public Result<Reservation> checkModifiable(LocalDateTime now, Duration leadTime) {
        if (isTerminal()) {
            return Result.err(ErrorCode.CANNOT_MODIFY,
                    String.format("Reservation in %s status cannot be modified. Reservation ID: %s", status(), id));
        }
        if (!startTime.isAfter(now.plus(leadTime))) {
            return Result.err(ErrorCode.CANNOT_MODIFY,
                    String.format("Reservation can no longer be modified. Reservation ID: %s", id));
        }
        return Result.ok(this);
    }

    /**
     * 예약 내용 변경
     * 시간 범위와 금액은 호출 전에 검증되어 있어야 한다.
     */
    public Result<Reservation> modify(ReservationChanges changes, String actor, LocalDateTime now,
                                      Duration leadTime) {
        return checkModifiable(now, leadTime).flatMap(current -> {
            TimeRange range = changes.timeRange() != null ? changes.timeRange() : timeRange();
            long amount = changes.totalAmount() != null ? changes.totalAmount() : totalAmount;
            Long deposit = changes.depositAmount() != null ? changes.depositAmount() : depositAmount;
            if (deposit != null && deposit > amount) {
                return Result.err(ErrorCode.INVALID_AMOUNT, "Deposit amount cannot exceed total amount");
            }
            return Result.ok(new Reservation(id, salonId, customerId,
                    changes.staffId() != null ? changes.staffId() : staffId,
                    changes.serviceId() != null ? changes.serviceId() : serviceId,
                    range.start(), range.end(),
                    changes.notes() != null ? changes.notes() : notes,
                    amount, deposit, paid, state, createdAt, createdBy, now, actor, version));
        });
    }

    /**
     * 결제 완료 시 지불된 금액 (미결제면 예약금, 예약금도 없으면 0)
     */
    public long paidAmount() {
        if (paid) {
            return totalAmount;
        }
        return depositAmount == null ? 0 : depositAmount;
    }

    private Reservation withState(ReservationState next, String actor, LocalDateTime now) {
        return new Reservation(id, salonId, customerId, staffId, serviceId, startTime, endTime, notes,
                totalAmount, depositAmount, paid, next, createdAt, createdBy, now, actor, version);
    }

    private Result<Reservation> invalidStatus(String action) {
        return Result.err(ErrorCode.INVALID_STATUS,
                String.format("Cannot %s reservation in %s status. Reservation ID: %s", action, status(), id));
    }
}
