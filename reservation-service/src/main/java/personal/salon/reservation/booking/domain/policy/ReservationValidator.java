package personal.salon.reservation.booking.domain.policy;

import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.DomainError;
import personal.salon.common.result.FieldError;
import personal.salon.common.result.Result;
import personal.salon.reservation.booking.domain.model.TimeRange;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Reservation Validator
 * 영속화 전에 호출되는 순수 검증 함수 모음 (부수 효과 없음)
 */
public final class ReservationValidator {

    private ReservationValidator() {
    }

    /**
     * 시간 범위 검증
     *
     * @param now              현재 시각
     * @param maxAdvanceMonths 예약 가능 최대 선행 기간 (개월)
     * @return 검증된 TimeRange
     */
    public static Result<TimeRange> validateTimeRange(LocalDateTime start, LocalDateTime end,
                                                      LocalDateTime now, int maxAdvanceMonths) {
        if (start == null || end == null) {
            return Result.err(ErrorCode.INVALID_TIME_RANGE, "Start time and end time are required");
        }
        if (!start.isBefore(end)) {
            return Result.err(ErrorCode.INVALID_TIME_RANGE, "Start time must be before end time");
        }
        if (start.isBefore(now)) {
            return Result.err(ErrorCode.PAST_TIME_NOT_ALLOWED, "Cannot create reservation in the past");
        }
        if (start.isAfter(now.plusMonths(maxAdvanceMonths))) {
            return Result.err(ErrorCode.INVALID_TIME_RANGE,
                    String.format("Cannot book more than %d months in advance", maxAdvanceMonths));
        }
        return Result.ok(new TimeRange(start, end));
    }

    public static Result<Long> validateAmount(long amount, long ceiling) {
        if (amount < 0) {
            return Result.err(ErrorCode.INVALID_AMOUNT, "Amount cannot be negative");
        }
        if (amount > ceiling) {
            return Result.err(ErrorCode.INVALID_AMOUNT, "Amount cannot exceed " + ceiling);
        }
        return Result.ok(amount);
    }

    /**
     * 예약금 검증 (null 은 그대로 통과)
     */
    public static Result<Long> validateDepositAmount(Long deposit, long total) {
        if (deposit == null) {
            return Result.ok(null);
        }
        if (deposit < 0) {
            return Result.err(ErrorCode.INVALID_AMOUNT, "Deposit amount cannot be negative");
        }
        if (deposit > total) {
            return Result.err(ErrorCode.INVALID_AMOUNT, "Deposit amount cannot exceed total amount");
        }
        return Result.ok(deposit);
    }

    /**
     * 필수 식별자 검증
     * 누락된 필드마다 FieldError 를 하나씩 담아 VALIDATION_FAILED 반환
     *
     * @param identifiers 필드명 -> 값 (순서 유지를 위해 LinkedHashMap 권장)
     */
    public static Result<Void> validateIdentifiers(Map<String, UUID> identifiers) {
        List<FieldError> errors = new ArrayList<>();
        identifiers.forEach((field, value) -> {
            if (value == null) {
                errors.add(new FieldError(field, field + " is required"));
            }
        });
        if (!errors.isEmpty()) {
            return Result.err(DomainError.validation(errors));
        }
        return Result.ok(null);
    }
}
