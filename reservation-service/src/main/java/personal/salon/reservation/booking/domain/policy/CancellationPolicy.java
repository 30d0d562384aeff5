package personal.salon.reservation.booking.domain.policy;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Cancellation Policy
 * 환불액, 취소 수수료, 초과 시술 요금 계산 (I/O 없는 순수 함수)
 *
 * 환불 규칙 (시작까지 남은 시간 기준):
 * - 48시간 이상: 전액
 * - 24 ~ 48시간: 70% (원 단위 내림)
 * - 12 ~ 24시간: 50% (원 단위 내림)
 * - 12시간 미만 또는 시작 이후: 0
 */
public final class CancellationPolicy {

    private static final double FULL_REFUND_HOURS = 48;
    private static final double PARTIAL_REFUND_HOURS = 24;
    private static final double HALF_REFUND_HOURS = 12;
    private static final double MILLIS_PER_HOUR = 3_600_000d;

    private CancellationPolicy() {
    }

    public static long refund(long paidAmount, double hoursBeforeStart) {
        if (paidAmount < 0) {
            throw new IllegalArgumentException("Paid amount cannot be negative: " + paidAmount);
        }
        if (hoursBeforeStart >= FULL_REFUND_HOURS) {
            return paidAmount;
        }
        if (hoursBeforeStart >= PARTIAL_REFUND_HOURS) {
            return paidAmount * 70 / 100;
        }
        if (hoursBeforeStart >= HALF_REFUND_HOURS) {
            return paidAmount * 50 / 100;
        }
        return 0;
    }

    /**
     * 시작 시각과 취소 시각으로 환불액 계산 (시간 단위는 소수 포함)
     */
    public static long refund(long paidAmount, LocalDateTime scheduledStart, LocalDateTime cancelledAt) {
        return refund(paidAmount, hoursBetween(cancelledAt, scheduledStart));
    }

    public static long cancellationFee(long paidAmount, double hoursBeforeStart) {
        return paidAmount - refund(paidAmount, hoursBeforeStart);
    }

    public static long cancellationFee(long paidAmount, LocalDateTime scheduledStart, LocalDateTime cancelledAt) {
        return paidAmount - refund(paidAmount, scheduledStart, cancelledAt);
    }

    /**
     * 초과 시술 요금
     * 예정 종료 이후 초과 분(올림) x 분당 요금
     */
    public static long overtimeCharge(LocalDateTime actualEnd, LocalDateTime scheduledEnd, long perMinuteRate) {
        if (!actualEnd.isAfter(scheduledEnd)) {
            return 0;
        }
        Duration overtime = Duration.between(scheduledEnd, actualEnd);
        long minutes = overtime.toMinutes();
        if (overtime.minusMinutes(minutes).compareTo(Duration.ZERO) > 0) {
            minutes++;
        }
        return minutes * perMinuteRate;
    }

    public static double hoursBetween(LocalDateTime from, LocalDateTime to) {
        return Duration.between(from, to).toMillis() / MILLIS_PER_HOUR;
    }
}
