package personal.salon.reservation.booking.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Reservation 정책 Properties
 * application.yml의 reservation.policy.* 설정을 바인딩
 *
 * @param cancellationLeadTime  시작 전 취소 마감 (기본 1시간)
 * @param maxAdvanceMonths      예약 가능 최대 선행 기간 (기본 3개월)
 * @param maxAmount             금액 상한 (기본 10,000,000)
 * @param modificationLeadTime  시작 전 변경 마감 (기본 12시간)
 * @param rejectPastSlotQueries 지난 날짜의 슬롯 조회 거부 여부 (기본 false)
 */
@ConfigurationProperties(prefix = "reservation.policy")
public record ReservationPolicyProperties(
        @DefaultValue("PT1H") Duration cancellationLeadTime,
        @DefaultValue("3") int maxAdvanceMonths,
        @DefaultValue("10000000") long maxAmount,
        @DefaultValue("PT12H") Duration modificationLeadTime,
        @DefaultValue("false") boolean rejectPastSlotQueries
) {
    public static ReservationPolicyProperties defaults() {
        return new ReservationPolicyProperties(Duration.ofHours(1), 3, 10_000_000L, Duration.ofHours(12), false);
    }
}
