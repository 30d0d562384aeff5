package personal.salon.reservation.booking.adapter.out.lock;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Staff Lock 설정 Properties
 *
 * 설정 예시:
 * reservation:
 *   lock:
 *     strategy: redis          # local | redis
 *     ttl-seconds: 10          # 락 TTL (초)
 *     wait-timeout-millis: 3000
 *     retry-interval-millis: 50
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "reservation.lock")
public class StaffLockProperties {

    /**
     * 락 전략
     * - local: JVM 내 직원별 락 (단일 인스턴스)
     * - redis: Redis SETNX 분산 락 (다중 인스턴스)
     */
    private String strategy = "local";

    /**
     * 락 TTL (초)
     * 기본값: 10초 (충돌 검사 + 저장 최대 시간 + 안전 마진)
     */
    private int ttlSeconds = 10;

    /**
     * 락 대기 최대 시간 (밀리초), 초과 시 SLOT_NOT_AVAILABLE
     */
    private long waitTimeoutMillis = 3000;

    /**
     * Redis 락 재시도 간격 (밀리초)
     */
    private long retryIntervalMillis = 50;
}
