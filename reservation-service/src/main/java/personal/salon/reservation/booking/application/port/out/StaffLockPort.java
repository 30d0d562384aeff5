package personal.salon.reservation.booking.application.port.out;

import personal.salon.common.result.Result;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * 직원 일정 락 Port
 * 충돌 검사와 저장을 직원 단위로 직렬화한다.
 *
 * 구현체:
 * - LocalStaffLockAdapter: JVM 내 직원별 ReentrantLock (단일 인스턴스)
 * - RedisStaffLockAdapter: Redis SETNX 분산 락 (다중 인스턴스)
 */
public interface StaffLockPort {

    /**
     * 락을 잡은 상태로 action 실행
     * 대기 시간 안에 락을 얻지 못하면 action 을 실행하지 않고 SLOT_NOT_AVAILABLE 반환
     */
    <T> Result<T> executeWithLock(UUID staffId, Supplier<Result<T>> action);

    /**
     * 전략 이름 반환 (로깅/모니터링용)
     */
    String getStrategyName();
}
