package personal.salon.reservation.booking.adapter.out.lock;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.Result;
import personal.salon.reservation.booking.application.port.out.StaffLockPort;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Local Staff Lock Adapter
 * 직원별 ReentrantLock 으로 check-then-write 를 직렬화하는 어댑터
 * 대기/보유 중인 스레드가 없어진 직원의 락은 맵에서 제거한다.
 *
 * 사용 환경:
 * - 로컬 개발 (단일 인스턴스)
 * - 통합 테스트
 *
 * 주의: 다중 인스턴스 운영 환경에서는 redis 전략을 사용할 것
 */
@Slf4j
@RequiredArgsConstructor
public class LocalStaffLockAdapter implements StaffLockPort {

    private final ConcurrentMap<UUID, StaffLock> locks = new ConcurrentHashMap<>();
    private final Duration waitTimeout;
    private final MeterRegistry meterRegistry;

    @Override
    public <T> Result<T> executeWithLock(UUID staffId, Supplier<Result<T>> action) {
        ReentrantLock lock = retain(staffId);
        try {
            boolean acquired;
            try {
                acquired = lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[LocalLock] Interrupted while waiting for lock: staffId={}", staffId);
                return lockUnavailable(staffId);
            }

            if (!acquired) {
                log.warn("[LocalLock] Lock wait timed out: staffId={}, waitTimeout={}ms",
                        staffId, waitTimeout.toMillis());
                return lockUnavailable(staffId);
            }

            try {
                log.debug("[LocalLock] Lock acquired: staffId={}", staffId);
                return action.get();
            } finally {
                lock.unlock();
                log.debug("[LocalLock] Lock released: staffId={}", staffId);
            }
        } finally {
            releaseReference(staffId);
        }
    }

    @Override
    public String getStrategyName() {
        return "local";
    }

    int trackedLockCount() {
        return locks.size();
    }

    // 참조 수 증감은 compute 안에서만 일어나므로 사용 중인 락이 맵에서 빠지지 않는다
    private ReentrantLock retain(UUID staffId) {
        return locks.compute(staffId, (id, existing) -> {
            StaffLock staffLock = existing != null ? existing : new StaffLock();
            staffLock.references++;
            return staffLock;
        }).lock;
    }

    private void releaseReference(UUID staffId) {
        locks.computeIfPresent(staffId, (id, staffLock) -> --staffLock.references == 0 ? null : staffLock);
    }

    private <T> Result<T> lockUnavailable(UUID staffId) {
        Counter.builder("reservation.lock.acquire.failures")
                .tag("strategy", getStrategyName())
                .description("Number of staff lock acquisition failures")
                .register(meterRegistry)
                .increment();
        return Result.err(ErrorCode.SLOT_NOT_AVAILABLE,
                "Staff schedule is busy, please retry: " + staffId);
    }

    private static final class StaffLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int references;
    }
}
