package personal.salon.reservation.booking.adapter.out.lock;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.Result;
import personal.salon.reservation.booking.application.port.out.StaffLockPort;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Redis Staff Lock Adapter
 * Redis SETNX 기반 직원별 분산 락
 * Lua Script를 사용한 원자적 락 해제 (소유권 검증)
 *
 * 사용 환경:
 * - 운영 환경 (다중 인스턴스)
 */
@Slf4j
@RequiredArgsConstructor
public class RedisStaffLockAdapter implements StaffLockPort {

    private static final String STAFF_LOCK_PREFIX = "reservation:staff-lock:";

    // 락 해제 Lua Script (본인 소유인 경우만 삭제)
    private static final String UNLOCK_SCRIPT = """
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('del', KEYS[1])
            end
            return 0
            """;

    private final StringRedisTemplate redisTemplate;
    private final StaffLockProperties properties;
    private final MeterRegistry meterRegistry;

    @Override
    public <T> Result<T> executeWithLock(UUID staffId, Supplier<Result<T>> action) {
        String lockKey = STAFF_LOCK_PREFIX + staffId;
        // 호출마다 고유한 소유자 토큰
        String owner = UUID.randomUUID().toString();

        Result<Boolean> acquired = acquire(lockKey, owner);
        if (acquired.isErr()) {
            return acquired.cast();
        }
        if (!acquired.value()) {
            log.warn("[RedisLock] Lock wait timed out: key={}, waitTimeout={}ms",
                    lockKey, properties.getWaitTimeoutMillis());
            countFailure();
            return Result.err(ErrorCode.SLOT_NOT_AVAILABLE, "Staff schedule is busy, please retry: " + staffId);
        }

        try {
            log.debug("[RedisLock] Lock acquired: key={}, owner={}", lockKey, owner);
            return action.get();
        } finally {
            release(lockKey, owner);
        }
    }

    @Override
    public String getStrategyName() {
        return "redis";
    }

    private Result<Boolean> acquire(String lockKey, String owner) {
        Duration ttl = Duration.ofSeconds(properties.getTtlSeconds());
        long deadline = System.currentTimeMillis() + properties.getWaitTimeoutMillis();
        try {
            while (true) {
                Boolean success = redisTemplate.opsForValue().setIfAbsent(lockKey, owner, ttl);
                if (Boolean.TRUE.equals(success)) {
                    return Result.ok(true);
                }
                if (System.currentTimeMillis() >= deadline) {
                    return Result.ok(false);
                }
                Thread.sleep(properties.getRetryIntervalMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[RedisLock] Interrupted while waiting for lock: key={}", lockKey);
            return Result.ok(false);
        } catch (Exception e) {
            log.error("[RedisLock] Failed to acquire lock: key={}", lockKey, e);
            countFailure();
            return Result.err(ErrorCode.SYSTEM_ERROR, "Failed to acquire staff lock: " + e.getMessage());
        }
    }

    private void release(String lockKey, String owner) {
        try {
            Long released = redisTemplate.execute(
                    new DefaultRedisScript<>(UNLOCK_SCRIPT, Long.class),
                    List.of(lockKey),
                    owner);

            if (released != null && released > 0) {
                log.debug("[RedisLock] Lock released: key={}", lockKey);
            } else {
                log.warn("[RedisLock] Lock not released (not owner or expired): key={}", lockKey);
            }
        } catch (Exception e) {
            // TTL 만료로 자동 해제된다.
            log.error("[RedisLock] Failed to release lock: key={}", lockKey, e);
        }
    }

    private void countFailure() {
        Counter.builder("reservation.lock.acquire.failures")
                .tag("strategy", getStrategyName())
                .description("Number of staff lock acquisition failures")
                .register(meterRegistry)
                .increment();
    }
}
