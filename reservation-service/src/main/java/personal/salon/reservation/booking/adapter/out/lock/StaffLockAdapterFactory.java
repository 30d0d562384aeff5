package personal.salon.reservation.booking.adapter.out.lock;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import personal.salon.reservation.booking.application.port.out.StaffLockPort;

import java.time.Duration;

/**
 * Staff Lock Adapter Factory
 * 설정에 따라 적절한 StaffLockPort 구현체를 생성
 *
 * 설정:
 * - reservation.lock.strategy=local → LocalStaffLockAdapter (기본값)
 * - reservation.lock.strategy=redis → RedisStaffLockAdapter
 */
@Slf4j
@Configuration
public class StaffLockAdapterFactory {

    @Bean
    @ConditionalOnProperty(name = "reservation.lock.strategy", havingValue = "local", matchIfMissing = true)
    public StaffLockPort localStaffLockAdapter(StaffLockProperties properties, MeterRegistry meterRegistry) {
        log.info("Creating LocalStaffLockAdapter - waitTimeout: {}ms", properties.getWaitTimeoutMillis());
        return new LocalStaffLockAdapter(Duration.ofMillis(properties.getWaitTimeoutMillis()), meterRegistry);
    }

    @Bean
    @ConditionalOnProperty(name = "reservation.lock.strategy", havingValue = "redis")
    public StaffLockPort redisStaffLockAdapter(
            StringRedisTemplate redisTemplate,
            StaffLockProperties properties,
            MeterRegistry meterRegistry) {

        log.info("Creating RedisStaffLockAdapter - TTL: {}s, waitTimeout: {}ms",
                properties.getTtlSeconds(), properties.getWaitTimeoutMillis());
        return new RedisStaffLockAdapter(redisTemplate, properties, meterRegistry);
    }
}
