package personal.salon.reservation.booking.adapter.out.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import personal.salon.reservation.booking.application.port.out.ReservationEventPublisher;
import personal.salon.reservation.booking.domain.model.LifecycleEvent;

/**
 * Logging Event Publisher
 * Kafka 가 비활성일 때 이벤트를 감사 로그로만 남기는 구현체 (로컬 개발, 테스트)
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "reservation.events.kafka-enabled", havingValue = "false", matchIfMissing = true)
public class LoggingEventPublisher implements ReservationEventPublisher {

    @Override
    public void publish(LifecycleEvent event) {
        log.info("Lifecycle event: type={}, aggregateId={}, status={}, actor={}, occurredAt={}",
                event.type(), event.aggregateId(), event.status(), event.actor(), event.occurredAt());
    }
}
