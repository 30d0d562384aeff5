package personal.salon.reservation.booking.adapter.out.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import personal.salon.reservation.booking.application.port.out.ReservationEventPublisher;
import personal.salon.reservation.booking.domain.model.LifecycleEvent;

/**
 * Reservation Kafka Publisher (Adapter Layer)
 * Kafka를 통한 예약/부킹 이벤트 발행 구현체
 * 발행 실패는 로그와 메트릭으로만 남기고 호출자에게 전파하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "reservation.events.kafka-enabled", havingValue = "true")
public class ReservationKafkaPublisher implements ReservationEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final ReservationEventProperties properties;
    private final MeterRegistry meterRegistry;

    @Override
    public void publish(LifecycleEvent event) {
        String topic = properties.getTopicPrefix() + "." + event.type().getTopicSuffix();
        String key = event.aggregateId().toString();

        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event: type={}, aggregateId={}", event.type(), key, e);
            countFailure(event);
            return;
        }

        try {
            log.debug("Publishing event: topic={}, key={}", topic, key);
            kafkaTemplate.send(topic, key, payload)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("Failed to publish event: topic={}, key={}", topic, key, ex);
                            countFailure(event);
                        } else {
                            log.debug("Event published: topic={}, key={}, offset={}",
                                    topic, key, result.getRecordMetadata().offset());
                        }
                    });
        } catch (Exception e) {
            log.error("Failed to send event: topic={}, key={}", topic, key, e);
            countFailure(event);
        }
    }

    private void countFailure(LifecycleEvent event) {
        Counter.builder("reservation.event.publish.failures")
                .tag("type", event.type().name())
                .description("Number of lifecycle events that could not be published")
                .register(meterRegistry)
                .increment();
    }
}
