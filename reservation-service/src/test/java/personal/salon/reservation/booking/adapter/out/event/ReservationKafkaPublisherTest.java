package personal.salon.reservation.booking.adapter.out.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import personal.salon.reservation.booking.domain.model.LifecycleEvent;
import personal.salon.reservation.booking.domain.model.LifecycleEventType;

import java.time.LocalDateTime;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReservationKafkaPublisher 단위 테스트")
class ReservationKafkaPublisherTest {

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private SimpleMeterRegistry meterRegistry;
    private ReservationKafkaPublisher publisher;
    private LifecycleEvent event;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        publisher = new ReservationKafkaPublisher(kafkaTemplate, objectMapper, new ReservationEventProperties(),
                meterRegistry);
        event = new LifecycleEvent(UUID.randomUUID(), LifecycleEventType.RESERVATION_CANCELLED, UUID.randomUUID(),
                UUID.randomUUID(), UUID.randomUUID(), "CANCELLED", "staff-1", LocalDateTime.of(2024, 6, 1, 9, 0));
    }

    @Test
    @DisplayName("{prefix}.{종류} 토픽에 예약 ID 를 키로 JSON 을 보낸다")
    void publish_Success() {
        // given
        CompletableFuture<SendResult<String, String>> pending = new CompletableFuture<>();
        given(kafkaTemplate.send(eq("salon.reservation.cancelled"), eq(event.aggregateId().toString()), anyString()))
                .willReturn(pending);

        // when
        publisher.publish(event);

        // then
        then(kafkaTemplate).should().send(eq("salon.reservation.cancelled"), eq(event.aggregateId().toString()),
                contains("\"status\":\"CANCELLED\""));
        assertThat(meterRegistry.find("reservation.event.publish.failures").counter()).isNull();
    }

    @Test
    @DisplayName("브로커 전송 실패는 예외 없이 실패 카운터만 증가시킨다")
    void publish_BrokerFailure() {
        // given
        given(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .willReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        // when & then
        assertThatCode(() -> publisher.publish(event)).doesNotThrowAnyException();
        assertThat(meterRegistry.counter("reservation.event.publish.failures",
                "type", "RESERVATION_CANCELLED").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("send 호출 자체가 예외를 던져도 호출자에게 전파하지 않는다")
    void publish_SendThrows() {
        // given
        given(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .willThrow(new IllegalStateException("producer closed"));

        // when & then
        assertThatCode(() -> publisher.publish(event)).doesNotThrowAnyException();
        assertThat(meterRegistry.counter("reservation.event.publish.failures",
                "type", "RESERVATION_CANCELLED").count()).isEqualTo(1.0);
    }
}
