package personal.salon.reservation.booking.adapter.out.event;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Reservation Event 설정 Properties
 *
 * 설정 예시:
 * reservation:
 *   events:
 *     kafka-enabled: true   # false 면 로그로만 남김
 *     topic-prefix: salon
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "reservation.events")
public class ReservationEventProperties {

    private boolean kafkaEnabled = false;

    /**
     * 토픽 이름 = {topicPrefix}.{이벤트 종류} (예: salon.reservation.created)
     */
    private String topicPrefix = "salon";
}
