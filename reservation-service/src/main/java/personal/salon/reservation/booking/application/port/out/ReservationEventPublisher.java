package personal.salon.reservation.booking.application.port.out;

import personal.salon.reservation.booking.domain.model.LifecycleEvent;

/**
 * Reservation Event Publisher (Output Port)
 * 최선 노력 전달: 구현체는 예외를 던지지 않고 실패를 로그와 메트릭으로 남긴다.
 */
public interface ReservationEventPublisher {

    void publish(LifecycleEvent event);
}
