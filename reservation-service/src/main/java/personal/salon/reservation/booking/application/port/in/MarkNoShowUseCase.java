package personal.salon.reservation.booking.application.port.in;

import personal.salon.common.result.Result;
import personal.salon.reservation.booking.domain.model.Reservation;

import java.util.UUID;

/**
 * Mark No-Show UseCase (Input Port)
 */
public interface MarkNoShowUseCase {

    /**
     * 노쇼 처리 (CONFIRMED 이고 종료 시각이 지난 경우만)
     */
    Result<Reservation> markAsNoShow(UUID reservationId, String actor);
}
