package personal.salon.reservation.booking.application.port.in;

import personal.salon.common.result.Result;
import personal.salon.reservation.booking.domain.model.Reservation;

import java.util.UUID;

/**
 * Confirm Reservation UseCase (Input Port)
 */
public interface ConfirmReservationUseCase {

    /**
     * 예약 확정 (PENDING 에서만 가능, 그 외 INVALID_STATUS)
     */
    Result<Reservation> confirmReservation(UUID reservationId, String actor);
}
