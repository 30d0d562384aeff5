package personal.salon.reservation.booking.application.port.in;

import personal.salon.common.result.Result;
import personal.salon.reservation.booking.domain.model.Reservation;

import java.util.UUID;

/**
 * Get Reservation UseCase (Input Port)
 */
public interface GetReservationUseCase {

    Result<Reservation> getReservation(UUID reservationId);
}
