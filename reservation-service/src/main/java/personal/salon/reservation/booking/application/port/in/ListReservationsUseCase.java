package personal.salon.reservation.booking.application.port.in;

import personal.salon.common.result.Result;
import personal.salon.reservation.booking.domain.model.PageResult;
import personal.salon.reservation.booking.domain.model.Pagination;
import personal.salon.reservation.booking.domain.model.Reservation;
import personal.salon.reservation.booking.domain.model.ReservationSearchCriteria;

/**
 * List Reservations UseCase (Input Port)
 */
public interface ListReservationsUseCase {

    Result<PageResult<Reservation>> listReservations(ReservationSearchCriteria criteria, Pagination pagination);
}
