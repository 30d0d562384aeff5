package personal.salon.reservation.booking.application.port.in;

import personal.salon.common.result.Result;
import personal.salon.reservation.booking.domain.model.Booking;
import personal.salon.reservation.booking.domain.model.BookingSearchCriteria;
import personal.salon.reservation.booking.domain.model.PageResult;
import personal.salon.reservation.booking.domain.model.Pagination;

/**
 * Search Bookings UseCase (Input Port)
 */
public interface SearchBookingsUseCase {

    Result<PageResult<Booking>> searchBookings(BookingSearchCriteria criteria, Pagination pagination);
}
