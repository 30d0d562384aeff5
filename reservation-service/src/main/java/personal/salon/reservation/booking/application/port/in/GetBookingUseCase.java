package personal.salon.reservation.booking.application.port.in;

import personal.salon.common.result.Result;
import personal.salon.reservation.booking.domain.model.Booking;

import java.util.List;
import java.util.UUID;

/**
 * Get Booking UseCase (Input Port)
 */
public interface GetBookingUseCase {

    Result<Booking> getBooking(UUID bookingId);

    Result<List<Booking>> getBookingsByCustomer(UUID customerId);
}
