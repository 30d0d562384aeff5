package personal.salon.reservation.booking.application.port.in;

import personal.salon.common.result.Result;
import personal.salon.reservation.booking.domain.model.Booking;

/**
 * Create Booking UseCase (Input Port)
 */
public interface CreateBookingUseCase {

    /**
     * 부킹 생성
     * 예약 ID 는 모두 존재해야 하며 (RESERVATION_NOT_FOUND), 같은 고객/살롱의 예약이어야 한다.
     */
    Result<Booking> createBooking(CreateBookingCommand command);
}
