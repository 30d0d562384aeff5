package personal.salon.reservation.booking.application.port.in;

import personal.salon.common.result.Result;
import personal.salon.reservation.booking.domain.model.Booking;

import java.util.UUID;

/**
 * Update Booking UseCase (Input Port)
 * 결제 전 부킹의 메모/할인/결제 수단 변경과 예약 추가/제외
 */
public interface UpdateBookingUseCase {

    Result<Booking> updateBooking(UpdateBookingCommand command);

    /**
     * 예약 추가
     * 같은 고객, 같은 살롱의 예약만 추가할 수 있다.
     */
    Result<Booking> addReservation(UUID bookingId, UUID reservationId, String actor);

    Result<Booking> removeReservation(UUID bookingId, UUID reservationId, String actor);
}
