package personal.salon.reservation.booking.application.port.out;

import personal.salon.common.result.Result;
import personal.salon.reservation.booking.domain.model.Booking;
import personal.salon.reservation.booking.domain.model.BookingSearchCriteria;
import personal.salon.reservation.booking.domain.model.PageResult;
import personal.salon.reservation.booking.domain.model.Pagination;

import java.util.List;
import java.util.UUID;

/**
 * Booking Repository (Output Port)
 */
public interface BookingRepository {

    Result<Booking> findById(UUID bookingId);

    Result<List<Booking>> findByCustomer(UUID customerId);

    Result<Booking> create(Booking booking);

    /**
     * 내용 변경 저장 (메모, 할인, 결제 수단, 예약 목록)
     * 조회 이후 다른 변경이 있었으면 INVALID_STATUS 로 거절한다.
     */
    Result<Booking> update(Booking booking);

    Result<PageResult<Booking>> search(BookingSearchCriteria criteria, Pagination pagination);

    Result<Booking> confirm(Booking confirmed);

    Result<Booking> cancel(Booking cancelled);

    Result<Booking> complete(Booking completed);

    Result<Booking> markAsNoShow(Booking noShow);

    Result<Booking> updatePaymentStatus(Booking booking);
}
