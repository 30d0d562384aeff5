package personal.salon.reservation.booking.application.port.in;

import personal.salon.common.result.Result;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Count Reservations UseCase (Input Port)
 */
public interface CountReservationsUseCase {

    /**
     * 날짜별 예약 수 (salonId 가 null 이면 전체)
     */
    Result<Long> countByDate(LocalDate date, UUID salonId);
}
