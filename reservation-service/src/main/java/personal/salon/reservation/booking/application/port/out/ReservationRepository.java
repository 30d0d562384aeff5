package personal.salon.reservation.booking.application.port.out;

import personal.salon.common.result.Result;
import personal.salon.reservation.booking.domain.model.PageResult;
import personal.salon.reservation.booking.domain.model.Pagination;
import personal.salon.reservation.booking.domain.model.Reservation;
import personal.salon.reservation.booking.domain.model.ReservationSearchCriteria;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Reservation Repository (Output Port)
 * 모든 실패는 Result 로 반환 (RESERVATION_NOT_FOUND, DATABASE_ERROR, INVALID_STATUS)
 * 상태 전이 저장은 저장소의 현재 상태가 전이 표상 허용될 때만 반영된다.
 */
public interface ReservationRepository {

    Result<Reservation> findById(UUID reservationId);

    Result<List<Reservation>> findAllById(Collection<UUID> reservationIds);

    Result<Reservation> create(Reservation reservation);

    /**
     * 예약 내용 변경 저장 (시간, 담당자, 금액, 메모, 결제 여부)
     */
    Result<Reservation> update(Reservation reservation);

    Result<Reservation> confirm(Reservation confirmed);

    Result<Reservation> cancel(Reservation cancelled);

    Result<Reservation> complete(Reservation completed);

    Result<Reservation> markAsNoShow(Reservation noShow);

    Result<PageResult<Reservation>> search(ReservationSearchCriteria criteria, Pagination pagination);

    /**
     * [from, to) 구간과 겹치는 직원 예약 (취소 포함, 시작 시각 순)
     */
    Result<List<Reservation>> findByStaffAndDateRange(UUID staffId, LocalDateTime from, LocalDateTime to);

    /**
     * 취소되지 않은 예약 중 [start, end) 와 겹치는 것이 있는지 확인
     *
     * @param excludeId 변경 중인 예약 자신 (없으면 null)
     */
    Result<Boolean> checkTimeSlotConflict(UUID staffId, LocalDateTime start, LocalDateTime end, UUID excludeId);

    /**
     * 해당 날짜에 시작하는 예약 수
     *
     * @param salonId null 이면 전체
     */
    Result<Long> countByDate(LocalDate date, UUID salonId);
}
