package personal.salon.reservation.booking.application.port.in;

import personal.salon.common.result.Result;
import personal.salon.reservation.booking.domain.model.Reservation;

/**
 * Create Reservation UseCase (Input Port)
 * 예약 생성 유스케이스
 */
public interface CreateReservationUseCase {

    /**
     * 예약 생성
     * 입력 검증 -> 시술 조회 -> (직원 락 안에서) 충돌 검사 -> 저장
     *
     * @return 생성된 예약 또는 INVALID_TIME_RANGE, PAST_TIME_NOT_ALLOWED, INVALID_AMOUNT,
     * SERVICE_NOT_FOUND, SLOT_CONFLICT, SLOT_NOT_AVAILABLE, VALIDATION_FAILED
     */
    Result<Reservation> createReservation(CreateReservationCommand command);
}
