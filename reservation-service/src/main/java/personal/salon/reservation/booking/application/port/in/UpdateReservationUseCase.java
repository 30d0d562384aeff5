package personal.salon.reservation.booking.application.port.in;

import personal.salon.common.result.Result;
import personal.salon.reservation.booking.domain.model.Reservation;

/**
 * Update Reservation UseCase (Input Port)
 */
public interface UpdateReservationUseCase {

    /**
     * 예약 변경
     * 종료 상태면 CANNOT_MODIFY, 시간/담당자 변경 시 자기 자신을 제외하고 충돌 재검사
     */
    Result<Reservation> updateReservation(UpdateReservationCommand command);
}
