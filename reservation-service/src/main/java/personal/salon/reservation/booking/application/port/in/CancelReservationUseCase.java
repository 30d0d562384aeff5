package personal.salon.reservation.booking.application.port.in;

import personal.salon.common.result.Result;

/**
 * Cancel Reservation UseCase (Input Port)
 */
public interface CancelReservationUseCase {

    /**
     * 예약 취소
     * 사유 누락 INVALID_REQUEST, 종료 상태이거나 시작 1시간 전 이후면 CANNOT_CANCEL
     */
    Result<CancellationOutcome> cancelReservation(CancelReservationCommand command);
}
