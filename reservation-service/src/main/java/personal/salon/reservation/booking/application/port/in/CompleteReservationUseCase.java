package personal.salon.reservation.booking.application.port.in;

import personal.salon.common.result.Result;

/**
 * Complete Reservation UseCase (Input Port)
 */
public interface CompleteReservationUseCase {

    /**
     * 시술 완료 (CONFIRMED 에서만 가능)
     * 실제 종료 시각이 예정보다 늦으면 시술의 분당 초과 요금으로 계산
     */
    Result<CompletionOutcome> completeReservation(CompleteReservationCommand command);
}
