package personal.salon.reservation.booking.application.port.in;

import personal.salon.common.result.Result;
import personal.salon.reservation.booking.domain.model.AvailableSlot;

import java.util.List;

/**
 * Find Available Slots UseCase (Input Port)
 */
public interface FindAvailableSlotsUseCase {

    /**
     * 하루 예약 가능 슬롯 조회 (시간순, 캐시하지 않음)
     */
    Result<List<AvailableSlot>> findAvailableSlots(FindAvailableSlotsQuery query);
}
