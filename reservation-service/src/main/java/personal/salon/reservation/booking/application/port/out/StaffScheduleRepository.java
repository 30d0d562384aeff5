package personal.salon.reservation.booking.application.port.out;

import personal.salon.common.result.Result;
import personal.salon.reservation.booking.domain.model.WorkingHours;

import java.time.DayOfWeek;
import java.util.Optional;
import java.util.UUID;

/**
 * Staff Schedule Repository (Output Port)
 * 직원 요일별 근무 시간 조회 (휴무일이면 empty)
 */
public interface StaffScheduleRepository {

    Result<Optional<WorkingHours>> findWorkingHours(UUID staffId, DayOfWeek dayOfWeek);
}
