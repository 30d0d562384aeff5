package personal.salon.reservation.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.Result;
import personal.salon.reservation.booking.application.port.out.StaffScheduleRepository;
import personal.salon.reservation.booking.domain.model.WorkingHours;

import java.time.DayOfWeek;
import java.util.Optional;
import java.util.UUID;

/**
 * Staff Schedule Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaffSchedulePersistenceAdapter implements StaffScheduleRepository {

    private final JpaStaffWorkingHoursRepository jpaStaffWorkingHoursRepository;

    @Override
    public Result<Optional<WorkingHours>> findWorkingHours(UUID staffId, DayOfWeek dayOfWeek) {
        log.debug("Finding working hours: staffId={}, dayOfWeek={}", staffId, dayOfWeek);
        try {
            return Result.ok(jpaStaffWorkingHoursRepository.findByStaffIdAndDayOfWeek(staffId, dayOfWeek)
                    .map(StaffWorkingHoursEntity::toDomain));
        } catch (DataAccessException e) {
            log.error("Database error while finding working hours: staffId={}", staffId, e);
            return Result.err(ErrorCode.DATABASE_ERROR, e.getMessage());
        }
    }
}
