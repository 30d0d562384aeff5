package personal.salon.reservation.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.DayOfWeek;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA Repository for Staff Working Hours
 */
public interface JpaStaffWorkingHoursRepository extends JpaRepository<StaffWorkingHoursEntity, Long> {

    Optional<StaffWorkingHoursEntity> findByStaffIdAndDayOfWeek(UUID staffId, DayOfWeek dayOfWeek);
}
