package personal.salon.reservation.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.salon.reservation.booking.domain.model.ReservationStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA Repository for Reservation
 */
public interface JpaReservationRepository extends JpaRepository<ReservationEntity, UUID>,
        JpaSpecificationExecutor<ReservationEntity> {

    /**
     * 반열림 구간 [start, end) 와 겹치는 직원 예약 (제외 상태 제외)
     */
    @Query("""
            select r from ReservationEntity r
            where r.staffId = :staffId
              and r.status <> :excluded
              and r.startTime < :end
              and r.endTime > :start
            """)
    List<ReservationEntity> findOverlapping(@Param("staffId") UUID staffId,
                                            @Param("start") LocalDateTime start,
                                            @Param("end") LocalDateTime end,
                                            @Param("excluded") ReservationStatus excluded);

    @Query("""
            select r from ReservationEntity r
            where r.staffId = :staffId
              and r.startTime < :to
              and r.endTime > :from
            order by r.startTime
            """)
    List<ReservationEntity> findByStaffInRange(@Param("staffId") UUID staffId,
                                               @Param("from") LocalDateTime from,
                                               @Param("to") LocalDateTime to);

    long countByStartTimeGreaterThanEqualAndStartTimeLessThan(LocalDateTime from, LocalDateTime to);

    long countBySalonIdAndStartTimeGreaterThanEqualAndStartTimeLessThan(UUID salonId, LocalDateTime from,
                                                                         LocalDateTime to);
}
