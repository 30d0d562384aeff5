package personal.salon.reservation.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.Result;
import personal.salon.reservation.booking.application.port.out.ReservationRepository;
import personal.salon.reservation.booking.domain.model.PageResult;
import personal.salon.reservation.booking.domain.model.Pagination;
import personal.salon.reservation.booking.domain.model.Reservation;
import personal.salon.reservation.booking.domain.model.ReservationSearchCriteria;
import personal.salon.reservation.booking.domain.model.ReservationStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Reservation Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 * 변경 저장은 도메인 스냅샷의 version 과 @Version 으로 보호되어, 오래된 스냅샷의 쓰기는 거절된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationPersistenceAdapter implements ReservationRepository {

    private static final String CONCURRENT_MODIFICATION = "Reservation was modified concurrently, please reload";

    private final JpaReservationRepository jpaReservationRepository;

    @Override
    public Result<Reservation> findById(UUID reservationId) {
        log.debug("Finding reservation: reservationId={}", reservationId);
        return execute("find reservation", () -> jpaReservationRepository.findById(reservationId)
                .map(entity -> Result.ok(entity.toDomain()))
                .orElseGet(() -> notFound(reservationId)));
    }

    @Override
    public Result<List<Reservation>> findAllById(Collection<UUID> reservationIds) {
        return execute("find reservations", () -> Result.ok(jpaReservationRepository.findAllById(reservationIds)
                .stream()
                .map(ReservationEntity::toDomain)
                .toList()));
    }

    @Override
    public Result<Reservation> create(Reservation reservation) {
        log.debug("Creating reservation: staffId={}, startTime={}", reservation.staffId(), reservation.startTime());
        return execute("create reservation", () -> {
            ReservationEntity saved = jpaReservationRepository.save(ReservationEntity.fromDomain(reservation));
            return Result.ok(saved.toDomain());
        });
    }

    @Override
    public Result<Reservation> update(Reservation reservation) {
        log.debug("Updating reservation: reservationId={}", reservation.id());
        return execute("update reservation", () -> {
            Optional<ReservationEntity> found = jpaReservationRepository.findById(reservation.id());
            if (found.isEmpty()) {
                return notFound(reservation.id());
            }
            ReservationEntity entity = found.get();
            if (entity.getStatus().isTerminal()) {
                return Result.err(ErrorCode.CANNOT_MODIFY,
                        String.format("Reservation in %s status cannot be modified. Reservation ID: %s",
                                entity.getStatus(), reservation.id()));
            }
            if (entity.isModifiedSince(reservation)) {
                return staleSnapshot(reservation.id());
            }
            entity.applyDetails(reservation);
            return Result.ok(jpaReservationRepository.save(entity).toDomain());
        });
    }

    @Override
    public Result<Reservation> confirm(Reservation confirmed) {
        return applyTransition(confirmed, ReservationStatus.CONFIRMED);
    }

    @Override
    public Result<Reservation> cancel(Reservation cancelled) {
        return applyTransition(cancelled, ReservationStatus.CANCELLED);
    }

    @Override
    public Result<Reservation> complete(Reservation completed) {
        return applyTransition(completed, ReservationStatus.COMPLETED);
    }

    @Override
    public Result<Reservation> markAsNoShow(Reservation noShow) {
        return applyTransition(noShow, ReservationStatus.NO_SHOW);
    }

    @Override
    public Result<PageResult<Reservation>> search(ReservationSearchCriteria criteria, Pagination pagination) {
        return execute("search reservations", () -> {
            PageRequest pageRequest = PageRequest.of(pagination.page(), pagination.size(),
                    Sort.by(Sort.Direction.ASC, "startTime"));
            Page<ReservationEntity> page = jpaReservationRepository.findAll(
                    ReservationSpecifications.matching(criteria), pageRequest);
            List<Reservation> items = page.getContent().stream()
                    .map(ReservationEntity::toDomain)
                    .toList();
            return Result.ok(new PageResult<>(items, page.getTotalElements(), pagination.page(), pagination.size()));
        });
    }

    @Override
    public Result<List<Reservation>> findByStaffAndDateRange(UUID staffId, LocalDateTime from, LocalDateTime to) {
        return execute("find staff reservations", () -> Result.ok(
                jpaReservationRepository.findByStaffInRange(staffId, from, to).stream()
                        .map(ReservationEntity::toDomain)
                        .toList()));
    }

    @Override
    public Result<Boolean> checkTimeSlotConflict(UUID staffId, LocalDateTime start, LocalDateTime end,
                                                 UUID excludeId) {
        return execute("check time slot conflict", () -> Result.ok(
                jpaReservationRepository.findOverlapping(staffId, start, end, ReservationStatus.CANCELLED).stream()
                        .anyMatch(entity -> excludeId == null || !excludeId.equals(entity.getId()))));
    }

    @Override
    public Result<Long> countByDate(LocalDate date, UUID salonId) {
        LocalDateTime from = date.atStartOfDay();
        LocalDateTime to = date.plusDays(1).atStartOfDay();
        return execute("count reservations", () -> Result.ok(salonId == null
                ? jpaReservationRepository.countByStartTimeGreaterThanEqualAndStartTimeLessThan(from, to)
                : jpaReservationRepository.countBySalonIdAndStartTimeGreaterThanEqualAndStartTimeLessThan(
                        salonId, from, to)));
    }

    /**
     * 저장소의 현재 상태 기준으로 전이를 다시 검사한 뒤 반영
     */
    private Result<Reservation> applyTransition(Reservation next, ReservationStatus target) {
        log.debug("Applying reservation transition: reservationId={}, target={}", next.id(), target);
        return execute("update reservation status", () -> {
            Optional<ReservationEntity> found = jpaReservationRepository.findById(next.id());
            if (found.isEmpty()) {
                return notFound(next.id());
            }
            ReservationEntity entity = found.get();
            if (!entity.getStatus().canTransitionTo(target)) {
                log.warn("Stale reservation transition: reservationId={}, current={}, target={}",
                        next.id(), entity.getStatus(), target);
                return Result.err(ErrorCode.INVALID_STATUS,
                        String.format("Reservation is already %s. Reservation ID: %s", entity.getStatus(), next.id()));
            }
            if (entity.isModifiedSince(next)) {
                return staleSnapshot(next.id());
            }
            entity.applyState(next);
            return Result.ok(jpaReservationRepository.save(entity).toDomain());
        });
    }

    private <T> Result<T> execute(String operation, Supplier<Result<T>> action) {
        try {
            return action.get();
        } catch (OptimisticLockingFailureException e) {
            log.warn("Concurrent reservation modification: operation={}", operation);
            return Result.err(ErrorCode.INVALID_STATUS, CONCURRENT_MODIFICATION);
        } catch (DataAccessException e) {
            log.error("Database error: operation={}", operation, e);
            return Result.err(ErrorCode.DATABASE_ERROR, e.getMessage());
        }
    }

    private static Result<Reservation> staleSnapshot(UUID reservationId) {
        log.warn("Stale reservation snapshot rejected: reservationId={}", reservationId);
        return Result.err(ErrorCode.INVALID_STATUS, CONCURRENT_MODIFICATION + ". Reservation ID: " + reservationId);
    }

    private static Result<Reservation> notFound(UUID reservationId) {
        return Result.err(ErrorCode.RESERVATION_NOT_FOUND, "Reservation not found: " + reservationId);
    }
}
