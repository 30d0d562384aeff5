package personal.salon.reservation.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;
import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.Result;
import personal.salon.reservation.booking.application.port.out.BookingRepository;
import personal.salon.reservation.booking.domain.model.Booking;
import personal.salon.reservation.booking.domain.model.BookingSearchCriteria;
import personal.salon.reservation.booking.domain.model.BookingStatus;
import personal.salon.reservation.booking.domain.model.PageResult;
import personal.salon.reservation.booking.domain.model.Pagination;
import personal.salon.reservation.booking.domain.model.PaymentStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Booking Persistence Adapter
 * JPA를 사용한 부킹 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingPersistenceAdapter implements BookingRepository {

    private static final String CONCURRENT_MODIFICATION = "Booking was modified concurrently, please reload";

    private final JpaBookingRepository jpaBookingRepository;
    private final JpaReservationRepository jpaReservationRepository;
    private final TransactionTemplate transactionTemplate;

    @Override
    public Result<Booking> findById(UUID bookingId) {
        log.debug("Finding booking: bookingId={}", bookingId);
        return execute("find booking", () -> jpaBookingRepository.findById(bookingId)
                .map(entity -> Result.ok(entity.toDomain()))
                .orElseGet(() -> notFound(bookingId)));
    }

    @Override
    public Result<List<Booking>> findByCustomer(UUID customerId) {
        return execute("find customer bookings", () -> Result.ok(
                jpaBookingRepository.findByCustomerIdOrderByCreatedAtDesc(customerId).stream()
                        .map(BookingEntity::toDomain)
                        .toList()));
    }

    @Override
    public Result<Booking> create(Booking booking) {
        log.debug("Creating booking: customerId={}, reservations={}", booking.customerId(), booking.reservationIds());
        return execute("create booking",
                () -> Result.ok(jpaBookingRepository.save(BookingEntity.fromDomain(booking)).toDomain()));
    }

    @Override
    public Result<Booking> update(Booking booking) {
        log.debug("Updating booking: bookingId={}, reservations={}", booking.id(), booking.reservationIds());
        return execute("update booking", () -> {
            Optional<BookingEntity> found = jpaBookingRepository.findById(booking.id());
            if (found.isEmpty()) {
                return notFound(booking.id());
            }
            BookingEntity entity = found.get();
            if (entity.getStatus().isTerminal()) {
                return Result.err(ErrorCode.INVALID_STATUS,
                        String.format("Booking is already %s. Booking ID: %s", entity.getStatus(), booking.id()));
            }
            if (entity.isModifiedSince(booking)) {
                return staleSnapshot(booking.id());
            }
            entity.applyDetails(booking);
            return Result.ok(jpaBookingRepository.saveAndFlush(entity).toDomain());
        });
    }

    @Override
    public Result<PageResult<Booking>> search(BookingSearchCriteria criteria, Pagination pagination) {
        return execute("search bookings", () -> {
            PageRequest pageRequest = PageRequest.of(pagination.page(), pagination.size(),
                    Sort.by(Sort.Direction.DESC, "createdAt"));
            Page<BookingEntity> page = jpaBookingRepository.findAll(
                    BookingSpecifications.matching(criteria), pageRequest);
            List<Booking> items = page.getContent().stream()
                    .map(BookingEntity::toDomain)
                    .toList();
            return Result.ok(new PageResult<>(items, page.getTotalElements(), pagination.page(), pagination.size()));
        });
    }

    @Override
    public Result<Booking> confirm(Booking confirmed) {
        return applyTransition(confirmed, BookingStatus.CONFIRMED);
    }

    @Override
    public Result<Booking> cancel(Booking cancelled) {
        return applyTransition(cancelled, BookingStatus.CANCELLED);
    }

    @Override
    public Result<Booking> complete(Booking completed) {
        return applyTransition(completed, BookingStatus.COMPLETED);
    }

    @Override
    public Result<Booking> markAsNoShow(Booking noShow) {
        return applyTransition(noShow, BookingStatus.NO_SHOW);
    }

    /**
     * 결제 상태 저장
     * PAID 로 바뀌면 같은 트랜잭션에서 포함된 예약들의 결제 여부도 함께 갱신한다.
     */
    @Override
    public Result<Booking> updatePaymentStatus(Booking booking) {
        log.debug("Updating booking payment: bookingId={}, paymentStatus={}", booking.id(), booking.paymentStatus());
        return execute("update booking payment", () -> transactionTemplate.execute(status -> {
            Optional<BookingEntity> found = jpaBookingRepository.findById(booking.id());
            if (found.isEmpty()) {
                return notFound(booking.id());
            }
            BookingEntity entity = found.get();
            if (entity.isModifiedSince(booking)) {
                return staleSnapshot(booking.id());
            }
            entity.applyPayment(booking);
            if (booking.paymentStatus() == PaymentStatus.PAID) {
                jpaReservationRepository.findAllById(booking.reservationIds())
                        .forEach(reservation -> reservation.markPaid(booking.updatedBy(), booking.updatedAt()));
            }
            return Result.ok(jpaBookingRepository.saveAndFlush(entity).toDomain());
        }));
    }

    private Result<Booking> applyTransition(Booking next, BookingStatus target) {
        log.debug("Applying booking transition: bookingId={}, target={}", next.id(), target);
        return execute("update booking status", () -> {
            Optional<BookingEntity> found = jpaBookingRepository.findById(next.id());
            if (found.isEmpty()) {
                return notFound(next.id());
            }
            BookingEntity entity = found.get();
            if (!entity.getStatus().canTransitionTo(target)) {
                log.warn("Stale booking transition: bookingId={}, current={}, target={}",
                        next.id(), entity.getStatus(), target);
                return Result.err(ErrorCode.INVALID_STATUS,
                        String.format("Booking is already %s. Booking ID: %s", entity.getStatus(), next.id()));
            }
            if (entity.isModifiedSince(next)) {
                return staleSnapshot(next.id());
            }
            entity.applyState(next);
            return Result.ok(jpaBookingRepository.save(entity).toDomain());
        });
    }

    private <T> Result<T> execute(String operation, Supplier<Result<T>> action) {
        try {
            return action.get();
        } catch (OptimisticLockingFailureException e) {
            log.warn("Concurrent booking modification: operation={}", operation);
            return Result.err(ErrorCode.INVALID_STATUS, CONCURRENT_MODIFICATION);
        } catch (DataAccessException e) {
            log.error("Database error: operation={}", operation, e);
            return Result.err(ErrorCode.DATABASE_ERROR, e.getMessage());
        }
    }

    private static Result<Booking> staleSnapshot(UUID bookingId) {
        log.warn("Stale booking snapshot: bookingId={}", bookingId);
        return Result.err(ErrorCode.INVALID_STATUS, CONCURRENT_MODIFICATION + ". Booking ID: " + bookingId);
    }

    private static Result<Booking> notFound(UUID bookingId) {
        return Result.err(ErrorCode.BOOKING_NOT_FOUND, "Booking not found: " + bookingId);
    }
}
