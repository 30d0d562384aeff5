package personal.salon.reservation.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.DomainError;
import personal.salon.common.result.FieldError;
import personal.salon.common.result.Result;
import personal.salon.reservation.booking.application.port.in.BookingCancellation;
import personal.salon.reservation.booking.application.port.in.BookingLifecycleUseCase;
import personal.salon.reservation.booking.application.port.in.CreateBookingCommand;
import personal.salon.reservation.booking.application.port.in.CreateBookingUseCase;
import personal.salon.reservation.booking.application.port.in.GetBookingUseCase;
import personal.salon.reservation.booking.application.port.in.SearchBookingsUseCase;
import personal.salon.reservation.booking.application.port.in.UpdateBookingCommand;
import personal.salon.reservation.booking.application.port.in.UpdateBookingUseCase;
import personal.salon.reservation.booking.application.port.out.BookingRepository;
import personal.salon.reservation.booking.application.port.out.ReservationEventPublisher;
import personal.salon.reservation.booking.application.port.out.ReservationRepository;
import personal.salon.reservation.booking.domain.model.Booking;
import personal.salon.reservation.booking.domain.model.BookingSearchCriteria;
import personal.salon.reservation.booking.domain.model.LifecycleEvent;
import personal.salon.reservation.booking.domain.model.LifecycleEventType;
import personal.salon.reservation.booking.domain.model.PageResult;
import personal.salon.reservation.booking.domain.model.Pagination;
import personal.salon.reservation.booking.domain.model.PaymentMethod;
import personal.salon.reservation.booking.domain.model.Reservation;
import personal.salon.reservation.booking.domain.policy.CancellationPolicy;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Booking Service
 * 부킹(결제 단위) 생성, 조회, 변경, 상태/결제 전이
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService implements CreateBookingUseCase, GetBookingUseCase, SearchBookingsUseCase,
        UpdateBookingUseCase, BookingLifecycleUseCase {

    private final BookingRepository bookingRepository;
    private final ReservationRepository reservationRepository;
    private final ReservationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public Result<Booking> createBooking(CreateBookingCommand command) {
        log.info("Create booking: salonId={}, customerId={}, reservations={}",
                command.salonId(), command.customerId(), command.reservationIds());
        LocalDateTime now = LocalDateTime.now(clock);

        Result<Booking> draft = Booking.create(
                UUID.randomUUID(),
                command.salonId(),
                command.customerId(),
                command.reservationIds(),
                command.totalAmount(),
                command.discountAmount(),
                command.paymentMethod(),
                command.notes(),
                command.actor(),
                now);
        if (draft.isErr()) {
            return draft;
        }

        Result<List<Reservation>> reservations = reservationRepository.findAllById(command.reservationIds())
                .mapError(RepositoryFailures.wrap("Failed to load reservations"));
        if (reservations.isErr()) {
            return reservations.cast();
        }

        Set<UUID> found = reservations.value().stream()
                .map(Reservation::id)
                .collect(Collectors.toSet());
        List<UUID> missing = command.reservationIds().stream()
                .filter(id -> !found.contains(id))
                .toList();
        if (!missing.isEmpty()) {
            log.warn("Booking references missing reservations: {}", missing);
            return Result.err(ErrorCode.RESERVATION_NOT_FOUND, "Reservations not found: " + missing);
        }

        List<FieldError> ownershipErrors = reservations.value().stream()
                .filter(reservation -> !command.customerId().equals(reservation.customerId())
                        || !command.salonId().equals(reservation.salonId()))
                .map(reservation -> new FieldError("reservationIds",
                        "Reservation " + reservation.id() + " belongs to another customer or salon"))
                .toList();
        if (!ownershipErrors.isEmpty()) {
            return Result.err(DomainError.validation(ownershipErrors));
        }

        Result<Booking> created = bookingRepository.create(draft.value())
                .mapError(RepositoryFailures.wrap("Failed to create booking"));
        return published(created, LifecycleEventType.BOOKING_CREATED);
    }

    @Override
    public Result<Booking> getBooking(UUID bookingId) {
        return load(bookingId).mapError(RepositoryFailures.wrap("Failed to load booking"));
    }

    @Override
    public Result<List<Booking>> getBookingsByCustomer(UUID customerId) {
        if (customerId == null) {
            return Result.err(ErrorCode.INVALID_INPUT, "Customer ID is required");
        }
        return bookingRepository.findByCustomer(customerId)
                .mapError(RepositoryFailures.wrap("Failed to load bookings"));
    }

    @Override
    public Result<PageResult<Booking>> searchBookings(BookingSearchCriteria criteria, Pagination pagination) {
        if (criteria == null || pagination == null) {
            return Result.err(ErrorCode.INVALID_INPUT, "Search criteria and pagination are required");
        }
        if (criteria.createdFrom() != null && criteria.createdTo() != null
                && criteria.createdFrom().isAfter(criteria.createdTo())) {
            return Result.err(ErrorCode.INVALID_TIME_RANGE, "createdFrom must not be after createdTo");
        }
        if (criteria.minAmount() != null && criteria.maxAmount() != null
                && criteria.minAmount() > criteria.maxAmount()) {
            return Result.err(ErrorCode.INVALID_AMOUNT, "minAmount must not exceed maxAmount");
        }
        return bookingRepository.search(criteria, pagination)
                .mapError(RepositoryFailures.wrap("Failed to search bookings"));
    }

    @Override
    public Result<Booking> updateBooking(UpdateBookingCommand command) {
        log.info("Update booking: bookingId={}, actor={}", command.bookingId(), command.actor());
        return transition(command.bookingId(),
                booking -> booking.update(command.toChanges(), command.actor(), LocalDateTime.now(clock)),
                bookingRepository::update, LifecycleEventType.BOOKING_UPDATED);
    }

    @Override
    public Result<Booking> addReservation(UUID bookingId, UUID reservationId, String actor) {
        log.info("Add reservation to booking: bookingId={}, reservationId={}", bookingId, reservationId);
        Result<Booking> existing = load(bookingId).mapError(RepositoryFailures.wrap("Failed to load booking"));
        if (existing.isErr()) {
            return existing;
        }
        Booking booking = existing.value();

        if (reservationId != null) {
            Result<Reservation> reservation = reservationRepository.findById(reservationId)
                    .mapError(RepositoryFailures.wrap("Failed to load reservation"));
            if (reservation.isErr()) {
                return reservation.cast();
            }
            if (!booking.customerId().equals(reservation.value().customerId())
                    || !booking.salonId().equals(reservation.value().salonId())) {
                return Result.err(DomainError.validation(List.of(new FieldError("reservationId",
                        "Reservation " + reservationId + " belongs to another customer or salon"))));
            }
        }

        Result<Booking> updated = booking.addReservation(reservationId, actor, LocalDateTime.now(clock))
                .flatMap(bookingRepository::update)
                .mapError(RepositoryFailures.wrap("Failed to update booking"));
        return published(updated, LifecycleEventType.BOOKING_UPDATED);
    }

    @Override
    public Result<Booking> removeReservation(UUID bookingId, UUID reservationId, String actor) {
        log.info("Remove reservation from booking: bookingId={}, reservationId={}", bookingId, reservationId);
        return transition(bookingId,
                booking -> booking.removeReservation(reservationId, actor, LocalDateTime.now(clock)),
                bookingRepository::update, LifecycleEventType.BOOKING_UPDATED);
    }

    @Override
    public Result<Booking> confirmBooking(UUID bookingId, String actor) {
        log.info("Confirm booking: bookingId={}, actor={}", bookingId, actor);
        return transition(bookingId, booking -> booking.confirm(actor, LocalDateTime.now(clock)),
                bookingRepository::confirm, LifecycleEventType.BOOKING_CONFIRMED);
    }

    @Override
    public Result<BookingCancellation> cancelBooking(UUID bookingId, String reason, String actor) {
        log.info("Cancel booking: bookingId={}, actor={}", bookingId, actor);
        if (reason == null || reason.isBlank()) {
            return Result.err(ErrorCode.INVALID_REQUEST, "Cancellation reason is required");
        }
        LocalDateTime now = LocalDateTime.now(clock);

        Result<Booking> existing = load(bookingId).mapError(RepositoryFailures.wrap("Failed to load booking"));
        if (existing.isErr()) {
            return existing.cast();
        }
        Booking booking = existing.value();

        long paidAmount = booking.paidAmount();
        long refund = 0;
        if (paidAmount > 0) {
            Result<List<Reservation>> reservations = reservationRepository.findAllById(booking.reservationIds())
                    .mapError(RepositoryFailures.wrap("Failed to load reservations"));
            if (reservations.isErr()) {
                return reservations.cast();
            }
            refund = reservations.value().stream()
                    .map(Reservation::startTime)
                    .min(Comparator.naturalOrder())
                    .map(earliestStart -> CancellationPolicy.refund(paidAmount, earliestStart, now))
                    .orElse(0L);
        }

        long refundAmount = refund;
        Result<Booking> cancelled = booking.cancel(actor, reason, refundAmount, now)
                .flatMap(bookingRepository::cancel)
                .mapError(RepositoryFailures.wrap("Failed to cancel booking"));
        return published(cancelled, LifecycleEventType.BOOKING_CANCELLED)
                .map(saved -> new BookingCancellation(saved, paidAmount, refundAmount, paidAmount - refundAmount));
    }

    @Override
    public Result<Booking> completeBooking(UUID bookingId, String actor) {
        log.info("Complete booking: bookingId={}, actor={}", bookingId, actor);
        return transition(bookingId, booking -> booking.complete(actor, LocalDateTime.now(clock)),
                bookingRepository::complete, LifecycleEventType.BOOKING_COMPLETED);
    }

    @Override
    public Result<Booking> markBookingAsNoShow(UUID bookingId, String actor) {
        log.info("Mark booking as no-show: bookingId={}, actor={}", bookingId, actor);
        return transition(bookingId, booking -> booking.markAsNoShow(actor, LocalDateTime.now(clock)),
                bookingRepository::markAsNoShow, LifecycleEventType.BOOKING_NO_SHOW);
    }

    @Override
    public Result<Booking> recordPayment(UUID bookingId, PaymentMethod paymentMethod, String actor) {
        log.info("Record booking payment: bookingId={}, method={}", bookingId, paymentMethod);
        return transition(bookingId,
                booking -> booking.recordPayment(paymentMethod, actor, LocalDateTime.now(clock)),
                bookingRepository::updatePaymentStatus, LifecycleEventType.BOOKING_PAYMENT_RECORDED);
    }

    @Override
    public Result<Booking> markPaymentFailed(UUID bookingId, String actor) {
        log.info("Mark booking payment failed: bookingId={}", bookingId);
        Result<Booking> failed = load(bookingId)
                .flatMap(booking -> booking.markPaymentFailed(actor, LocalDateTime.now(clock)))
                .flatMap(bookingRepository::updatePaymentStatus)
                .mapError(RepositoryFailures.wrap("Failed to update payment status"));
        if (failed.isErr()) {
            log.warn("Payment failure not recorded: bookingId={}, code={}", bookingId, failed.error().code());
        }
        return failed;
    }

    private Result<Booking> transition(UUID bookingId,
                                       Function<Booking, Result<Booking>> domainTransition,
                                       Function<Booking, Result<Booking>> persist,
                                       LifecycleEventType eventType) {
        Result<Booking> result = load(bookingId)
                .flatMap(domainTransition)
                .flatMap(persist)
                .mapError(RepositoryFailures.wrap("Failed to update booking"));
        return published(result, eventType);
    }

    private Result<Booking> load(UUID bookingId) {
        if (bookingId == null) {
            return Result.err(ErrorCode.INVALID_INPUT, "Booking ID is required");
        }
        return bookingRepository.findById(bookingId);
    }

    private Result<Booking> published(Result<Booking> result, LifecycleEventType type) {
        if (result.isErr()) {
            log.warn("Booking operation rejected: type={}, code={}, message={}",
                    type, result.error().code(), result.error().message());
            return result;
        }
        eventPublisher.publish(LifecycleEvent.of(type, result.value()));
        return result;
    }
}
