package personal.salon.reservation.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.Result;
import personal.salon.reservation.booking.application.config.ReservationPolicyProperties;
import personal.salon.reservation.booking.application.port.in.CancelReservationCommand;
import personal.salon.reservation.booking.application.port.in.CancelReservationUseCase;
import personal.salon.reservation.booking.application.port.in.CancellationOutcome;
import personal.salon.reservation.booking.application.port.in.CompleteReservationCommand;
import personal.salon.reservation.booking.application.port.in.CompleteReservationUseCase;
import personal.salon.reservation.booking.application.port.in.CompletionOutcome;
import personal.salon.reservation.booking.application.port.in.ConfirmReservationUseCase;
import personal.salon.reservation.booking.application.port.in.MarkNoShowUseCase;
import personal.salon.reservation.booking.application.port.out.ReservationEventPublisher;
import personal.salon.reservation.booking.application.port.out.ReservationRepository;
import personal.salon.reservation.booking.application.port.out.ServiceRepository;
import personal.salon.reservation.booking.domain.model.LifecycleEvent;
import personal.salon.reservation.booking.domain.model.LifecycleEventType;
import personal.salon.reservation.booking.domain.model.Reservation;
import personal.salon.reservation.booking.domain.model.ServiceOffering;
import personal.salon.reservation.booking.domain.policy.CancellationPolicy;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Reservation Status Service
 * 예약 상태 전이 (확정, 취소, 완료, 노쇼)
 * 조회 -> 도메인 전이 검사 -> 저장소 단일 쓰기 -> 이벤트 발행
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationStatusService implements ConfirmReservationUseCase, CancelReservationUseCase,
        CompleteReservationUseCase, MarkNoShowUseCase {

    private final ReservationRepository reservationRepository;
    private final ServiceRepository serviceRepository;
    private final ReservationEventPublisher eventPublisher;
    private final ReservationPolicyProperties policy;
    private final Clock clock;

    @Override
    public Result<Reservation> confirmReservation(UUID reservationId, String actor) {
        log.info("Confirm reservation: reservationId={}, actor={}", reservationId, actor);
        LocalDateTime now = LocalDateTime.now(clock);

        Result<Reservation> confirmed = load(reservationId)
                .flatMap(reservation -> reservation.confirm(actor, now))
                .flatMap(reservationRepository::confirm)
                .mapError(RepositoryFailures.wrap("Failed to confirm reservation"));

        return published(confirmed, LifecycleEventType.RESERVATION_CONFIRMED);
    }

    @Override
    public Result<CancellationOutcome> cancelReservation(CancelReservationCommand command) {
        log.info("Cancel reservation: reservationId={}, actor={}", command.reservationId(), command.actor());
        if (command.reason() == null || command.reason().isBlank()) {
            return Result.err(ErrorCode.INVALID_REQUEST, "Cancellation reason is required");
        }
        LocalDateTime now = LocalDateTime.now(clock);

        Result<Reservation> cancelled = load(command.reservationId())
                .flatMap(reservation -> reservation.cancel(
                        command.actor(), command.reason(), now, policy.cancellationLeadTime()))
                .flatMap(reservationRepository::cancel)
                .mapError(RepositoryFailures.wrap("Failed to cancel reservation"));

        return published(cancelled, LifecycleEventType.RESERVATION_CANCELLED)
                .map(reservation -> {
                    long paidAmount = reservation.paidAmount();
                    long refund = CancellationPolicy.refund(paidAmount, reservation.startTime(), now);
                    log.info("Reservation refund calculated: reservationId={}, paid={}, refund={}",
                            reservation.id(), paidAmount, refund);
                    return new CancellationOutcome(reservation, paidAmount, refund, paidAmount - refund);
                });
    }

    @Override
    public Result<CompletionOutcome> completeReservation(CompleteReservationCommand command) {
        log.info("Complete reservation: reservationId={}, actualEndTime={}",
                command.reservationId(), command.actualEndTime());
        LocalDateTime now = LocalDateTime.now(clock);

        Result<Reservation> transitioned = load(command.reservationId())
                .flatMap(reservation -> reservation.complete(command.actor(), now));
        if (transitioned.isErr()) {
            return transitioned.cast();
        }
        Reservation completed = transitioned.value();

        long overtimeCharge = 0;
        if (command.actualEndTime() != null && command.actualEndTime().isAfter(completed.endTime())) {
            Result<ServiceOffering> service = serviceRepository.findById(completed.serviceId())
                    .mapError(RepositoryFailures.wrap("Failed to load service"));
            if (service.isErr()) {
                return service.cast();
            }
            overtimeCharge = CancellationPolicy.overtimeCharge(
                    command.actualEndTime(), completed.endTime(), service.value().overtimeRatePerMinute());
        }

        long charge = overtimeCharge;
        Result<Reservation> saved = reservationRepository.complete(completed)
                .mapError(RepositoryFailures.wrap("Failed to complete reservation"));
        return published(saved, LifecycleEventType.RESERVATION_COMPLETED)
                .map(reservation -> new CompletionOutcome(reservation, charge));
    }

    @Override
    public Result<Reservation> markAsNoShow(UUID reservationId, String actor) {
        log.info("Mark reservation as no-show: reservationId={}, actor={}", reservationId, actor);
        LocalDateTime now = LocalDateTime.now(clock);

        Result<Reservation> noShow = load(reservationId)
                .flatMap(reservation -> reservation.markAsNoShow(actor, now))
                .flatMap(reservationRepository::markAsNoShow)
                .mapError(RepositoryFailures.wrap("Failed to mark reservation as no-show"));

        return published(noShow, LifecycleEventType.RESERVATION_NO_SHOW);
    }

    private Result<Reservation> load(UUID reservationId) {
        if (reservationId == null) {
            return Result.err(ErrorCode.INVALID_INPUT, "Reservation ID is required");
        }
        return reservationRepository.findById(reservationId);
    }

    private Result<Reservation> published(Result<Reservation> result, LifecycleEventType type) {
        if (result.isErr()) {
            log.warn("Reservation transition rejected: type={}, code={}, message={}",
                    type, result.error().code(), result.error().message());
            return result;
        }
        log.info("Reservation transitioned: reservationId={}, status={}", result.value().id(), result.value().status());
        eventPublisher.publish(LifecycleEvent.of(type, result.value()));
        return result;
    }
}
