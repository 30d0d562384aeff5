package personal.salon.reservation.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.Result;
import personal.salon.reservation.booking.application.config.ReservationPolicyProperties;
import personal.salon.reservation.booking.application.port.in.CreateReservationCommand;
import personal.salon.reservation.booking.application.port.in.CreateReservationUseCase;
import personal.salon.reservation.booking.application.port.in.UpdateReservationCommand;
import personal.salon.reservation.booking.application.port.in.UpdateReservationUseCase;
import personal.salon.reservation.booking.application.port.out.ReservationEventPublisher;
import personal.salon.reservation.booking.application.port.out.ReservationRepository;
import personal.salon.reservation.booking.application.port.out.ServiceRepository;
import personal.salon.reservation.booking.domain.model.LifecycleEvent;
import personal.salon.reservation.booking.domain.model.LifecycleEventType;
import personal.salon.reservation.booking.domain.model.Reservation;
import personal.salon.reservation.booking.domain.model.ReservationChanges;
import personal.salon.reservation.booking.domain.model.ServiceOffering;
import personal.salon.reservation.booking.domain.model.TimeRange;
import personal.salon.reservation.booking.domain.policy.ReservationValidator;
import personal.salon.reservation.booking.domain.service.ReservationSlotManager;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Reservation Command Service
 * 예약 생성/변경 (직원 일정을 점유하는 쓰기)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationCommandService implements CreateReservationUseCase, UpdateReservationUseCase {

    private final ServiceRepository serviceRepository;
    private final ReservationRepository reservationRepository;
    private final ReservationSlotManager slotManager;
    private final ReservationEventPublisher eventPublisher;
    private final ReservationPolicyProperties policy;
    private final Clock clock;

    @Override
    public Result<Reservation> createReservation(CreateReservationCommand command) {
        log.info("Create reservation: salonId={}, staffId={}, serviceId={}, startTime={}",
                command.salonId(), command.staffId(), command.serviceId(), command.startTime());
        LocalDateTime now = LocalDateTime.now(clock);

        Map<String, UUID> identifiers = new LinkedHashMap<>();
        identifiers.put("salonId", command.salonId());
        identifiers.put("customerId", command.customerId());
        identifiers.put("staffId", command.staffId());
        identifiers.put("serviceId", command.serviceId());
        Result<Void> identifierCheck = ReservationValidator.validateIdentifiers(identifiers);
        if (identifierCheck.isErr()) {
            return identifierCheck.cast();
        }

        Result<ServiceOffering> service = findService(command.serviceId(), command.salonId());
        if (service.isErr()) {
            return service.cast();
        }
        ServiceOffering offering = service.value();

        LocalDateTime endTime = command.endTime();
        if (endTime == null && command.startTime() != null) {
            endTime = command.startTime().plusMinutes(offering.durationMinutes());
        }
        Result<TimeRange> timeRange = ReservationValidator.validateTimeRange(
                command.startTime(), endTime, now, policy.maxAdvanceMonths());
        if (timeRange.isErr()) {
            return timeRange.cast();
        }

        long totalAmount = command.totalAmount() != null ? command.totalAmount() : offering.price();
        Result<Long> amount = ReservationValidator.validateAmount(totalAmount, policy.maxAmount());
        if (amount.isErr()) {
            return amount.cast();
        }
        Result<Long> deposit = ReservationValidator.validateDepositAmount(command.depositAmount(), totalAmount);
        if (deposit.isErr()) {
            return deposit.cast();
        }

        Reservation reservation = Reservation.create(
                UUID.randomUUID(),
                command.salonId(),
                command.customerId(),
                command.staffId(),
                command.serviceId(),
                timeRange.value(),
                command.notes(),
                amount.value(),
                deposit.value(),
                command.actor(),
                now,
                command.confirmImmediately());

        Result<Reservation> created = slotManager.reserveSlot(reservation)
                .mapError(RepositoryFailures.wrap("Failed to create reservation"));
        if (created.isErr()) {
            log.warn("Reservation rejected: staffId={}, code={}, message={}",
                    command.staffId(), created.error().code(), created.error().message());
            return created;
        }

        log.info("Reservation created: reservationId={}, status={}", created.value().id(), created.value().status());
        eventPublisher.publish(LifecycleEvent.of(LifecycleEventType.RESERVATION_CREATED, created.value()));
        return created;
    }

    @Override
    public Result<Reservation> updateReservation(UpdateReservationCommand command) {
        log.info("Update reservation: reservationId={}", command.reservationId());
        Map<String, UUID> identifiers = new LinkedHashMap<>();
        identifiers.put("reservationId", command.reservationId());
        Result<Void> identifierCheck = ReservationValidator.validateIdentifiers(identifiers);
        if (identifierCheck.isErr()) {
            return identifierCheck.cast();
        }
        LocalDateTime now = LocalDateTime.now(clock);

        Result<Reservation> existing = reservationRepository.findById(command.reservationId())
                .mapError(RepositoryFailures.wrap("Failed to load reservation"));
        if (existing.isErr()) {
            return existing;
        }
        Reservation current = existing.value();

        Result<Reservation> modifiable = current.checkModifiable(now, policy.modificationLeadTime());
        if (modifiable.isErr()) {
            log.warn("Reservation not modifiable: reservationId={}, status={}", current.id(), current.status());
            return modifiable;
        }

        TimeRange newRange = null;
        if (command.changesTime()) {
            LocalDateTime start = command.startTime() != null ? command.startTime() : current.startTime();
            LocalDateTime end = command.endTime() != null
                    ? command.endTime()
                    : start.plus(Duration.between(current.startTime(), current.endTime()));
            Result<TimeRange> timeRange = ReservationValidator.validateTimeRange(
                    start, end, now, policy.maxAdvanceMonths());
            if (timeRange.isErr()) {
                return timeRange.cast();
            }
            newRange = timeRange.value();
        }

        if (command.serviceId() != null) {
            Result<ServiceOffering> service = findService(command.serviceId(), current.salonId());
            if (service.isErr()) {
                return service.cast();
            }
        }

        long effectiveTotal = command.totalAmount() != null ? command.totalAmount() : current.totalAmount();
        if (command.totalAmount() != null) {
            Result<Long> amount = ReservationValidator.validateAmount(effectiveTotal, policy.maxAmount());
            if (amount.isErr()) {
                return amount.cast();
            }
        }
        Long effectiveDeposit = command.depositAmount() != null ? command.depositAmount() : current.depositAmount();
        Result<Long> deposit = ReservationValidator.validateDepositAmount(effectiveDeposit, effectiveTotal);
        if (deposit.isErr()) {
            return deposit.cast();
        }

        ReservationChanges changes = new ReservationChanges(
                command.staffId(),
                command.serviceId(),
                newRange,
                command.notes(),
                command.totalAmount(),
                command.depositAmount());
        Result<Reservation> modified = current.modify(changes, command.actor(), now, policy.modificationLeadTime());
        if (modified.isErr()) {
            return modified;
        }

        Result<Reservation> saved = (changes.reschedules()
                ? slotManager.rescheduleSlot(modified.value())
                : slotManager.updateSlot(modified.value()))
                .mapError(RepositoryFailures.wrap("Failed to update reservation"));
        if (saved.isErr()) {
            log.warn("Reservation update rejected: reservationId={}, code={}",
                    command.reservationId(), saved.error().code());
            return saved;
        }

        log.info("Reservation updated: reservationId={}", saved.value().id());
        eventPublisher.publish(LifecycleEvent.of(LifecycleEventType.RESERVATION_UPDATED, saved.value()));
        return saved;
    }

    /**
     * 시술 조회 (다른 살롱의 시술이면 SERVICE_NOT_FOUND)
     */
    private Result<ServiceOffering> findService(UUID serviceId, UUID salonId) {
        return serviceRepository.findById(serviceId)
                .mapError(RepositoryFailures.wrap("Failed to load service"))
                .flatMap(offering -> {
                    if (offering.salonId() != null && !offering.salonId().equals(salonId)) {
                        return Result.err(ErrorCode.SERVICE_NOT_FOUND,
                                String.format("Service %s is not offered by salon %s", serviceId, salonId));
                    }
                    return Result.ok(offering);
                });
    }
}
