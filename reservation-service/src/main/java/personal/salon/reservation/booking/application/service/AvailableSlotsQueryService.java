package personal.salon.reservation.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.DomainError;
import personal.salon.common.result.FieldError;
import personal.salon.common.result.Result;
import personal.salon.reservation.booking.application.config.ReservationPolicyProperties;
import personal.salon.reservation.booking.application.port.in.FindAvailableSlotsQuery;
import personal.salon.reservation.booking.application.port.in.FindAvailableSlotsUseCase;
import personal.salon.reservation.booking.application.port.out.ReservationRepository;
import personal.salon.reservation.booking.application.port.out.ServiceRepository;
import personal.salon.reservation.booking.application.port.out.StaffScheduleRepository;
import personal.salon.reservation.booking.domain.model.AvailableSlot;
import personal.salon.reservation.booking.domain.model.Reservation;
import personal.salon.reservation.booking.domain.model.ServiceOffering;
import personal.salon.reservation.booking.domain.model.WorkingHours;
import personal.salon.reservation.booking.domain.policy.AvailabilityCalculator;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Available Slots Query Service
 * 근무 시간 - (기존 예약 + 휴게 시간) 을 시술 소요 시간 단위로 분할
 * 결과는 캐시하지 않고 매 요청마다 다시 계산한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailableSlotsQueryService implements FindAvailableSlotsUseCase {

    private final ServiceRepository serviceRepository;
    private final StaffScheduleRepository staffScheduleRepository;
    private final ReservationRepository reservationRepository;
    private final ReservationPolicyProperties policy;
    private final Clock clock;

    @Override
    public Result<List<AvailableSlot>> findAvailableSlots(FindAvailableSlotsQuery query) {
        log.info("Find available slots: staffId={}, date={}, serviceId={}",
                query.staffId(), query.date(), query.serviceId());

        List<FieldError> errors = new ArrayList<>();
        if (query.staffId() == null) {
            errors.add(new FieldError("staffId", "staffId is required"));
        }
        if (query.date() == null) {
            errors.add(new FieldError("date", "date is required"));
        }
        if (query.serviceId() == null) {
            errors.add(new FieldError("serviceId", "serviceId is required"));
        }
        if (!errors.isEmpty()) {
            return Result.err(DomainError.validation(errors));
        }

        if (policy.rejectPastSlotQueries() && query.date().isBefore(LocalDate.now(clock))) {
            return Result.err(ErrorCode.PAST_TIME_NOT_ALLOWED, "Cannot query slots for a past date: " + query.date());
        }

        Result<ServiceOffering> service = serviceRepository.findById(query.serviceId())
                .mapError(RepositoryFailures.wrap("Failed to load service"));
        if (service.isErr()) {
            return service.cast();
        }

        Result<Optional<WorkingHours>> workingHours = staffScheduleRepository
                .findWorkingHours(query.staffId(), query.date().getDayOfWeek())
                .mapError(RepositoryFailures.wrap("Failed to load working hours"));
        if (workingHours.isErr()) {
            return workingHours.cast();
        }
        if (workingHours.value().isEmpty()) {
            log.debug("Staff is off duty: staffId={}, dayOfWeek={}", query.staffId(), query.date().getDayOfWeek());
            return Result.ok(List.of());
        }

        Result<List<Reservation>> existing = reservationRepository.findByStaffAndDateRange(
                        query.staffId(), query.date().atStartOfDay(), query.date().plusDays(1).atStartOfDay())
                .mapError(RepositoryFailures.wrap("Failed to load staff reservations"));
        if (existing.isErr()) {
            return existing.cast();
        }

        List<AvailableSlot> slots = AvailabilityCalculator.findAvailableSlots(
                query.staffId(),
                query.date(),
                workingHours.value().get(),
                Duration.ofMinutes(service.value().durationMinutes()),
                existing.value());
        log.debug("Available slots calculated: staffId={}, date={}, count={}", query.staffId(), query.date(), slots.size());
        return Result.ok(slots);
    }
}
