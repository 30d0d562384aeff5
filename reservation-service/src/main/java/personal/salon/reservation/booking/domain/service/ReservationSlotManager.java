package personal.salon.reservation.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.Result;
import personal.salon.reservation.booking.application.port.out.ReservationRepository;
import personal.salon.reservation.booking.application.port.out.StaffLockPort;
import personal.salon.reservation.booking.domain.model.Reservation;

import java.util.UUID;

/**
 * Reservation Slot Manager
 * 직원 락 안에서 충돌 검사와 저장을 한 번에 수행하는 실행 전용 서비스
 * 같은 직원에 대한 check-then-write 는 동시에 하나만 실행된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationSlotManager {

    private final ReservationRepository reservationRepository;
    private final StaffLockPort staffLockPort;

    /**
     * 신규 예약 저장
     */
    public Result<Reservation> reserveSlot(Reservation reservation) {
        return staffLockPort.executeWithLock(reservation.staffId(), () ->
                ensureSlotFree(reservation, null)
                        .flatMap(reservationRepository::create));
    }

    /**
     * 시간/담당자가 바뀐 예약 저장 (자기 자신은 충돌 대상에서 제외)
     */
    public Result<Reservation> rescheduleSlot(Reservation changed) {
        return staffLockPort.executeWithLock(changed.staffId(), () ->
                ensureSlotFree(changed, changed.id())
                        .flatMap(reservationRepository::update));
    }

    /**
     * 시간/담당자가 그대로인 예약 저장
     * 같은 직원의 예약 생성/변경과 직렬화되도록 락 안에서 저장한다.
     */
    public Result<Reservation> updateSlot(Reservation changed) {
        return staffLockPort.executeWithLock(changed.staffId(), () -> reservationRepository.update(changed));
    }

    private Result<Reservation> ensureSlotFree(Reservation reservation, UUID excludeId) {
        return reservationRepository.checkTimeSlotConflict(
                        reservation.staffId(), reservation.startTime(), reservation.endTime(), excludeId)
                .flatMap(conflict -> {
                    if (conflict) {
                        log.warn("Time slot conflict: staffId={}, startTime={}, endTime={}",
                                reservation.staffId(), reservation.startTime(), reservation.endTime());
                        return Result.err(ErrorCode.SLOT_CONFLICT, "The selected time slot is not available");
                    }
                    return Result.ok(reservation);
                });
    }
}
