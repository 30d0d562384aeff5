package personal.salon.reservation.booking.domain.policy;

import personal.salon.reservation.booking.domain.model.AvailableSlot;
import personal.salon.reservation.booking.domain.model.Reservation;
import personal.salon.reservation.booking.domain.model.ReservationStatus;
import personal.salon.reservation.booking.domain.model.TimeRange;
import personal.salon.reservation.booking.domain.model.WorkingHours;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Availability Calculator
 * 직원 일정의 충돌 판정과 빈 슬롯 계산
 * 취소된 예약은 슬롯을 점유하지 않는다.
 */
public final class AvailabilityCalculator {

    private AvailabilityCalculator() {
    }

    /**
     * 반열림 구간 겹침 판정 (s < e2 AND s2 < e)
     */
    public static boolean overlaps(TimeRange candidate, TimeRange existing) {
        return candidate.overlaps(existing);
    }

    /**
     * 후보 구간과 겹치는 첫 번째 예약
     *
     * @param excludeId 변경 중인 예약 자신 (없으면 null)
     */
    public static Optional<Reservation> findConflict(TimeRange candidate, List<Reservation> existing, UUID excludeId) {
        return existing.stream()
                .filter(AvailabilityCalculator::occupiesSlot)
                .filter(reservation -> excludeId == null || !excludeId.equals(reservation.id()))
                .filter(reservation -> overlaps(candidate, reservation.timeRange()))
                .findFirst();
    }

    /**
     * 예약 가능 슬롯 계산
     * 근무 시간에서 기존 예약과 휴게 시간을 빼고, 남은 구간을 소요 시간 단위로 잘라 시간순으로 반환
     */
    public static List<AvailableSlot> findAvailableSlots(UUID staffId, LocalDate date, WorkingHours workingHours,
                                                         Duration duration, List<Reservation> existing) {
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("Slot duration must be positive: " + duration);
        }
        TimeRange window = workingHours.on(date);

        List<TimeRange> occupied = new ArrayList<>(workingHours.breaksOn(date));
        existing.stream()
                .filter(AvailabilityCalculator::occupiesSlot)
                .map(Reservation::timeRange)
                .forEach(occupied::add);
        occupied.sort(Comparator.comparing(TimeRange::start));

        List<AvailableSlot> slots = new ArrayList<>();
        LocalDateTime cursor = window.start();
        for (TimeRange busy : occupied) {
            if (!busy.end().isAfter(cursor)) {
                continue;
            }
            if (!busy.start().isBefore(window.end())) {
                break;
            }
            addSegments(slots, staffId, cursor, busy.start(), duration);
            cursor = busy.end();
        }
        addSegments(slots, staffId, cursor, window.end(), duration);
        return List.copyOf(slots);
    }

    private static void addSegments(List<AvailableSlot> slots, UUID staffId,
                                    LocalDateTime from, LocalDateTime to, Duration duration) {
        LocalDateTime slotStart = from;
        while (!slotStart.plus(duration).isAfter(to)) {
            slots.add(new AvailableSlot(staffId, slotStart, slotStart.plus(duration)));
            slotStart = slotStart.plus(duration);
        }
    }

    private static boolean occupiesSlot(Reservation reservation) {
        return reservation.status() != ReservationStatus.CANCELLED;
    }
}
