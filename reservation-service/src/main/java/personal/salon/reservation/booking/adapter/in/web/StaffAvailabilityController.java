package personal.salon.reservation.booking.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.salon.reservation.booking.adapter.in.web.dto.AvailableSlotResponse;
import personal.salon.reservation.booking.application.port.in.FindAvailableSlotsQuery;
import personal.salon.reservation.booking.application.port.in.FindAvailableSlotsUseCase;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Staff Availability API Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/staff")
@RequiredArgsConstructor
public class StaffAvailabilityController {

    private final FindAvailableSlotsUseCase findAvailableSlotsUseCase;

    /**
     * 직원의 하루 예약 가능 슬롯 조회
     * GET /api/v1/staff/{staffId}/available-slots?date=2025-01-01&serviceId=...
     */
    @GetMapping("/{staffId}/available-slots")
    public ResponseEntity<Object> getAvailableSlots(
            @PathVariable UUID staffId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) UUID serviceId
    ) {
        log.debug("Get available slots: staffId={}, date={}, serviceId={}", staffId, date, serviceId);

        return ResultResponses.toResponse(
                findAvailableSlotsUseCase.findAvailableSlots(new FindAvailableSlotsQuery(staffId, date, serviceId)),
                slots -> slots.stream().map(AvailableSlotResponse::from).toList());
    }
}
