package personal.salon.reservation.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.reservation.booking.adapter.in.web.dto.CancelRequest;
import personal.salon.reservation.booking.adapter.in.web.dto.CancellationResponse;
import personal.salon.reservation.booking.adapter.in.web.dto.CompleteReservationRequest;
import personal.salon.reservation.booking.adapter.in.web.dto.CompletionResponse;
import personal.salon.reservation.booking.adapter.in.web.dto.CreateReservationRequest;
import personal.salon.reservation.booking.adapter.in.web.dto.PageResponse;
import personal.salon.reservation.booking.adapter.in.web.dto.ReservationCountResponse;
import personal.salon.reservation.booking.adapter.in.web.dto.ReservationResponse;
import personal.salon.reservation.booking.adapter.in.web.dto.UpdateReservationRequest;
import personal.salon.reservation.booking.application.port.in.CancelReservationCommand;
import personal.salon.reservation.booking.application.port.in.CancelReservationUseCase;
import personal.salon.reservation.booking.application.port.in.CompleteReservationCommand;
import personal.salon.reservation.booking.application.port.in.CompleteReservationUseCase;
import personal.salon.reservation.booking.application.port.in.ConfirmReservationUseCase;
import personal.salon.reservation.booking.application.port.in.CountReservationsUseCase;
import personal.salon.reservation.booking.application.port.in.CreateReservationUseCase;
import personal.salon.reservation.booking.application.port.in.GetReservationUseCase;
import personal.salon.reservation.booking.application.port.in.ListReservationsUseCase;
import personal.salon.reservation.booking.application.port.in.MarkNoShowUseCase;
import personal.salon.reservation.booking.application.port.in.UpdateReservationUseCase;
import personal.salon.reservation.booking.domain.model.Pagination;
import personal.salon.reservation.booking.domain.model.ReservationSearchCriteria;
import personal.salon.reservation.booking.domain.model.ReservationStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Reservation API Controller
 * 예약 생성/변경/상태 전이 및 조회 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/reservations")
@RequiredArgsConstructor
public class ReservationController {

    private final CreateReservationUseCase createReservationUseCase;
    private final UpdateReservationUseCase updateReservationUseCase;
    private final ConfirmReservationUseCase confirmReservationUseCase;
    private final CancelReservationUseCase cancelReservationUseCase;
    private final CompleteReservationUseCase completeReservationUseCase;
    private final MarkNoShowUseCase markNoShowUseCase;
    private final GetReservationUseCase getReservationUseCase;
    private final ListReservationsUseCase listReservationsUseCase;
    private final CountReservationsUseCase countReservationsUseCase;

    /**
     * 예약 생성
     * POST /api/v1/reservations
     */
    @PostMapping
    public ResponseEntity<Object> createReservation(
            @Valid @RequestBody CreateReservationRequest request,
            @RequestHeader("X-User-Id") String userId
    ) {
        log.info("Create reservation: userId={}, staffId={}, startTime={}",
                userId, request.staffId(), request.startTime());

        return ResultResponses.toResponse(
                createReservationUseCase.createReservation(request.toCommand(userId)),
                ReservationResponse::from,
                HttpStatus.CREATED);
    }

    /**
     * 예약 목록 조회 (필터 + 페이지)
     * GET /api/v1/reservations
     */
    @GetMapping
    public ResponseEntity<Object> listReservations(
            @RequestParam(required = false) UUID salonId,
            @RequestParam(required = false) UUID customerId,
            @RequestParam(required = false) UUID staffId,
            @RequestParam(required = false) ReservationStatus status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startTo,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        log.debug("List reservations: salonId={}, customerId={}, staffId={}, status={}, page={}, size={}",
                salonId, customerId, staffId, status, page, size);

        ReservationSearchCriteria criteria =
                new ReservationSearchCriteria(salonId, customerId, staffId, status, startFrom, startTo);

        return ResultResponses.toResponse(
                listReservationsUseCase.listReservations(criteria, pagination(page, size)),
                result -> PageResponse.from(result, ReservationResponse::from));
    }

    /**
     * 날짜별 예약 수 조회
     * GET /api/v1/reservations/count?date=2025-01-01
     */
    @GetMapping("/count")
    public ResponseEntity<Object> countReservations(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) UUID salonId
    ) {
        return ResultResponses.toResponse(
                countReservationsUseCase.countByDate(date, salonId),
                count -> new ReservationCountResponse(date, salonId, count));
    }

    /**
     * 예약 단건 조회
     * GET /api/v1/reservations/{reservationId}
     */
    @GetMapping("/{reservationId}")
    public ResponseEntity<Object> getReservation(@PathVariable UUID reservationId) {
        log.debug("Get reservation: reservationId={}", reservationId);

        return ResultResponses.toResponse(
                getReservationUseCase.getReservation(reservationId),
                ReservationResponse::from);
    }

    /**
     * 예약 변경
     * PATCH /api/v1/reservations/{reservationId}
     */
    @PatchMapping("/{reservationId}")
    public ResponseEntity<Object> updateReservation(
            @PathVariable UUID reservationId,
            @Valid @RequestBody UpdateReservationRequest request,
            @RequestHeader("X-User-Id") String userId
    ) {
        log.info("Update reservation: reservationId={}, userId={}", reservationId, userId);

        return ResultResponses.toResponse(
                updateReservationUseCase.updateReservation(request.toCommand(reservationId, userId)),
                ReservationResponse::from);
    }

    /**
     * 예약 확정
     * POST /api/v1/reservations/{reservationId}/confirm
     */
    @PostMapping("/{reservationId}/confirm")
    public ResponseEntity<Object> confirmReservation(
            @PathVariable UUID reservationId,
            @RequestHeader("X-User-Id") String userId
    ) {
        log.info("Confirm reservation: reservationId={}, userId={}", reservationId, userId);

        return ResultResponses.toResponse(
                confirmReservationUseCase.confirmReservation(reservationId, userId),
                ReservationResponse::from);
    }

    /**
     * 예약 취소 (환불액/수수료 포함 응답)
     * POST /api/v1/reservations/{reservationId}/cancel
     */
    @PostMapping("/{reservationId}/cancel")
    public ResponseEntity<Object> cancelReservation(
            @PathVariable UUID reservationId,
            @Valid @RequestBody CancelRequest request,
            @RequestHeader("X-User-Id") String userId
    ) {
        log.info("Cancel reservation: reservationId={}, userId={}", reservationId, userId);

        CancelReservationCommand command = new CancelReservationCommand(reservationId, request.reason(), userId);
        return ResultResponses.toResponse(
                cancelReservationUseCase.cancelReservation(command),
                CancellationResponse::from);
    }

    /**
     * 시술 완료
     * POST /api/v1/reservations/{reservationId}/complete
     */
    @PostMapping("/{reservationId}/complete")
    public ResponseEntity<Object> completeReservation(
            @PathVariable UUID reservationId,
            @RequestBody(required = false) CompleteReservationRequest request,
            @RequestHeader("X-User-Id") String userId
    ) {
        log.info("Complete reservation: reservationId={}, userId={}", reservationId, userId);

        LocalDateTime actualEndTime = request != null ? request.actualEndTime() : null;
        CompleteReservationCommand command = new CompleteReservationCommand(reservationId, actualEndTime, userId);
        return ResultResponses.toResponse(
                completeReservationUseCase.completeReservation(command),
                CompletionResponse::from);
    }

    /**
     * 노쇼 처리
     * POST /api/v1/reservations/{reservationId}/no-show
     */
    @PostMapping("/{reservationId}/no-show")
    public ResponseEntity<Object> markAsNoShow(
            @PathVariable UUID reservationId,
            @RequestHeader("X-User-Id") String userId
    ) {
        log.info("Mark reservation as no-show: reservationId={}, userId={}", reservationId, userId);

        return ResultResponses.toResponse(
                markNoShowUseCase.markAsNoShow(reservationId, userId),
                ReservationResponse::from);
    }

    private Pagination pagination(int page, int size) {
        try {
            return new Pagination(page, size);
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, e.getMessage());
        }
    }
}
