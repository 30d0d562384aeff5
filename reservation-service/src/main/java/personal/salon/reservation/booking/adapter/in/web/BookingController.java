package personal.salon.reservation.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
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
import personal.salon.reservation.booking.adapter.in.web.dto.AddBookingReservationRequest;
import personal.salon.reservation.booking.adapter.in.web.dto.BookingCancellationResponse;
import personal.salon.reservation.booking.adapter.in.web.dto.BookingResponse;
import personal.salon.reservation.booking.adapter.in.web.dto.CancelRequest;
import personal.salon.reservation.booking.adapter.in.web.dto.CreateBookingRequest;
import personal.salon.reservation.booking.adapter.in.web.dto.PageResponse;
import personal.salon.reservation.booking.adapter.in.web.dto.RecordPaymentRequest;
import personal.salon.reservation.booking.adapter.in.web.dto.UpdateBookingRequest;
import personal.salon.reservation.booking.application.port.in.BookingLifecycleUseCase;
import personal.salon.reservation.booking.application.port.in.CreateBookingUseCase;
import personal.salon.reservation.booking.application.port.in.GetBookingUseCase;
import personal.salon.reservation.booking.application.port.in.SearchBookingsUseCase;
import personal.salon.reservation.booking.application.port.in.UpdateBookingUseCase;
import personal.salon.reservation.booking.domain.model.BookingSearchCriteria;
import personal.salon.reservation.booking.domain.model.BookingStatus;
import personal.salon.reservation.booking.domain.model.Pagination;
import personal.salon.reservation.booking.domain.model.PaymentMethod;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Booking API Controller
 * 여러 예약을 묶는 부킹의 생성/결제/상태 전이 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final CreateBookingUseCase createBookingUseCase;
    private final GetBookingUseCase getBookingUseCase;
    private final SearchBookingsUseCase searchBookingsUseCase;
    private final UpdateBookingUseCase updateBookingUseCase;
    private final BookingLifecycleUseCase bookingLifecycleUseCase;

    /**
     * 부킹 생성
     * POST /api/v1/bookings
     */
    @PostMapping
    public ResponseEntity<Object> createBooking(
            @Valid @RequestBody CreateBookingRequest request,
            @RequestHeader("X-User-Id") String userId
    ) {
        log.info("Create booking: userId={}, customerId={}, reservationIds={}",
                userId, request.customerId(), request.reservationIds());

        return ResultResponses.toResponse(
                createBookingUseCase.createBooking(request.toCommand(userId)),
                BookingResponse::from,
                HttpStatus.CREATED);
    }

    /**
     * 부킹 단건 조회
     * GET /api/v1/bookings/{bookingId}
     */
    @GetMapping("/{bookingId}")
    public ResponseEntity<Object> getBooking(@PathVariable UUID bookingId) {
        return ResultResponses.toResponse(getBookingUseCase.getBooking(bookingId), BookingResponse::from);
    }

    /**
     * 고객별 부킹 조회 (최신순)
     * GET /api/v1/bookings?customerId=...
     */
    @GetMapping
    public ResponseEntity<Object> getBookingsByCustomer(@RequestParam UUID customerId) {
        return ResultResponses.toResponse(
                getBookingUseCase.getBookingsByCustomer(customerId),
                bookings -> bookings.stream().map(BookingResponse::from).toList());
    }

    /**
     * 부킹 검색 (필터 + 페이지, 최신순)
     * GET /api/v1/bookings/search
     */
    @GetMapping("/search")
    public ResponseEntity<Object> searchBookings(
            @RequestParam(required = false) UUID salonId,
            @RequestParam(required = false) UUID customerId,
            @RequestParam(required = false) BookingStatus status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime createdFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime createdTo,
            @RequestParam(required = false) Long minAmount,
            @RequestParam(required = false) Long maxAmount,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        log.debug("Search bookings: salonId={}, customerId={}, status={}, page={}, size={}",
                salonId, customerId, status, page, size);

        BookingSearchCriteria criteria = new BookingSearchCriteria(salonId, customerId, status,
                createdFrom, createdTo, minAmount, maxAmount);

        return ResultResponses.toResponse(
                searchBookingsUseCase.searchBookings(criteria, pagination(page, size)),
                result -> PageResponse.from(result, BookingResponse::from));
    }

    /**
     * 부킹 변경 (메모, 할인, 결제 수단)
     * PATCH /api/v1/bookings/{bookingId}
     */
    @PatchMapping("/{bookingId}")
    public ResponseEntity<Object> updateBooking(
            @PathVariable UUID bookingId,
            @Valid @RequestBody UpdateBookingRequest request,
            @RequestHeader("X-User-Id") String userId
    ) {
        log.info("Update booking: bookingId={}, userId={}", bookingId, userId);
        return ResultResponses.toResponse(
                updateBookingUseCase.updateBooking(request.toCommand(bookingId, userId)),
                BookingResponse::from);
    }

    @PostMapping("/{bookingId}/reservations")
    public ResponseEntity<Object> addReservation(
            @PathVariable UUID bookingId,
            @Valid @RequestBody AddBookingReservationRequest request,
            @RequestHeader("X-User-Id") String userId
    ) {
        log.info("Add reservation to booking: bookingId={}, reservationId={}, userId={}",
                bookingId, request.reservationId(), userId);
        return ResultResponses.toResponse(
                updateBookingUseCase.addReservation(bookingId, request.reservationId(), userId),
                BookingResponse::from);
    }

    @DeleteMapping("/{bookingId}/reservations/{reservationId}")
    public ResponseEntity<Object> removeReservation(
            @PathVariable UUID bookingId,
            @PathVariable UUID reservationId,
            @RequestHeader("X-User-Id") String userId
    ) {
        log.info("Remove reservation from booking: bookingId={}, reservationId={}, userId={}",
                bookingId, reservationId, userId);
        return ResultResponses.toResponse(
                updateBookingUseCase.removeReservation(bookingId, reservationId, userId),
                BookingResponse::from);
    }

    @PostMapping("/{bookingId}/confirm")
    public ResponseEntity<Object> confirmBooking(
            @PathVariable UUID bookingId,
            @RequestHeader("X-User-Id") String userId
    ) {
        log.info("Confirm booking: bookingId={}, userId={}", bookingId, userId);
        return ResultResponses.toResponse(
                bookingLifecycleUseCase.confirmBooking(bookingId, userId),
                BookingResponse::from);
    }

    @PostMapping("/{bookingId}/cancel")
    public ResponseEntity<Object> cancelBooking(
            @PathVariable UUID bookingId,
            @Valid @RequestBody CancelRequest request,
            @RequestHeader("X-User-Id") String userId
    ) {
        log.info("Cancel booking: bookingId={}, userId={}", bookingId, userId);
        return ResultResponses.toResponse(
                bookingLifecycleUseCase.cancelBooking(bookingId, request.reason(), userId),
                BookingCancellationResponse::from);
    }

    @PostMapping("/{bookingId}/complete")
    public ResponseEntity<Object> completeBooking(
            @PathVariable UUID bookingId,
            @RequestHeader("X-User-Id") String userId
    ) {
        log.info("Complete booking: bookingId={}, userId={}", bookingId, userId);
        return ResultResponses.toResponse(
                bookingLifecycleUseCase.completeBooking(bookingId, userId),
                BookingResponse::from);
    }

    @PostMapping("/{bookingId}/no-show")
    public ResponseEntity<Object> markBookingAsNoShow(
            @PathVariable UUID bookingId,
            @RequestHeader("X-User-Id") String userId
    ) {
        log.info("Mark booking as no-show: bookingId={}, userId={}", bookingId, userId);
        return ResultResponses.toResponse(
                bookingLifecycleUseCase.markBookingAsNoShow(bookingId, userId),
                BookingResponse::from);
    }

    /**
     * 결제 기록
     * POST /api/v1/bookings/{bookingId}/payment
     */
    @PostMapping("/{bookingId}/payment")
    public ResponseEntity<Object> recordPayment(
            @PathVariable UUID bookingId,
            @RequestBody(required = false) RecordPaymentRequest request,
            @RequestHeader("X-User-Id") String userId
    ) {
        log.info("Record payment: bookingId={}, userId={}", bookingId, userId);
        PaymentMethod method = request != null ? request.paymentMethod() : null;
        return ResultResponses.toResponse(
                bookingLifecycleUseCase.recordPayment(bookingId, method, userId),
                BookingResponse::from);
    }

    @PostMapping("/{bookingId}/payment-failed")
    public ResponseEntity<Object> markPaymentFailed(
            @PathVariable UUID bookingId,
            @RequestHeader("X-User-Id") String userId
    ) {
        log.info("Mark payment failed: bookingId={}, userId={}", bookingId, userId);
        return ResultResponses.toResponse(
                bookingLifecycleUseCase.markPaymentFailed(bookingId, userId),
                BookingResponse::from);
    }

    private Pagination pagination(int page, int size) {
        try {
            return new Pagination(page, size);
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, e.getMessage());
        }
    }
}
