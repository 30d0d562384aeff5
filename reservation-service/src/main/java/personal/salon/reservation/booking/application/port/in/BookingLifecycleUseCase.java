package personal.salon.reservation.booking.application.port.in;

import personal.salon.common.result.Result;
import personal.salon.reservation.booking.domain.model.Booking;
import personal.salon.reservation.booking.domain.model.PaymentMethod;

import java.util.UUID;

/**
 * Booking Lifecycle UseCase (Input Port)
 * DRAFT -> CONFIRMED -> COMPLETED | CANCELLED | NO_SHOW 및 결제 상태 변경
 */
public interface BookingLifecycleUseCase {

    Result<Booking> confirmBooking(UUID bookingId, String actor);

    /**
     * 부킹 취소
     * 결제 완료 건은 가장 이른 예약의 시작 시각 기준으로 환불액을 계산한다.
     */
    Result<BookingCancellation> cancelBooking(UUID bookingId, String reason, String actor);

    Result<Booking> completeBooking(UUID bookingId, String actor);

    Result<Booking> markBookingAsNoShow(UUID bookingId, String actor);

    /**
     * 결제 기록 (PENDING/FAILED -> PAID), 포함된 예약들도 결제 완료로 표시
     */
    Result<Booking> recordPayment(UUID bookingId, PaymentMethod paymentMethod, String actor);

    Result<Booking> markPaymentFailed(UUID bookingId, String actor);
}
