package personal.salon.reservation.booking.adapter.in.web.dto;

import personal.salon.reservation.booking.domain.model.PaymentMethod;

/**
 * 결제 기록 요청 DTO
 *
 * @param paymentMethod 결제 수단 (없으면 부킹 생성 시 값 유지)
 */
public record RecordPaymentRequest(
        PaymentMethod paymentMethod
) {
}
