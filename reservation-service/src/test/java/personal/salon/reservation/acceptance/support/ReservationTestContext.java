package personal.salon.reservation.acceptance.support;

import io.cucumber.spring.ScenarioScope;
import io.restassured.response.Response;
import lombok.Getter;
import lombok.Setter;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reservation Acceptance Test Context
 * 시나리오 내 Step 클래스 간 상태 공유
 */
@Getter
@Setter
@Component
@ScenarioScope
public class ReservationTestContext {

    /** 기본 요청 사용자 */
    private static final String DEFAULT_USER_ID = "front-desk";

    private final AtomicInteger successfulReservations = new AtomicInteger(0);
    private final AtomicInteger failedReservations = new AtomicInteger(0);

    /** 마지막 HTTP API 응답 */
    private Response lastHttpResponse;

    private UUID salonId;
    private UUID staffId;
    private UUID serviceId;
    private UUID customerId;

    /** 현재 시나리오의 예약 ID */
    private UUID currentReservationId;
    private UUID currentBookingId;

    public String getUserId() {
        return DEFAULT_USER_ID;
    }
}
