package personal.salon.reservation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Reservation Service Application
 * 살롱 예약/부킹 라이프사이클 엔진
 */
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.salon.reservation",
        "personal.salon.common"  // common 모듈의 GlobalExceptionHandler 스캔
    }
)
public class ReservationServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReservationServiceApplication.class, args);
    }
}
