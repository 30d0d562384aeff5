package personal.salon.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "C002", "요청 형식이 올바르지 않습니다."),
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "C003", "입력값 검증에 실패했습니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C005", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),
    DATABASE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C007", "데이터베이스 오류가 발생했습니다."),
    SYSTEM_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C008", "시스템 오류가 발생했습니다."),

    // Reservation Domain (Rxxx)
    INVALID_TIME_RANGE(HttpStatus.BAD_REQUEST, "R001", "예약 시간 범위가 올바르지 않습니다."),
    PAST_TIME_NOT_ALLOWED(HttpStatus.BAD_REQUEST, "R002", "과거 시간으로 예약할 수 없습니다."),
    INVALID_AMOUNT(HttpStatus.BAD_REQUEST, "R003", "금액이 올바르지 않습니다."),
    SLOT_NOT_AVAILABLE(HttpStatus.CONFLICT, "R004", "선택한 시간대를 예약할 수 없습니다."),
    SLOT_CONFLICT(HttpStatus.CONFLICT, "R005", "다른 예약과 시간이 겹칩니다."),
    RESERVATION_NOT_FOUND(HttpStatus.NOT_FOUND, "R006", "예약을 찾을 수 없습니다."),
    INVALID_STATUS(HttpStatus.CONFLICT, "R007", "현재 상태에서 허용되지 않는 요청입니다."),
    CANNOT_CANCEL(HttpStatus.CONFLICT, "R008", "예약을 취소할 수 없습니다."),
    CANNOT_MODIFY(HttpStatus.CONFLICT, "R009", "예약을 변경할 수 없습니다."),

    // Catalog (Sxxx)
    SERVICE_NOT_FOUND(HttpStatus.NOT_FOUND, "S001", "시술 메뉴를 찾을 수 없습니다."),

    // Booking Domain (Bxxx)
    BOOKING_NOT_FOUND(HttpStatus.NOT_FOUND, "B001", "예약 묶음(Booking)을 찾을 수 없습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
