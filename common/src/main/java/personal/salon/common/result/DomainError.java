package personal.salon.common.result;

import personal.salon.common.exception.ErrorCode;

import java.util.List;
import java.util.Objects;

/**
 * Domain Error
 * 예외 대신 값으로 전달되는 실패 정보
 *
 * @param code        에러 분류
 * @param message     상세 메시지
 * @param fieldErrors 필드 단위 오류 (VALIDATION_FAILED 에서만 사용)
 */
public record DomainError(
        ErrorCode code,
        String message,
        List<FieldError> fieldErrors
) {
    public DomainError {
        Objects.requireNonNull(code, "Error code cannot be null");
        if (message == null || message.isBlank()) {
            message = code.getMessage();
        }
        fieldErrors = fieldErrors == null ? List.of() : List.copyOf(fieldErrors);
    }

    public static DomainError of(ErrorCode code, String message) {
        return new DomainError(code, message, List.of());
    }

    public static DomainError validation(List<FieldError> fieldErrors) {
        return new DomainError(ErrorCode.VALIDATION_FAILED, ErrorCode.VALIDATION_FAILED.getMessage(), fieldErrors);
    }

    /**
     * 상위 계층에서 문맥을 덧붙여 감싼 오류 생성
     * 예: 저장소 실패를 SYSTEM_ERROR 로 변환
     */
    public DomainError wrap(ErrorCode wrapperCode, String context) {
        return new DomainError(wrapperCode, context + ": " + message, fieldErrors);
    }

    public boolean is(ErrorCode candidate) {
        return code == candidate;
    }
}
