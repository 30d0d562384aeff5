package personal.salon.common.exception;

import personal.salon.common.result.FieldError;

import java.util.List;

/**
 * 에러 응답 포맷
 *
 * @param code    에러 코드 (예: R005)
 * @param error   에러 이름 (예: SLOT_CONFLICT)
 * @param message 상세 메시지
 * @param errors  필드 단위 검증 오류 (없으면 빈 목록)
 */
public record ErrorResponse(
        String code,
        String error,
        String message,
        List<FieldError> errors
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(errorCode.getCode(), errorCode.name(), message, List.of());
    }

    public static ErrorResponse of(ErrorCode errorCode, String message, List<FieldError> errors) {
        return new ErrorResponse(errorCode.getCode(), errorCode.name(), message,
                errors == null ? List.of() : List.copyOf(errors));
    }
}
