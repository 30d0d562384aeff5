package personal.salon.common.result;

/**
 * 필드 단위 검증 오류
 */
public record FieldError(String field, String message) {
}
