package personal.salon.common.exception;

/**
 * 비즈니스 예외
 * 웹 경계에서 ErrorCode와 함께 전파되는 예외 (Result 를 사용할 수 없는 지점 전용)
 */
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
