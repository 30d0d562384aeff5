package personal.salon.reservation.booking.adapter.in.web;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import personal.salon.common.exception.ErrorResponse;
import personal.salon.common.result.DomainError;
import personal.salon.common.result.Result;

import java.util.function.Function;

/**
 * Result -> HTTP 응답 변환
 * Err 는 ErrorCode 의 HTTP 상태와 ErrorResponse 로 변환한다.
 */
@Slf4j
final class ResultResponses {

    private ResultResponses() {
    }

    static <T, R> ResponseEntity<Object> toResponse(Result<T> result, Function<T, R> mapper) {
        return toResponse(result, mapper, HttpStatus.OK);
    }

    static <T, R> ResponseEntity<Object> toResponse(Result<T> result, Function<T, R> mapper, HttpStatus status) {
        if (result.isOk()) {
            return ResponseEntity.status(status).body(mapper.apply(result.value()));
        }
        DomainError error = result.error();
        log.warn("Request rejected: code={}, message={}", error.code().getCode(), error.message());
        ErrorResponse body = ErrorResponse.of(error.code(), error.message(), error.fieldErrors());
        return ResponseEntity.status(error.code().getHttpStatus()).body(body);
    }
}
