package personal.salon.reservation.booking.application.service;

import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.DomainError;

import java.util.function.Function;

/**
 * 저장소 장애를 유스케이스 문맥을 붙인 SYSTEM_ERROR 로 감싼다.
 * 도메인 오류(NOT_FOUND, INVALID_STATUS 등)는 그대로 전달.
 */
final class RepositoryFailures {

    private RepositoryFailures() {
    }

    static Function<DomainError, DomainError> wrap(String context) {
        return error -> error.is(ErrorCode.DATABASE_ERROR)
                ? error.wrap(ErrorCode.SYSTEM_ERROR, context)
                : error;
    }
}
