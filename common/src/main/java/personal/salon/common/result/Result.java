package personal.salon.common.result;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Result Type
 * 성공(Ok) / 실패(Err) 를 값으로 표현하는 닫힌 타입
 * 예상 가능한 실패는 예외 대신 Err 로 반환한다.
 *
 * @param <T> 성공 값 타입
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(DomainError error) {
        return new Err<>(error);
    }

    static <T> Result<T> err(ErrorCode code, String message) {
        return new Err<>(DomainError.of(code, message));
    }

    boolean isOk();

    default boolean isErr() {
        return !isOk();
    }

    /**
     * 성공 값 반환 (Err 이면 IllegalStateException - 호출자 버그)
     */
    T value();

    /**
     * 실패 정보 반환 (Ok 이면 IllegalStateException - 호출자 버그)
     */
    DomainError error();

    @SuppressWarnings("unchecked")
    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Ok<T> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        return (Result<U>) this;
    }

    @SuppressWarnings("unchecked")
    default <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (this instanceof Ok<T> ok) {
            return mapper.apply(ok.value());
        }
        return (Result<U>) this;
    }

    default Result<T> mapError(Function<DomainError, DomainError> mapper) {
        if (this instanceof Err<T> err) {
            return new Err<>(mapper.apply(err.error()));
        }
        return this;
    }

    default Result<T> onSuccess(Consumer<? super T> action) {
        if (this instanceof Ok<T> ok) {
            action.accept(ok.value());
        }
        return this;
    }

    /**
     * 웹 경계 등 예외 흐름이 필요한 곳에서 사용
     */
    default T orElseThrow() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        DomainError error = error();
        throw new BusinessException(error.code(), error.message());
    }

    /**
     * 실패 값을 다른 성공 타입으로 전달할 때 사용
     */
    @SuppressWarnings("unchecked")
    default <U> Result<U> cast() {
        if (isOk()) {
            throw new IllegalStateException("Ok result cannot be cast to another type");
        }
        return (Result<U>) this;
    }

    record Ok<T>(T value) implements Result<T> {
        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public DomainError error() {
            throw new IllegalStateException("Ok result has no error");
        }
    }

    record Err<T>(DomainError error) implements Result<T> {
        public Err {
            Objects.requireNonNull(error, "Error cannot be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("Err result has no value: " + error.code());
        }
    }
}
