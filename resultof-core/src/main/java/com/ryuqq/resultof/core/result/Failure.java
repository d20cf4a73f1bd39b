package com.ryuqq.resultof.core.result;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 실패 결과.
 *
 * <p>예상 가능한 실패를 값으로 보유합니다. 예외와 달리 제어 흐름을 끊지 않으며,
 * 호출자가 검사하거나 변환할 수 있는 일반 값입니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>유효성 검증 실패 (sealed interface로 표현된 오류 코드)</li>
 *   <li>리소스 없음</li>
 *   <li>{@link com.ryuqq.resultof.core.catching.Catching}이 포착한 예외</li>
 * </ul>
 *
 * @param value 실패 값 (null 허용)
 * @param <T> 성공 값 타입
 * @param <F> 실패 값 타입
 *
 * @author ResultOf Team
 * @since 1.0.0
 */
public record Failure<T, F>(F value) implements ResultOf<T, F> {

    @Override
    public boolean isSuccess() {
        return false;
    }

    @Override
    public boolean isFailure() {
        return true;
    }

    @Override
    public T getOrNull() {
        return null;
    }

    @Override
    public F failureOrNull() {
        return value;
    }

    @Override
    public T getOrElse(T fallback) {
        return fallback;
    }

    @Override
    public T getOrThrow() {
        String message = "Cannot get value from Failure: " + value;
        if (value instanceof Throwable cause) {
            throw new IllegalStateException(message, cause);
        }
        throw new IllegalStateException(message);
    }

    @Override
    public ResultOf<T, F> onSuccess(Consumer<? super T> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        return this;
    }

    @Override
    public ResultOf<T, F> onFailure(Consumer<? super F> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        action.accept(value);
        return this;
    }

    @Override
    public <R> ResultOf<R, F> map(Function<? super T, ? extends R> transform) {
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        return new Failure<>(value);
    }

    @Override
    public <R> ResultOf<T, R> mapFailure(Function<? super F, ? extends R> transform) {
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        return new Failure<>(transform.apply(value));
    }

    @Override
    public <R> ResultOf<R, F> flatMap(Function<? super T, ResultOf<R, F>> transform) {
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        return new Failure<>(value);
    }

    @Override
    public <R> ResultOf<T, R> flatMapFailure(Function<? super F, ResultOf<T, R>> transform) {
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        return transform.apply(value);
    }

    @Override
    public ResultOf<T, F> recover(Function<? super F, ? extends T> transform) {
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        return new Success<>(transform.apply(value));
    }

    @Override
    public ResultOf<T, F> flatRecover(Function<? super F, ResultOf<T, F>> transform) {
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        return transform.apply(value);
    }

    @Override
    public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super F, ? extends R> onFailure) {
        if (onSuccess == null || onFailure == null) {
            throw new IllegalArgumentException("onSuccess and onFailure cannot be null");
        }
        return onFailure.apply(value);
    }
}
