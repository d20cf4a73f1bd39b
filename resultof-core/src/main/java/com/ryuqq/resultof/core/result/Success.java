package com.ryuqq.resultof.core.result;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 성공 결과.
 *
 * <p>연산이 성공적으로 완료되어 성공 값을 보유하고 있음을 나타냅니다.</p>
 *
 * @param value 성공 값 (null 허용)
 * @param <T> 성공 값 타입
 * @param <F> 실패 값 타입
 *
 * @author ResultOf Team
 * @since 1.0.0
 */
public record Success<T, F>(T value) implements ResultOf<T, F> {

    @Override
    public boolean isSuccess() {
        return true;
    }

    @Override
    public boolean isFailure() {
        return false;
    }

    @Override
    public T getOrNull() {
        return value;
    }

    @Override
    public F failureOrNull() {
        return null;
    }

    @Override
    public T getOrElse(T fallback) {
        return value;
    }

    @Override
    public T getOrThrow() {
        return value;
    }

    @Override
    public ResultOf<T, F> onSuccess(Consumer<? super T> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        action.accept(value);
        return this;
    }

    @Override
    public ResultOf<T, F> onFailure(Consumer<? super F> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        return this;
    }

    @Override
    public <R> ResultOf<R, F> map(Function<? super T, ? extends R> transform) {
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        return new Success<>(transform.apply(value));
    }

    @Override
    public <R> ResultOf<T, R> mapFailure(Function<? super F, ? extends R> transform) {
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        return new Success<>(value);
    }

    @Override
    public <R> ResultOf<R, F> flatMap(Function<? super T, ResultOf<R, F>> transform) {
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        return transform.apply(value);
    }

    @Override
    public <R> ResultOf<T, R> flatMapFailure(Function<? super F, ResultOf<T, R>> transform) {
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        return new Success<>(value);
    }

    @Override
    public ResultOf<T, F> recover(Function<? super F, ? extends T> transform) {
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        return this;
    }

    @Override
    public ResultOf<T, F> flatRecover(Function<? super F, ResultOf<T, F>> transform) {
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        return this;
    }

    @Override
    public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super F, ? extends R> onFailure) {
        if (onSuccess == null || onFailure == null) {
            throw new IllegalArgumentException("onSuccess and onFailure cannot be null");
        }
        return onSuccess.apply(value);
    }
}
