package com.ryuqq.resultof.core.function;

/**
 * 예외를 던질 수 있는 Function.
 *
 * @param <T> 인자 타입
 * @param <R> 반환 타입
 *
 * @author ResultOf Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CheckedFunction<T, R> {

    R apply(T t) throws Throwable;
}
