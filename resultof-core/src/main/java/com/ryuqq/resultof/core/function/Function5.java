package com.ryuqq.resultof.core.function;

/**
 * 다섯 개의 인자를 받는 함수.
 *
 * @param <T1> 첫 번째 인자 타입
 * @param <T2> 두 번째 인자 타입
 * @param <T3> 세 번째 인자 타입
 * @param <T4> 네 번째 인자 타입
 * @param <T5> 다섯 번째 인자 타입
 * @param <R> 반환 타입
 *
 * @author ResultOf Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Function5<T1, T2, T3, T4, T5, R> {

    R apply(T1 t1, T2 t2, T3 t3, T4 t4, T5 t5);
}
