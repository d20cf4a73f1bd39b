package com.ryuqq.resultof.core.function;

/**
 * 예외를 던질 수 있는 Supplier.
 *
 * <p>checked exception을 포함한 모든 {@link Throwable}을 선언하므로
 * {@link com.ryuqq.resultof.core.catching.Catching}에서 감싸지 않고 포착할 수 있습니다.</p>
 *
 * @param <R> 반환 타입
 *
 * @author ResultOf Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CheckedSupplier<R> {

    /**
     * 값 계산.
     *
     * @return 계산된 값
     * @throws Throwable 계산 중 발생한 예외
     */
    R get() throws Throwable;
}
