package com.ryuqq.resultof.core.result;

import com.ryuqq.resultof.core.combine.Results;

import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 성공 또는 실패를 표현하는 결과 값.
 *
 * <p>ResultOf는 두 가지 경우 중 정확히 하나만을 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 성공 값(T)을 보유</li>
 *   <li>{@link Failure}: 실패 값(F)을 보유</li>
 * </ul>
 *
 * <p>실패 타입 F는 호출자가 자유롭게 선택합니다. {@link Throwable} 계층에 묶이지 않으므로
 * sealed interface 등으로 예상 가능한 실패를 명시적인 값으로 다룰 수 있습니다.</p>
 *
 * <p><strong>불변성:</strong> 모든 변환 연산은 새로운 ResultOf를 반환하며, 기존 값을 변경하지 않습니다.</p>
 *
 * <p><strong>예외 정책:</strong> 호출자가 전달한 함수에서 발생한 예외는 가로채지 않고 그대로 전파됩니다.
 * 예외를 값으로 변환하려면 {@link com.ryuqq.resultof.core.catching.Catching}을 사용하세요.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ResultOf&lt;Integer, String&gt; parsed = parse(input);
 * String message = parsed
 *     .map(value -&gt; value * 2)
 *     .recover(error -&gt; 0)
 *     .fold(value -&gt; "value=" + value, error -&gt; "error=" + error);
 * </pre>
 *
 * @param <T> 성공 값 타입
 * @param <F> 실패 값 타입
 *
 * @author ResultOf Team
 * @since 1.0.0
 */
public sealed interface ResultOf<T, F> permits Success, Failure {

    /**
     * 성공 결과 생성.
     *
     * @param value 성공 값 (null 허용)
     * @param <T> 성공 값 타입
     * @param <F> 실패 값 타입
     * @return Success 인스턴스
     */
    static <T, F> ResultOf<T, F> success(T value) {
        return new Success<>(value);
    }

    /**
     * 실패 결과 생성.
     *
     * @param value 실패 값 (null 허용)
     * @param <T> 성공 값 타입
     * @param <F> 실패 값 타입
     * @return Failure 인스턴스
     */
    static <T, F> ResultOf<T, F> failure(F value) {
        return new Failure<>(value);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    boolean isSuccess();

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    boolean isFailure();

    /**
     * 성공 값 조회.
     *
     * @return 성공이면 성공 값, 실패면 null (예외를 던지지 않음)
     */
    T getOrNull();

    /**
     * 실패 값 조회.
     *
     * @return 실패면 실패 값, 성공이면 null (예외를 던지지 않음)
     */
    F failureOrNull();

    /**
     * 성공 값 조회 (기본값 사용).
     *
     * @param fallback 실패인 경우 반환할 값
     * @return 성공 값 또는 fallback
     */
    T getOrElse(T fallback);

    /**
     * 성공 값 조회 (실패 시 예외).
     *
     * <p>실패 값이 {@link Throwable}이면 발생하는 예외의 cause로 연결됩니다.</p>
     *
     * @return 성공 값
     * @throws IllegalStateException 실패인 경우
     */
    T getOrThrow();

    /**
     * 성공 값을 Optional로 변환.
     *
     * <p>성공 값이 null이면 빈 Optional이 반환됩니다.</p>
     *
     * @return 성공 값을 담은 Optional
     */
    default Optional<T> toOptional() {
        return Optional.ofNullable(getOrNull());
    }

    /**
     * 성공인 경우 action 실행.
     *
     * @param action 성공 값을 받는 동작
     * @return 이 결과 (체이닝용)
     * @throws IllegalArgumentException action이 null인 경우
     */
    ResultOf<T, F> onSuccess(Consumer<? super T> action);

    /**
     * 실패인 경우 action 실행.
     *
     * @param action 실패 값을 받는 동작
     * @return 이 결과 (체이닝용)
     * @throws IllegalArgumentException action이 null인 경우
     */
    ResultOf<T, F> onFailure(Consumer<? super F> action);

    /**
     * 성공 값 변환.
     *
     * <p>실패인 경우 실패 값은 그대로 유지되고 성공 타입만 R로 바뀝니다.</p>
     *
     * @param transform 성공 값 변환 함수
     * @param <R> 새 성공 값 타입
     * @return 변환된 결과
     * @throws IllegalArgumentException transform이 null인 경우
     */
    <R> ResultOf<R, F> map(Function<? super T, ? extends R> transform);

    /**
     * 실패 값 변환.
     *
     * @param transform 실패 값 변환 함수
     * @param <R> 새 실패 값 타입
     * @return 변환된 결과
     * @throws IllegalArgumentException transform이 null인 경우
     */
    <R> ResultOf<T, R> mapFailure(Function<? super F, ? extends R> transform);

    /**
     * 성공 값에 대한 bind.
     *
     * <p>성공인 경우 transform이 반환한 결과를 그대로 반환합니다.</p>
     *
     * @param transform 성공 값을 새 결과로 변환하는 함수
     * @param <R> 새 성공 값 타입
     * @return transform의 결과 또는 기존 실패
     * @throws IllegalArgumentException transform이 null인 경우
     */
    <R> ResultOf<R, F> flatMap(Function<? super T, ResultOf<R, F>> transform);

    /**
     * 실패 값에 대한 bind.
     *
     * @param transform 실패 값을 새 결과로 변환하는 함수
     * @param <R> 새 실패 값 타입
     * @return transform의 결과 또는 기존 성공
     * @throws IllegalArgumentException transform이 null인 경우
     */
    <R> ResultOf<T, R> flatMapFailure(Function<? super F, ResultOf<T, R>> transform);

    /**
     * 실패를 성공으로 복구.
     *
     * @param transform 실패 값을 성공 값으로 변환하는 함수
     * @return 성공이면 그대로, 실패면 Success(transform(실패 값))
     * @throws IllegalArgumentException transform이 null인 경우
     */
    ResultOf<T, F> recover(Function<? super F, ? extends T> transform);

    /**
     * 실패를 새 결과로 복구 (복구 자체가 실패할 수 있음).
     *
     * @param transform 실패 값을 새 결과로 변환하는 함수
     * @return 성공이면 그대로, 실패면 transform의 결과
     * @throws IllegalArgumentException transform이 null인 경우
     */
    ResultOf<T, F> flatRecover(Function<? super F, ResultOf<T, F>> transform);

    /**
     * 두 경우를 하나의 값으로 합침.
     *
     * @param onSuccess 성공 값 처리 함수
     * @param onFailure 실패 값 처리 함수
     * @param <R> 결과 타입
     * @return 해당 경우의 함수가 반환한 값
     * @throws IllegalArgumentException 함수가 null인 경우
     */
    <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super F, ? extends R> onFailure);

    /**
     * 다른 결과와 결합.
     *
     * <p>{@link Results#combine(ResultOf, ResultOf, BiFunction)}과 동일합니다.</p>
     *
     * @param other 결합할 결과
     * @param transform 두 성공 값을 결합하는 함수
     * @param <U> other의 성공 값 타입
     * @param <R> 결합 결과 타입
     * @return 결합된 결과 (첫 번째 실패 우선)
     * @throws IllegalArgumentException other 또는 transform이 null인 경우
     */
    default <U, R> ResultOf<R, F> combine(
        ResultOf<U, F> other,
        BiFunction<? super T, ? super U, ? extends R> transform
    ) {
        return Results.combine(this, other, transform);
    }
}
