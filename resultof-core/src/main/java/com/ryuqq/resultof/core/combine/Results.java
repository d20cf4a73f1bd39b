package com.ryuqq.resultof.core.combine;

import com.ryuqq.resultof.core.function.Function3;
import com.ryuqq.resultof.core.function.Function4;
import com.ryuqq.resultof.core.function.Function5;
import com.ryuqq.resultof.core.result.Failure;
import com.ryuqq.resultof.core.result.ResultOf;
import com.ryuqq.resultof.core.result.Success;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * 여러 ResultOf를 하나로 결합하는 함수 모음.
 *
 * <p>두 가지 계열을 제공합니다:</p>
 * <ul>
 *   <li>{@code combine}: 모든 입력이 성공이면 transform 결과를 Success로 감쌈</li>
 *   <li>{@code flatCombine}: 모든 입력이 성공이면 transform이 반환한 ResultOf를 그대로 반환</li>
 * </ul>
 *
 * <p><strong>단락 평가 규칙:</strong></p>
 * <ul>
 *   <li>입력을 인자 순서대로 검사</li>
 *   <li>첫 번째 Failure를 만나면 즉시 그 실패 값을 반환 (마지막 실패나 누적이 아님)</li>
 *   <li>Failure 이후의 입력은 검사하지 않으며, transform은 호출되지 않음</li>
 * </ul>
 *
 * <p>2~5개 고정 인자 오버로드는 각 입력의 성공 타입을 Object로 지운 뒤
 * 리스트 기반 결합({@link #flatCombine(List, Function)})에 위임하고,
 * transform 호출 시점에 위치별로 원래 타입을 복원합니다.
 * 단락 평가 로직은 리스트 기반 결합 한 곳에만 존재합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ResultOf&lt;Integer, String&gt; quantity = parseQuantity(input);
 * ResultOf&lt;String, String&gt; sku = parseSku(input);
 * ResultOf&lt;Order, String&gt; order = Results.combine(quantity, sku, Order::new);
 * </pre>
 *
 * @author ResultOf Team
 * @since 1.0.0
 */
public final class Results {

    // Utility class - prevent instantiation
    private Results() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 같은 타입의 결과 목록을 결합.
     *
     * @param results 결합할 결과 목록 (순서 유지)
     * @param transform 성공 값 목록을 결합하는 함수
     * @param <T> 성공 값 타입
     * @param <F> 실패 값 타입
     * @param <R> 결합 결과 타입
     * @return 모두 성공이면 Success(transform(values)), 아니면 첫 번째 Failure
     * @throws IllegalArgumentException results, transform 또는 검사한 원소가 null인 경우
     */
    public static <T, F, R> ResultOf<R, F> combine(
        List<? extends ResultOf<T, F>> results,
        Function<? super List<T>, ? extends R> transform
    ) {
        requireTransform(transform);
        return flatCombine(results, values -> new Success<R, F>(transform.apply(values)));
    }

    /**
     * 같은 타입의 결과 목록을 결합 (transform이 ResultOf 반환).
     *
     * <p>transform에는 수정 불가능한 성공 값 목록이 입력 순서대로 전달됩니다.
     * 빈 목록이면 transform이 빈 목록으로 호출됩니다.</p>
     *
     * @param results 결합할 결과 목록 (순서 유지)
     * @param transform 성공 값 목록을 새 결과로 변환하는 함수
     * @param <T> 성공 값 타입
     * @param <F> 실패 값 타입
     * @param <R> 결합 결과 타입
     * @return 모두 성공이면 transform의 결과, 아니면 첫 번째 Failure
     * @throws IllegalArgumentException results, transform 또는 검사한 원소가 null인 경우
     */
    public static <T, F, R> ResultOf<R, F> flatCombine(
        List<? extends ResultOf<T, F>> results,
        Function<? super List<T>, ResultOf<R, F>> transform
    ) {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        requireTransform(transform);

        List<T> values = new ArrayList<>(results.size());
        for (ResultOf<T, F> result : results) {
            if (result == null) {
                throw new IllegalArgumentException("results cannot contain null (index: " + values.size() + ")");
            }
            if (result.isFailure()) {
                return new Failure<>(result.failureOrNull());
            }
            values.add(result.getOrNull());
        }
        return transform.apply(Collections.unmodifiableList(values));
    }

    // ========== 2 ==========

    public static <T1, T2, F, R> ResultOf<R, F> combine(
        ResultOf<T1, F> r1,
        ResultOf<T2, F> r2,
        BiFunction<? super T1, ? super T2, ? extends R> transform
    ) {
        requireTransform(transform);
        return Results.<T1, T2, F, R>flatCombine(r1, r2, (v1, v2) -> new Success<>(transform.apply(v1, v2)));
    }

    public static <T1, T2, F, R> ResultOf<R, F> flatCombine(
        ResultOf<T1, F> r1,
        ResultOf<T2, F> r2,
        BiFunction<? super T1, ? super T2, ResultOf<R, F>> transform
    ) {
        requireTransform(transform);
        List<ResultOf<Object, F>> erased = List.of(erase(r1, "r1"), erase(r2, "r2"));
        return flatCombine(erased, values -> transform.apply(
            Results.<T1>restore(values.get(0)),
            Results.<T2>restore(values.get(1))
        ));
    }

    // ========== 3 ==========

    public static <T1, T2, T3, F, R> ResultOf<R, F> combine(
        ResultOf<T1, F> r1,
        ResultOf<T2, F> r2,
        ResultOf<T3, F> r3,
        Function3<? super T1, ? super T2, ? super T3, ? extends R> transform
    ) {
        requireTransform(transform);
        return Results.<T1, T2, T3, F, R>flatCombine(r1, r2, r3,
            (v1, v2, v3) -> new Success<>(transform.apply(v1, v2, v3)));
    }

    public static <T1, T2, T3, F, R> ResultOf<R, F> flatCombine(
        ResultOf<T1, F> r1,
        ResultOf<T2, F> r2,
        ResultOf<T3, F> r3,
        Function3<? super T1, ? super T2, ? super T3, ResultOf<R, F>> transform
    ) {
        requireTransform(transform);
        List<ResultOf<Object, F>> erased = List.of(erase(r1, "r1"), erase(r2, "r2"), erase(r3, "r3"));
        return flatCombine(erased, values -> transform.apply(
            Results.<T1>restore(values.get(0)),
            Results.<T2>restore(values.get(1)),
            Results.<T3>restore(values.get(2))
        ));
    }

    // ========== 4 ==========

    public static <T1, T2, T3, T4, F, R> ResultOf<R, F> combine(
        ResultOf<T1, F> r1,
        ResultOf<T2, F> r2,
        ResultOf<T3, F> r3,
        ResultOf<T4, F> r4,
        Function4<? super T1, ? super T2, ? super T3, ? super T4, ? extends R> transform
    ) {
        requireTransform(transform);
        return Results.<T1, T2, T3, T4, F, R>flatCombine(r1, r2, r3, r4,
            (v1, v2, v3, v4) -> new Success<>(transform.apply(v1, v2, v3, v4)));
    }

    public static <T1, T2, T3, T4, F, R> ResultOf<R, F> flatCombine(
        ResultOf<T1, F> r1,
        ResultOf<T2, F> r2,
        ResultOf<T3, F> r3,
        ResultOf<T4, F> r4,
        Function4<? super T1, ? super T2, ? super T3, ? super T4, ResultOf<R, F>> transform
    ) {
        requireTransform(transform);
        List<ResultOf<Object, F>> erased = List.of(
            erase(r1, "r1"), erase(r2, "r2"), erase(r3, "r3"), erase(r4, "r4"));
        return flatCombine(erased, values -> transform.apply(
            Results.<T1>restore(values.get(0)),
            Results.<T2>restore(values.get(1)),
            Results.<T3>restore(values.get(2)),
            Results.<T4>restore(values.get(3))
        ));
    }

    // ========== 5 ==========

    public static <T1, T2, T3, T4, T5, F, R> ResultOf<R, F> combine(
        ResultOf<T1, F> r1,
        ResultOf<T2, F> r2,
        ResultOf<T3, F> r3,
        ResultOf<T4, F> r4,
        ResultOf<T5, F> r5,
        Function5<? super T1, ? super T2, ? super T3, ? super T4, ? super T5, ? extends R> transform
    ) {
        requireTransform(transform);
        return Results.<T1, T2, T3, T4, T5, F, R>flatCombine(r1, r2, r3, r4, r5,
            (v1, v2, v3, v4, v5) -> new Success<>(transform.apply(v1, v2, v3, v4, v5)));
    }

    public static <T1, T2, T3, T4, T5, F, R> ResultOf<R, F> flatCombine(
        ResultOf<T1, F> r1,
        ResultOf<T2, F> r2,
        ResultOf<T3, F> r3,
        ResultOf<T4, F> r4,
        ResultOf<T5, F> r5,
        Function5<? super T1, ? super T2, ? super T3, ? super T4, ? super T5, ResultOf<R, F>> transform
    ) {
        requireTransform(transform);
        List<ResultOf<Object, F>> erased = List.of(
            erase(r1, "r1"), erase(r2, "r2"), erase(r3, "r3"), erase(r4, "r4"), erase(r5, "r5"));
        return flatCombine(erased, values -> transform.apply(
            Results.<T1>restore(values.get(0)),
            Results.<T2>restore(values.get(1)),
            Results.<T3>restore(values.get(2)),
            Results.<T4>restore(values.get(3)),
            Results.<T5>restore(values.get(4))
        ));
    }

    // ========== internal ==========

    private static void requireTransform(Object transform) {
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
    }

    /**
     * 성공 타입을 Object로 지움.
     *
     * <p>ResultOf는 불변이고 성공 값을 꺼내기만 하므로 안전합니다.</p>
     */
    @SuppressWarnings("unchecked")
    private static <F> ResultOf<Object, F> erase(ResultOf<?, F> result, String name) {
        if (result == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        return (ResultOf<Object, F>) result;
    }

    /**
     * 지워진 성공 값을 위치에 맞는 타입으로 복원.
     */
    @SuppressWarnings("unchecked")
    private static <V> V restore(Object value) {
        return (V) value;
    }
}
