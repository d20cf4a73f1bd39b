package com.ryuqq.resultof.core.catching;

import com.ryuqq.resultof.core.function.CheckedFunction;
import com.ryuqq.resultof.core.function.CheckedSupplier;
import com.ryuqq.resultof.core.result.Failure;
import com.ryuqq.resultof.core.result.ResultOf;
import com.ryuqq.resultof.core.result.Success;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 예외를 ResultOf로 변환하는 어댑터.
 *
 * <p>예외 기반 코드와 값 기반 ResultOf 사이의 유일한 연결 지점입니다.
 * 다른 연산({@code map}, {@code combine} 등)은 호출자 함수의 예외를 가로채지 않습니다.</p>
 *
 * <p><strong>변환 규칙:</strong></p>
 * <ul>
 *   <li>block이 정상 반환 → {@code Success(value)}</li>
 *   <li>block이 {@link Throwable} 발생 → {@code Failure(throwable)} (동일 인스턴스)</li>
 *   <li>{@link InterruptedException}인 경우 현재 스레드의 인터럽트 플래그 복원</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ResultOf&lt;byte[], Throwable&gt; bytes = Catching.runOrCatch(() -&gt; Files.readAllBytes(path));
 * ResultOf&lt;Integer, Throwable&gt; length = Catching.runOrCatch("42", Integer::parseInt);
 * </pre>
 *
 * @author ResultOf Team
 * @since 1.0.0
 */
public final class Catching {

    private static final Logger log = LoggerFactory.getLogger(Catching.class);

    // Utility class - prevent instantiation
    private Catching() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * block 실행 후 결과 또는 예외를 ResultOf로 반환.
     *
     * @param block 실행할 블록
     * @param <R> 성공 값 타입
     * @return 성공 값 또는 포착된 예외
     * @throws IllegalArgumentException block이 null인 경우
     */
    public static <R> ResultOf<R, Throwable> runOrCatch(CheckedSupplier<? extends R> block) {
        if (block == null) {
            throw new IllegalArgumentException("block cannot be null");
        }
        try {
            return new Success<>(block.get());
        } catch (Throwable e) {
            return captured(e);
        }
    }

    /**
     * receiver를 인자로 block 실행 후 결과 또는 예외를 ResultOf로 반환.
     *
     * @param receiver block에 전달할 값 (null 허용)
     * @param block 실행할 블록
     * @param <T> receiver 타입
     * @param <R> 성공 값 타입
     * @return 성공 값 또는 포착된 예외
     * @throws IllegalArgumentException block이 null인 경우
     */
    public static <T, R> ResultOf<R, Throwable> runOrCatch(T receiver, CheckedFunction<? super T, ? extends R> block) {
        if (block == null) {
            throw new IllegalArgumentException("block cannot be null");
        }
        try {
            return new Success<>(block.apply(receiver));
        } catch (Throwable e) {
            return captured(e);
        }
    }

    private static <R> ResultOf<R, Throwable> captured(Throwable e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        log.debug("runOrCatch captured {}", e.getClass().getName(), e);
        return new Failure<>(e);
    }
}
