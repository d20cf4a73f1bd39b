package com.ryuqq.resultof.core.catching;

import com.ryuqq.resultof.core.function.CheckedSupplier;
import com.ryuqq.resultof.core.result.Failure;
import com.ryuqq.resultof.core.result.ResultOf;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Catching 어댑터 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>정상 반환 → Success</li>
 *   <li>예외 발생 → 동일한 예외 인스턴스를 담은 Failure</li>
 *   <li>checked exception, Error도 포착</li>
 *   <li>InterruptedException 포착 시 인터럽트 플래그 복원</li>
 * </ul>
 *
 * @author ResultOf Team
 * @since 1.0.0
 */
class CatchingTest {

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @Test
    void runOrCatch_NormalReturn_ReturnsSuccess() {
        // When
        ResultOf<Integer, Throwable> result = Catching.runOrCatch(() -> 42);

        // Then
        assertEquals(ResultOf.success(42), result);
    }

    @Test
    void runOrCatch_DivideByZero_ReturnsFailureWithSameException() {
        // Given
        int zero = 0;

        // When
        ResultOf<Integer, Throwable> result = Catching.runOrCatch(() -> 10 / zero);

        // Then
        assertTrue(result.isFailure());
        assertInstanceOf(ArithmeticException.class, result.failureOrNull());
    }

    @Test
    void runOrCatch_ThrownInstance_IsExactlyWrapped() {
        // Given
        IllegalStateException thrown = new IllegalStateException("boom");

        // When
        ResultOf<String, Throwable> result = Catching.runOrCatch(() -> {
            throw thrown;
        });

        // Then
        assertEquals(new Failure<String, Throwable>(thrown), result);
        assertSame(thrown, result.failureOrNull());
    }

    @Test
    void runOrCatch_CheckedException_Captured() {
        // When
        ResultOf<byte[], Throwable> result = Catching.runOrCatch(() -> {
            throw new IOException("disk unavailable");
        });

        // Then
        IOException captured = assertInstanceOf(IOException.class, result.failureOrNull());
        assertEquals("disk unavailable", captured.getMessage());
    }

    @Test
    void runOrCatch_Error_Captured() {
        // When
        ResultOf<Object, Throwable> result = Catching.runOrCatch(() -> {
            throw new StackOverflowError("deep");
        });

        // Then
        assertInstanceOf(StackOverflowError.class, result.failureOrNull());
    }

    @Test
    void runOrCatch_InterruptedException_RestoresInterruptFlag() {
        // When
        ResultOf<Object, Throwable> result = Catching.runOrCatch(() -> {
            throw new InterruptedException("stop");
        });

        // Then
        assertInstanceOf(InterruptedException.class, result.failureOrNull());
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void runOrCatch_Receiver_PassedToBlock() {
        // Given
        AtomicReference<String> seen = new AtomicReference<>();

        // When
        ResultOf<Integer, Throwable> result = Catching.runOrCatch("128", receiver -> {
            seen.set(receiver);
            return Integer.parseInt(receiver);
        });

        // Then
        assertEquals("128", seen.get());
        assertEquals(ResultOf.success(128), result);
    }

    @Test
    void runOrCatch_ReceiverBlockThrows_ReturnsFailure() {
        // When
        ResultOf<Integer, Throwable> result = Catching.runOrCatch("not-a-number", Integer::parseInt);

        // Then
        assertInstanceOf(NumberFormatException.class, result.failureOrNull());
    }

    @Test
    void runOrCatch_ComposesWithMapFailure() {
        // When
        ResultOf<Integer, String> result = Catching.runOrCatch(() -> Integer.parseInt("x1"))
            .mapFailure(e -> e.getClass().getSimpleName());

        // Then
        assertEquals(ResultOf.failure("NumberFormatException"), result);
    }

    @Test
    void runOrCatch_NullBlock_ThrowsIllegalArgumentException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> Catching.runOrCatch((CheckedSupplier<Object>) null));
        assertThrows(IllegalArgumentException.class,
            () -> Catching.runOrCatch("x", null));
    }
}
