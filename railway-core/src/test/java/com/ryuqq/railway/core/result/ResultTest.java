package com.ryuqq.railway.core.result;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Result 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ResultTest {

    @Test
    void success_HoldsValue() {
        // When
        Result<String> result = Result.success("ok");

        // Then
        assertTrue(result.isSuccess());
        assertFalse(result.isFailure());
        assertEquals("ok", ((Success<String>) result).value());
    }

    @Test
    void failure_NullException_ThrowsIllegalArgumentException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Result.failure(null));
    }

    @Test
    void map_OnSuccess_TransformsValue() {
        // When
        Result<Integer> mapped = Result.success("abcd").map(String::length);

        // Then
        assertEquals(4, ((Success<Integer>) mapped).value());
    }

    @Test
    void map_OnFailure_KeepsExceptionAndSkipsMapper() {
        // Given
        IllegalStateException cause = new IllegalStateException("broken");

        // When
        Result<Integer> mapped = Result.<String>failure(cause).map(value -> {
            throw new AssertionError("mapper must not run");
        });

        // Then
        assertSame(cause, ((Failure<Integer>) mapped).exception());
    }

    @Test
    void isCancelled_OnlyForCancellationFailures() {
        // When & Then
        assertTrue(Result.failure(new CancellationException("stop")).isCancelled());
        assertFalse(Result.failure(new IllegalStateException()).isCancelled());
        assertFalse(Result.success(1).isCancelled());
    }
}
