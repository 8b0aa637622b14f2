package com.ryuqq.railway.core.result;

/**
 * 성공 트랙.
 *
 * @param value 성공 값 (null 허용, 값이 없는 Step은 {@code Unit}을 반환)
 * @param <T> 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Success<T>(T value) implements Result<T> {
}
