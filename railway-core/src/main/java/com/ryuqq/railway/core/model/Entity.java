package com.ryuqq.railway.core.model;

/**
 * 테이블에 저장되는 행.
 *
 * <p>id는 저장소가 추가 시점에 할당합니다. 저장소는 {@link #copy()}로 사본을 보관하므로
 * 호출자가 가진 인스턴스를 수정해도 저장하기 전까지는 반영되지 않습니다.</p>
 *
 * @param <T> 구현 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Entity<T extends Entity<T>> {

    Long getId();

    void setId(Long id);

    /**
     * 필드 단위 사본.
     *
     * @return 새 인스턴스
     */
    T copy();
}
