package com.ryuqq.railway.core.tuple;

import java.util.List;

/**
 * 2~7개 원소를 가진 값 묶음.
 *
 * <p>Step이 여러 값을 한 번에 반환하거나 입력으로 받을 때 사용합니다.
 * TypedMemory는 Tuple 자체를 키로 저장하지 않고 원소별로 분해해서 저장합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Tuple permits Tuple2, Tuple3, Tuple4, Tuple5, Tuple6, Tuple7 {

    /**
     * 원소를 선언 순서대로 반환.
     *
     * @return 원소 목록 (불변, null 원소 허용)
     */
    List<Object> values();

    default int arity() {
        return values().size();
    }
}
