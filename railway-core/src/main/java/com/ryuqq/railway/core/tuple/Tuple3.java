package com.ryuqq.railway.core.tuple;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 3개 원소 Tuple.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Tuple3<A, B, C>(A first, B second, C third) implements Tuple {

    @Override
    public List<Object> values() {
        return Collections.unmodifiableList(Arrays.asList(first, second, third));
    }
}
