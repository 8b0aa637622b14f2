package com.ryuqq.railway.core.tuple;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 2개 원소 Tuple.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Tuple2<A, B>(A first, B second) implements Tuple {

    @Override
    public List<Object> values() {
        return Collections.unmodifiableList(Arrays.asList(first, second));
    }
}
