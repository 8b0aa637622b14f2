package com.ryuqq.railway.core.tuple;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 5개 원소 Tuple.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Tuple5<A, B, C, D, E>(A first, B second, C third, D fourth, E fifth) implements Tuple {

    @Override
    public List<Object> values() {
        return Collections.unmodifiableList(Arrays.asList(first, second, third, fourth, fifth));
    }
}
