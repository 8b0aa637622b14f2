package com.ryuqq.railway.core.tuple;

import com.ryuqq.railway.core.type.TypeKeys;
import com.ryuqq.railway.core.workflow.WorkflowException;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.List;

/**
 * Tuple 생성 및 타입 판별 유틸리티.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Tuples {

    /** 지원하는 최대 원소 수. */
    public static final int MAX_ARITY = 7;

    private Tuples() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static <A, B> Tuple2<A, B> of(A first, B second) {
        return new Tuple2<>(first, second);
    }

    public static <A, B, C> Tuple3<A, B, C> of(A first, B second, C third) {
        return new Tuple3<>(first, second, third);
    }

    public static <A, B, C, D> Tuple4<A, B, C, D> of(A first, B second, C third, D fourth) {
        return new Tuple4<>(first, second, third, fourth);
    }

    public static <A, B, C, D, E> Tuple5<A, B, C, D, E> of(A first, B second, C third, D fourth, E fifth) {
        return new Tuple5<>(first, second, third, fourth, fifth);
    }

    public static <A, B, C, D, E, F> Tuple6<A, B, C, D, E, F> of(
        A first, B second, C third, D fourth, E fifth, F sixth) {
        return new Tuple6<>(first, second, third, fourth, fifth, sixth);
    }

    public static <A, B, C, D, E, F, G> Tuple7<A, B, C, D, E, F, G> of(
        A first, B second, C third, D fourth, E fifth, F sixth, G seventh) {
        return new Tuple7<>(first, second, third, fourth, fifth, sixth, seventh);
    }

    /**
     * 원소 목록으로 Tuple 생성.
     *
     * @param values 원소 목록
     * @return 원소 수에 맞는 Tuple
     * @throws WorkflowException 원소 수가 0, 1 또는 7 초과인 경우
     */
    public static Tuple fromValues(List<?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        checkArity(values.size());
        return switch (values.size()) {
            case 2 -> new Tuple2<>(values.get(0), values.get(1));
            case 3 -> new Tuple3<>(values.get(0), values.get(1), values.get(2));
            case 4 -> new Tuple4<>(values.get(0), values.get(1), values.get(2), values.get(3));
            case 5 -> new Tuple5<>(values.get(0), values.get(1), values.get(2), values.get(3), values.get(4));
            case 6 -> new Tuple6<>(values.get(0), values.get(1), values.get(2), values.get(3), values.get(4),
                values.get(5));
            default -> new Tuple7<>(values.get(0), values.get(1), values.get(2), values.get(3), values.get(4),
                values.get(5), values.get(6));
        };
    }

    /**
     * 타입이 Tuple 계열인지 확인.
     *
     * @param type 검사할 타입
     * @return Tuple 또는 그 구현 타입이면 true
     */
    public static boolean isTuple(Type type) {
        return Tuple.class.isAssignableFrom(TypeKeys.rawClass(type));
    }

    /**
     * Tuple 타입의 원소 타입 목록.
     *
     * <p>파라미터화되지 않은 Tuple(raw type)은 원소 타입을 알 수 없으므로 빈 목록을 반환하며,
     * 호출 측에서 길이 0 오류로 처리됩니다.</p>
     *
     * @param tupleType Tuple 타입
     * @return 원소 타입 목록
     */
    public static List<Type> elementTypes(Type tupleType) {
        if (tupleType instanceof ParameterizedType parameterized && isTuple(tupleType)) {
            return Arrays.asList(parameterized.getActualTypeArguments());
        }
        return List.of();
    }

    /**
     * 원소 수 검증.
     *
     * @param arity 원소 수
     * @throws WorkflowException 2~7 범위를 벗어난 경우
     */
    public static void checkArity(int arity) {
        if (arity == 0) {
            throw new WorkflowException("Cannot have Tuple of length 0.");
        }
        if (arity == 1) {
            throw new WorkflowException("Tuple of a single element is not supported. Use the element type directly.");
        }
        if (arity > MAX_ARITY) {
            throw new WorkflowException("Tuples larger than " + MAX_ARITY + " elements are not supported (length: "
                + arity + ").");
        }
    }
}
