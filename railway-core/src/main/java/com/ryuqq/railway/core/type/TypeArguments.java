package com.ryuqq.railway.core.type;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 제네릭 상위 타입의 실제 타입 인자 해석.
 *
 * <p>{@code class IntToString implements Step<Integer, String>}처럼 선언된 클래스에서
 * {@code Step}의 타입 인자 {@code [Integer, String]}을 찾아냅니다.
 * 중간 클래스가 타입 변수를 넘겨주는 경우에도 치환을 따라갑니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TypeArguments {

    private TypeArguments() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * target 제네릭 타입에 대한 실제 타입 인자 조회.
     *
     * @param type 탐색을 시작할 타입 (클래스 또는 파라미터화된 타입)
     * @param target 타입 인자를 구할 제네릭 상위 타입
     * @return 타입 인자 배열 (계층에 target이 없으면 empty)
     */
    public static Optional<Type[]> resolve(Type type, Class<?> target) {
        return Optional.ofNullable(find(type, target, Map.of()));
    }

    private static Type[] find(Type type, Class<?> target, Map<TypeVariable<?>, Type> bindings) {
        Class<?> raw;
        Map<TypeVariable<?>, Type> local = new HashMap<>();

        if (type instanceof ParameterizedType parameterized) {
            raw = (Class<?>) parameterized.getRawType();
            TypeVariable<?>[] parameters = raw.getTypeParameters();
            Type[] arguments = parameterized.getActualTypeArguments();
            for (int i = 0; i < parameters.length; i++) {
                local.put(parameters[i], substitute(arguments[i], bindings));
            }
        } else if (type instanceof Class<?> clazz) {
            raw = clazz;
        } else {
            return null;
        }

        if (raw == target) {
            TypeVariable<?>[] parameters = raw.getTypeParameters();
            Type[] resolved = new Type[parameters.length];
            for (int i = 0; i < parameters.length; i++) {
                resolved[i] = local.getOrDefault(parameters[i], parameters[i]);
            }
            return resolved;
        }

        for (Type generic : raw.getGenericInterfaces()) {
            Type[] found = find(generic, target, local);
            if (found != null) {
                return found;
            }
        }
        Type superclass = raw.getGenericSuperclass();
        return superclass == null ? null : find(superclass, target, local);
    }

    private static Type substitute(Type type, Map<TypeVariable<?>, Type> bindings) {
        if (type instanceof TypeVariable<?> variable && bindings.containsKey(variable)) {
            return bindings.get(variable);
        }
        return type;
    }
}
