package com.ryuqq.railway.core.type;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 메모리 키로 사용되는 {@link Type} 처리 유틸리티.
 *
 * <p>값이 저장되는 키는 구체 클래스와, 클래스 계층이 {@code implements}로 선언한 인터페이스들입니다.
 * 프록시 타입에 대한 특수 처리는 하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TypeKeys {

    private TypeKeys() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 타입의 raw class.
     *
     * @param type 타입
     * @return raw class (알 수 없으면 Object.class)
     */
    public static Class<?> rawClass(Type type) {
        if (type instanceof Class<?> clazz) {
            return clazz;
        }
        if (type instanceof ParameterizedType parameterized) {
            return (Class<?>) parameterized.getRawType();
        }
        if (type instanceof GenericArrayType array) {
            return java.lang.reflect.Array.newInstance(rawClass(array.getGenericComponentType()), 0).getClass();
        }
        if (type instanceof WildcardType wildcard) {
            return rawClass(wildcard.getUpperBounds()[0]);
        }
        if (type instanceof TypeVariable<?> variable) {
            return rawClass(variable.getBounds()[0]);
        }
        return Object.class;
    }

    /**
     * 클래스 계층이 선언한 모든 인터페이스 (상위 인터페이스 포함, 선언 순서).
     *
     * @param clazz 대상 클래스
     * @return 인터페이스 집합
     */
    public static Set<Class<?>> allInterfaces(Class<?> clazz) {
        Set<Class<?>> interfaces = new LinkedHashSet<>();
        Deque<Class<?>> pending = new ArrayDeque<>();
        for (Class<?> current = clazz; current != null; current = current.getSuperclass()) {
            for (Class<?> declared : current.getInterfaces()) {
                pending.add(declared);
            }
        }
        while (!pending.isEmpty()) {
            Class<?> next = pending.poll();
            if (interfaces.add(next)) {
                for (Class<?> parent : next.getInterfaces()) {
                    pending.add(parent);
                }
            }
        }
        return interfaces;
    }

    /**
     * 로그/오류 메시지용 짧은 타입 이름.
     *
     * @param type 타입
     * @return 패키지를 제외한 이름
     */
    public static String displayName(Type type) {
        if (type instanceof Class<?> clazz) {
            return clazz.getSimpleName();
        }
        if (type instanceof ParameterizedType parameterized) {
            StringBuilder builder = new StringBuilder(displayName(parameterized.getRawType())).append('<');
            Type[] arguments = parameterized.getActualTypeArguments();
            for (int i = 0; i < arguments.length; i++) {
                if (i > 0) {
                    builder.append(", ");
                }
                builder.append(displayName(arguments[i]));
            }
            return builder.append('>').toString();
        }
        return type.getTypeName();
    }

    /**
     * 타입 변수가 남아 있는지 확인.
     *
     * @param type 검사할 타입
     * @return 해석되지 않은 타입 변수나 wildcard가 포함되어 있으면 true
     */
    public static boolean isUnresolved(Type type) {
        if (type instanceof TypeVariable<?> || type instanceof WildcardType) {
            return true;
        }
        if (type instanceof ParameterizedType parameterized) {
            for (Type argument : parameterized.getActualTypeArguments()) {
                if (isUnresolved(argument)) {
                    return true;
                }
            }
        }
        if (type instanceof GenericArrayType array) {
            return isUnresolved(array.getGenericComponentType());
        }
        return false;
    }
}
