package com.ryuqq.railway.core.memory;

import com.ryuqq.railway.core.tuple.Tuple;
import com.ryuqq.railway.core.tuple.Tuples;
import com.ryuqq.railway.core.type.TypeKeys;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 타입을 키로 하는 Workflow 실행용 메모리.
 *
 * <p>한 타입당 하나의 값만 유지하며 같은 타입을 다시 쓰면 덮어씁니다.
 * Workflow 실행마다 새로 만들어지고 실행이 끝나면 버려집니다.</p>
 *
 * <p><strong>저장 규칙:</strong></p>
 * <ul>
 *   <li>선언 타입(예: {@code List<Order>}) 키로 저장</li>
 *   <li>값의 구체 클래스와 그 클래스가 구현한 모든 인터페이스 키로도 저장</li>
 *   <li>Tuple은 원소별로 분해해서 저장하며 Tuple 타입 자체는 키가 되지 않음</li>
 *   <li>null 값은 저장하지 않음</li>
 * </ul>
 *
 * <p>Workflow 한 인스턴스 안에서만 사용되므로 동기화하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TypedMemory {

    private final Map<Type, Object> values = new HashMap<>();

    /**
     * {@link Unit}으로 초기화된 메모리 생성.
     */
    public TypedMemory() {
        values.put(Unit.class, Unit.INSTANCE);
    }

    /**
     * 값의 런타임 타입을 기준으로 저장.
     *
     * @param value 저장할 값 (null이면 무시)
     */
    public void store(Object value) {
        if (value == null) {
            return;
        }
        store(value.getClass(), value);
    }

    /**
     * 선언 타입을 기준으로 저장.
     *
     * @param declaredType 선언 타입
     * @param value 저장할 값 (null이면 무시)
     * @throws IllegalArgumentException declaredType이 null인 경우
     */
    public void store(Type declaredType, Object value) {
        if (declaredType == null) {
            throw new IllegalArgumentException("declaredType cannot be null");
        }
        if (value == null) {
            return;
        }
        if (value instanceof Tuple tuple) {
            storeTuple(declaredType, tuple);
            return;
        }
        storeValue(declaredType, value);
    }

    /**
     * 지정한 키 하나에만 저장 (인터페이스 전개 없음).
     *
     * @param key 키 타입
     * @param value 저장할 값
     */
    public void put(Type key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            values.remove(key);
            return;
        }
        values.put(key, value);
    }

    /**
     * 타입으로 조회.
     *
     * <p>파라미터화된 타입을 직접 찾지 못하면 raw class 키를 한 번 더 조회합니다.</p>
     *
     * @param type 조회할 타입
     * @return 값 (없으면 empty)
     */
    public Optional<Object> get(Type type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        Object value = values.get(type);
        if (value == null && type instanceof ParameterizedType parameterized) {
            value = values.get(parameterized.getRawType());
        }
        return Optional.ofNullable(value);
    }

    public <T> Optional<T> get(Class<T> type) {
        return get((Type) type).map(type::cast);
    }

    public boolean contains(Type type) {
        return get(type).isPresent();
    }

    /**
     * 현재 저장된 키 목록 (테스트 및 진단용).
     *
     * @return 읽기 전용 키 집합
     */
    public Set<Type> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public int size() {
        return values.size();
    }

    private void storeTuple(Type declaredType, Tuple tuple) {
        List<Object> elements = tuple.values();
        List<Type> elementTypes = Tuples.elementTypes(declaredType);
        for (int i = 0; i < elements.size(); i++) {
            Object element = elements.get(i);
            if (element == null) {
                continue;
            }
            Type elementType = i < elementTypes.size() && !TypeKeys.isUnresolved(elementTypes.get(i))
                ? elementTypes.get(i)
                : element.getClass();
            store(elementType, element);
        }
    }

    private void storeValue(Type declaredType, Object value) {
        values.put(declaredType, value);
        Class<?> concrete = value.getClass();
        values.put(concrete, value);
        for (Class<?> implemented : TypeKeys.allInterfaces(concrete)) {
            values.put(implemented, value);
        }
    }
}
