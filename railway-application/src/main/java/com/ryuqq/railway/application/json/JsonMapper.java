package com.ryuqq.railway.application.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Workflow 입력/출력과 Manifest 속성의 JSON 직렬화.
 *
 * <p>Jackson {@link ObjectMapper}를 JavaTimeModule과 함께 한 번만 구성해 공유합니다.
 * 직렬화 실패는 {@link IllegalStateException}으로 감싸 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JsonMapper {

    private final ObjectMapper objectMapper;

    public JsonMapper() {
        this(defaultObjectMapper());
    }

    public JsonMapper(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * 기본 ObjectMapper 구성.
     *
     * @return ISO-8601 날짜, 모르는 속성 무시
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * 객체를 JSON 문자열로 변환.
     *
     * @param value 대상 (null이면 null 반환)
     * @return JSON 문자열
     * @throws IllegalStateException 직렬화 실패 시
     */
    public String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getName() + " to JSON", e);
        }
    }

    /**
     * JSON 문자열을 객체로 변환.
     *
     * @param json JSON 문자열
     * @param type 대상 타입
     * @param <T> 대상 타입
     * @return 역직렬화된 객체
     * @throws IllegalStateException 역직렬화 실패 시
     */
    public <T> T read(String json, Class<T> type) {
        if (json == null) {
            throw new IllegalArgumentException("json cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize JSON into " + type.getName(), e);
        }
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}
