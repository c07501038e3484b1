package com.ryuqq.fleet.application.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * 에이전트 wire 형식(snake_case JSON) 코덱.
 *
 * <p>에이전트는 새 필드를 추가해도 이전 버전 서버와 통신할 수 있어야 하므로
 * 알 수 없는 속성은 무시합니다. null 필드는 출력하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AgentJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .serializationInclusion(JsonInclude.Include.NON_NULL)
        .build();

    private AgentJson() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * 직렬화.
     *
     * @param value 대상 (poll 응답 등)
     * @return JSON 텍스트
     * @throws IllegalArgumentException value가 null인 경우
     * @throws IllegalStateException 직렬화 실패 시
     */
    public static String write(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * 역직렬화.
     *
     * @param json JSON 텍스트
     * @param type 대상 타입 (보고 레코드 등)
     * @param <T> 대상 타입
     * @return 역직렬화된 값
     * @throws IllegalArgumentException 입력이 null이거나 JSON 형식이 잘못된 경우
     */
    public static <T> T read(String json, Class<T> type) {
        if (json == null || type == null) {
            throw new IllegalArgumentException("json and type cannot be null");
        }
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + type.getSimpleName() + " payload: " + e.getOriginalMessage(), e);
        }
    }
}
