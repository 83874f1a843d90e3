package com.ryuqq.milestone.adapter.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * 진행 파일용 공유 Jackson 매퍼.
 *
 * <p>Java time 타입은 ISO-8601 문자열로 씁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Jsons {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .findAndRegisterModules()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private Jsons() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static byte[] toBytes(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new ProgressStoreException("Failed to serialize JSON", e);
        }
    }
}
