package com.ryuqq.resilience.application.registry;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.OutputStream;

/**
 * {@link ResilienceReport}를 JSON으로 직렬화.
 *
 * <p>외부 메트릭 수집기가 주기적으로 가져가는(pull) 용도입니다. 엔진은 네트워크로 직접 내보내지 않습니다.</p>
 *
 * <p><strong>출력 형식:</strong></p>
 * <ul>
 *   <li>속성 이름은 snake_case ({@code circuit_breakers}, {@code retry_managers}, {@code bulkheads}, ...)</li>
 *   <li>시각은 ISO-8601 문자열</li>
 *   <li>맵 키(의존성 이름)는 그대로 유지</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ResilienceReportJsonWriter {

    private final ObjectMapper objectMapper;

    public ResilienceReportJsonWriter() {
        this(false);
    }

    /**
     * 생성자.
     *
     * @param prettyPrint 들여쓰기 여부
     */
    public ResilienceReportJsonWriter(boolean prettyPrint) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        if (prettyPrint) {
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
        this.objectMapper = mapper;
    }

    /**
     * JSON 문자열로 변환.
     *
     * @param report 스냅샷
     * @return JSON
     * @throws IllegalStateException 직렬화 실패 시
     */
    public String write(ResilienceReport report) {
        if (report == null) {
            throw new IllegalArgumentException("report cannot be null");
        }
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize resilience report", e);
        }
    }

    /**
     * 스트림으로 출력.
     *
     * @param report 스냅샷
     * @param out 출력 스트림 (닫지 않음)
     * @throws IOException 출력 실패 시
     */
    public void writeTo(ResilienceReport report, OutputStream out) throws IOException {
        if (report == null) {
            throw new IllegalArgumentException("report cannot be null");
        }
        objectMapper.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .writeValue(out, report);
    }
}
