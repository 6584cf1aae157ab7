package com.secops.threatintel.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.secops.threatintel.subscription.FilterExpression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Jackson 配置单元测试
 */
class JacksonConfigTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        Jackson2ObjectMapperBuilder builder = new Jackson2ObjectMapperBuilder();
        new JacksonConfig().threatIntelJacksonCustomizer().customize(builder);
        objectMapper = builder.build();
    }

    @Test
    @DisplayName("Instant 输出为 ISO-8601 字符串")
    void testInstantAsIsoString() throws Exception {
        String json = objectMapper.writeValueAsString(Map.of("firstSeen", Instant.parse("2024-03-01T08:00:00Z")));

        assertEquals("{\"firstSeen\":\"2024-03-01T08:00:00Z\"}", json);
    }

    @Test
    @DisplayName("过滤表达式按 op 反序列化为对应变体，未知字段忽略")
    void testFilterExpressionSubtypes() throws Exception {
        String json = "{\"op\":\"and\",\"operands\":["
            + "{\"op\":\"in\",\"field\":\"severity\",\"values\":[\"HIGH\",\"CRITICAL\"]},"
            + "{\"op\":\"gte\",\"field\":\"confidence\",\"threshold\":80,\"comment\":\"legacy\"}]}";

        FilterExpression filter = objectMapper.readValue(json, FilterExpression.class);

        FilterExpression.And and = assertInstanceOf(FilterExpression.And.class, filter);
        assertEquals(2, and.operands().size());
        assertInstanceOf(FilterExpression.In.class, and.operands().get(0));
        FilterExpression.AtLeast atLeast = assertInstanceOf(FilterExpression.AtLeast.class, and.operands().get(1));
        assertEquals(80.0, atLeast.threshold());
    }

    @Test
    @DisplayName("payload 中的 NaN 可以读入")
    void testNonNumericNumbersAccepted() throws Exception {
        Map<?, ?> payload = objectMapper.readValue("{\"score\":NaN,\"name\":null}", Map.class);

        assertTrue(Double.isNaN(((Number) payload.get("score")).doubleValue()));
    }

    @Test
    @DisplayName("null 字段不输出")
    void testNullFieldsOmitted() throws Exception {
        assertEquals("{\"id\":\"t1\"}", objectMapper.writeValueAsString(new Row("t1", null)));
    }

    record Row(String id, String description) {}
}
