package com.secops.threatintel.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.TimeZone;

/**
 * Jackson 序列化配置
 * 在 Boot 自带的 ObjectMapper 上调整，HTTP 响应、SHARED 层缓存信封和订阅过滤表达式共用
 *
 * <ul>
 *   <li>Instant 等时间字段按 ISO-8601 字符串输出，时区固定 UTC</li>
 *   <li>缓存信封可能来自旧版本实例，未知字段忽略</li>
 *   <li>情报源 payload 中的 NaN / Infinity 允许读入，由过滤器按数值语义处理</li>
 * </ul>
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer threatIntelJacksonCustomizer() {
        return builder -> builder
            .timeZone(TimeZone.getTimeZone("UTC"))
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .featuresToDisable(
                SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                SerializationFeature.FAIL_ON_EMPTY_BEANS,
                DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .featuresToEnable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS.mappedFeature());
    }
}
