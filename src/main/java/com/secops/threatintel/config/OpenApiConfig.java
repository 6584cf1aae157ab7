package com.secops.threatintel.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI 3.0 文档配置
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("威胁情报数据访问 API")
                .version("1.0.0")
                .description("""
                    多租户威胁情报数据访问层

                    ## 读路径
                    - 查询成本分析 → 策略选择 → 优化执行
                    - 请求级批量缓存 + LOCAL/SHARED 分层结果缓存

                    ## 订阅
                    - 组织级主题，SSE 推送
                    - 按订阅过滤、按组织主题限流、心跳与陈旧订阅清理

                    ## 身份请求头
                    X-Organization-Id / X-User-Id / X-User-Role
                    """)
                .license(new License()
                    .name("Apache 2.0")
                    .url("https://www.apache.org/licenses/LICENSE-2.0")));
    }
}
