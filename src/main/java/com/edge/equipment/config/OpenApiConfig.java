package com.edge.equipment.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI equipmentMatcherOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Equipment Matcher API")
                        .description("""
                                装备图标识别 API 文档

                                ### 核心功能
                                - **特征缓存**：从基准装备目录构建持久化特征缓存（哈希失效）
                                - **图案 + 颜色匹配**：归一化互相关初筛，LAB 颜色距离复核
                                - **描述子回退匹配**：ORB 特征 + RANSAC 单应性几何校验

                                ### 匹配策略
                                | 策略 | 说明 |
                                |------|------|
                                | `PATTERN_COLOR` | 两阶段评分：图案得分 ≥ 阈值的候选再做颜色校验 |
                                | `DESCRIPTOR_GEOMETRIC` | ORB 关键点匹配，单应性内点校验 |

                                ### 错误响应格式
                                ```json
                                { "success": false, "message": "错误信息" }
                                ```
                                """)
                        .version("1.0.0"));
    }

    /**
     * 为 POST 接口补充统一的错误响应说明
     */
    @Bean
    public OpenApiCustomizer errorResponseCustomizer() {
        return openApi -> openApi.getPaths().forEach((path, pathItem) -> {
            if (pathItem.getPost() != null) {
                pathItem.getPost().getResponses().addApiResponse("400", createErrorResponse("请求错误"));
                pathItem.getPost().getResponses().addApiResponse("500", createErrorResponse("服务端错误"));
            }
        });
    }

    private ApiResponse createErrorResponse(String description) {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "success", new Schema<>().type("boolean").example(false),
                "message", new Schema<>().type("string").description("错误信息").example("目录不存在")
        ));

        return new ApiResponse()
                .description(description)
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }
}
