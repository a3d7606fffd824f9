package com.edge.equipment.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 记录 /api 请求的方法、请求体、耗时和状态
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final int MAX_BODY_LOG_LENGTH = 1000;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // swagger 等静态资源不记录
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);

        long startTime = System.currentTimeMillis();
        logger.info(">>> {} {}", request.getMethod(), request.getRequestURI());

        try {
            filterChain.doFilter(requestWrapper, responseWrapper);
        } finally {
            long duration = System.currentTimeMillis() - startTime;

            if ("POST".equalsIgnoreCase(request.getMethod())) {
                byte[] content = requestWrapper.getContentAsByteArray();
                if (content.length > 0) {
                    logger.info("Request Body: {}", abbreviate(new String(content, StandardCharsets.UTF_8)));
                }
            }

            if (logger.isDebugEnabled()) {
                byte[] responseContent = responseWrapper.getContentAsByteArray();
                String contentType = response.getContentType();
                if (responseContent.length > 0 && contentType != null && contentType.contains("json")) {
                    logger.debug("Response Body: {}", abbreviate(new String(responseContent, StandardCharsets.UTF_8)));
                }
            }

            // 必须把缓存的响应体写回，否则客户端收不到数据
            responseWrapper.copyBodyToResponse();

            logger.info("<<< {} {} | Status: {} | Duration: {} ms",
                    request.getMethod(), request.getRequestURI(), response.getStatus(), duration);
        }
    }

    private static String abbreviate(String body) {
        return body.length() > MAX_BODY_LOG_LENGTH ? body.substring(0, MAX_BODY_LOG_LENGTH) + "..." : body;
    }
}
