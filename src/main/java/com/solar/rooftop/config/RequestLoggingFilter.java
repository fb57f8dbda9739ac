package com.solar.rooftop.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 请求日志：方法、路径、耗时、状态码，以及较小的 JSON 响应体
 * <p>
 * 上传的图像体不记录；静态图片（/uploads、/output）直接放行
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final int MAX_LOGGED_BODY = 5000;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String path = request.getRequestURI();
        if (path.startsWith("/uploads/") || path.startsWith("/output/")) {
            filterChain.doFilter(request, response);
            return;
        }

        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);
        long startTime = System.currentTimeMillis();

        try {
            String contentType = request.getContentType();
            boolean multipart = contentType != null && contentType.startsWith("multipart/");
            logger.info("=== Incoming Request ===");
            logger.info("Method: {} {}{}", request.getMethod(), path, multipart ? " (multipart)" : "");

            filterChain.doFilter(request, responseWrapper);

        } finally {
            long duration = System.currentTimeMillis() - startTime;

            byte[] responseContent = responseWrapper.getContentAsByteArray();
            String responseType = responseWrapper.getContentType();
            if (responseContent.length > 0 && responseContent.length < MAX_LOGGED_BODY
                    && responseType != null && responseType.contains("json")) {
                logger.debug("Response Body: {}", new String(responseContent, StandardCharsets.UTF_8));
            }

            // 必须复制回原始响应，否则客户端收不到数据
            responseWrapper.copyBodyToResponse();

            logger.info("Duration: {} ms | Status: {}", duration, response.getStatus());
        }
    }
}
