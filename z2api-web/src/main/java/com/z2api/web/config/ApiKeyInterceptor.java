package com.z2api.web.config;

import com.z2api.web.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 校验调用方的 Bearer Key。未配置 Key 时放行所有请求。
 */
public class ApiKeyInterceptor implements HandlerInterceptor {

    private static final String BEARER_PREFIX = "Bearer ";

    private final WebProperties webProperties;

    public ApiKeyInterceptor(WebProperties webProperties) {
        this.webProperties = webProperties;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String expected = webProperties.getApiKey();
        if (expected == null || expected.isBlank()) {
            return true;
        }
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            throw new UnauthorizedException("缺少 Authorization: Bearer <key> 请求头");
        }
        if (!expected.equals(header.substring(BEARER_PREFIX.length()).trim())) {
            throw new UnauthorizedException("API Key 无效");
        }
        return true;
    }
}
