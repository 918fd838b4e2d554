package com.z2api.web.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web 模块配置。
 */
@Configuration
@ComponentScan(basePackages = "com.z2api.web")
@EnableConfigurationProperties(WebProperties.class)
@RequiredArgsConstructor
public class WebModuleConfig implements WebMvcConfigurer {

    private final WebProperties webProperties;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new ApiKeyInterceptor(webProperties))
                .addPathPatterns("/v1/**");
    }
}
