package com.z2api.upstream.config;

import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 上游模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.z2api.upstream")
@EnableConfigurationProperties(UpstreamProperties.class)
public class UpstreamModuleConfig {

    /**
     * 共享连接池的基础客户端，探测、登录、转发各自在其上派生不同的超时。
     */
    @Bean
    public OkHttpClient upstreamHttpClient(UpstreamProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(10))
                .build();
    }
}
