package com.z2api.config;

import com.z2api.pool.service.CredentialPoolManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * 应用启动时，从配置加载凭据到池中。
 * <p>
 * 配置方式（在 application.yml 中）：
 * z2api.cookies=token1,user@example.com----password----token2
 * <p>
 * 未配置时回退到环境变量 Z_AI_COOKIES。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialInitializer implements CommandLineRunner {

    private final CredentialPoolManager poolManager;

    @Value("${z2api.cookies:${Z_AI_COOKIES:}}")
    private String cookiesConfig;

    @Override
    public void run(String... args) {
        if (cookiesConfig == null || cookiesConfig.isBlank()) {
            log.warn("==============================================");
            log.warn("  未配置任何 Cookie！");
            log.warn("  请在 application.yml 中设置 z2api.cookies");
            log.warn("  或通过环境变量: Z_AI_COOKIES");
            log.warn("  也可以启动后通过 /api/cookies 接口添加");
            log.warn("==============================================");
            return;
        }

        List<String> entries = Arrays.stream(cookiesConfig.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();

        if (entries.isEmpty()) {
            log.warn("Cookie 配置为空");
            return;
        }

        poolManager.load(entries);
        log.info("已加载 {} 个凭据到凭据池", entries.size());
    }
}
