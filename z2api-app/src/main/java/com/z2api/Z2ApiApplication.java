package com.z2api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Z.ai 对话代理 - 启动类。
 */
@SpringBootApplication(scanBasePackages = "com.z2api")
@EnableScheduling
public class Z2ApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(Z2ApiApplication.class, args);
    }
}
