package com.z2api.web.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Web 层配置。
 */
@Data
@ConfigurationProperties(prefix = "z2api.web")
public class WebProperties {

    /** 调用 /v1/** 需要携带的 Bearer Key，留空则不校验 */
    private String apiKey = "";
}
