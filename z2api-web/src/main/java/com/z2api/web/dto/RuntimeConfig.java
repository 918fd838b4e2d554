package com.z2api.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 当前运行时配置，API Key 已脱敏。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuntimeConfig {

    @JsonProperty("api_key")
    private String apiKey;

    @JsonProperty("auto_refresh_tokens")
    private boolean autoRefreshTokens;

    /** 定期刷新间隔（秒） */
    @JsonProperty("refresh_check_interval")
    private int refreshCheckInterval;
}
