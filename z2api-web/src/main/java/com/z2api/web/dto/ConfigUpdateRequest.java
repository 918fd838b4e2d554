package com.z2api.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * 修改运行时配置的请求体，未出现的字段保持不变。
 */
@Data
public class ConfigUpdateRequest {

    @JsonProperty("api_key")
    private String apiKey;

    @JsonProperty("auto_refresh_tokens")
    private Boolean autoRefreshTokens;

    @JsonProperty("refresh_check_interval")
    private Integer refreshCheckInterval;
}
