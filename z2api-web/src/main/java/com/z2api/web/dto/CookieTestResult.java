package com.z2api.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个凭据的探测结果，凭据本身已脱敏。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CookieTestResult {

    private String cookie;

    @JsonProperty("is_valid")
    private boolean valid;
}
