package com.z2api.web.dto;

import lombok.Data;

/**
 * 针对单个凭据的请求体（测试、单个刷新）。
 */
@Data
public class CookieRequest {

    private String cookie;
}
