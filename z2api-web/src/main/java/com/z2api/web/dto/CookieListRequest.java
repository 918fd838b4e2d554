package com.z2api.web.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 整体替换凭据池的请求体。
 */
@Data
public class CookieListRequest {

    private List<String> cookies = new ArrayList<>();
}
