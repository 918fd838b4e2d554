package com.z2api.upstream.client;

import lombok.Value;

/**
 * 上游对话接口的原始响应：状态码、内容类型、响应体原样保留。
 */
@Value
public class UpstreamResponse {

    int statusCode;

    String contentType;

    String body;

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * 是否说明当前凭据有问题（鉴权失败、被限流或上游故障），应换一个凭据重试。
     */
    public boolean isCredentialFailure() {
        return statusCode == 401 || statusCode == 403 || statusCode == 429 || statusCode >= 500;
    }
}
