package com.z2api.common.exception;

/**
 * 上游服务调用异常（网络错误、上游持续返回错误状态等）。
 */
public class UpstreamException extends Z2ApiException {

    public UpstreamException(String message) {
        super("UPSTREAM_ERROR", message);
    }

    public UpstreamException(String message, Throwable cause) {
        super("UPSTREAM_ERROR", message, cause);
    }
}
