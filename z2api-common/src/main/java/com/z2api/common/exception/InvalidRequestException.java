package com.z2api.common.exception;

/**
 * 请求参数不合法（如提交的凭据列表为空）。
 */
public class InvalidRequestException extends Z2ApiException {

    public InvalidRequestException(String message) {
        super("INVALID_REQUEST", message);
    }
}
