package com.z2api.web.exception;

import com.z2api.common.exception.Z2ApiException;

/**
 * 调用方未携带或携带了错误的 API Key。
 */
public class UnauthorizedException extends Z2ApiException {

    public UnauthorizedException(String message) {
        super("UNAUTHORIZED", message);
    }
}
