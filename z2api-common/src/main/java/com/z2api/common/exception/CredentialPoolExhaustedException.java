package com.z2api.common.exception;

/**
 * 凭据池耗尽异常，池为空或没有可用凭据时抛出。
 */
public class CredentialPoolExhaustedException extends Z2ApiException {

    public CredentialPoolExhaustedException(String message) {
        super("KEY_EXHAUSTED", message);
    }
}
