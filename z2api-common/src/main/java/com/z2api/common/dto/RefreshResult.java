package com.z2api.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个凭据刷新（重新登录）的结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefreshResult {

    private boolean success;

    private String message;

    /** 刷新成功后写回池中的完整凭据（email----password----token），失败时为 null */
    private String entry;

    public static RefreshResult failure(String message) {
        return RefreshResult.builder().success(false).message(message).build();
    }

    public static RefreshResult success(String entry, String message) {
        return RefreshResult.builder().success(true).entry(entry).message(message).build();
    }
}
