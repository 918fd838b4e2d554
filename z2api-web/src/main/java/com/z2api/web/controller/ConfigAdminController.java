package com.z2api.web.controller;

import com.z2api.common.dto.ApiResponse;
import com.z2api.common.dto.PoolSnapshot;
import com.z2api.pool.service.CredentialPoolManager;
import com.z2api.web.dto.ConfigUpdateRequest;
import com.z2api.web.dto.RuntimeConfig;
import com.z2api.web.service.RuntimeConfigService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 运行时配置管理接口。
 */
@RestController
@RequestMapping("/api/config")
@RequiredArgsConstructor
public class ConfigAdminController {

    private final RuntimeConfigService configService;
    private final CredentialPoolManager poolManager;

    @GetMapping
    public ApiResponse<RuntimeConfig> get() {
        return ApiResponse.ok(configService.current());
    }

    @PutMapping
    public ApiResponse<List<String>> update(@RequestBody ConfigUpdateRequest request) {
        List<String> updated = configService.update(request);
        return ApiResponse.ok(updated, "已更新配置: " + String.join(", ", updated));
    }

    /**
     * 按最近一次配置的凭据列表重建凭据池，失败记录和轮询位置一并清空。
     */
    @PostMapping("/reload")
    public ApiResponse<PoolSnapshot> reload() {
        return ApiResponse.ok(poolManager.reload(), "配置已重新加载");
    }
}
