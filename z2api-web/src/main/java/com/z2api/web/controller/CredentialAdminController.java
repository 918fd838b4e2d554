package com.z2api.web.controller;

import com.z2api.common.dto.ApiResponse;
import com.z2api.common.dto.BatchRefreshResult;
import com.z2api.common.dto.PoolSnapshot;
import com.z2api.common.dto.RefreshResult;
import com.z2api.common.exception.InvalidRequestException;
import com.z2api.common.util.SecretMasker;
import com.z2api.pool.config.PoolProperties;
import com.z2api.pool.service.CredentialPoolManager;
import com.z2api.web.dto.CookieListRequest;
import com.z2api.web.dto.CookieRequest;
import com.z2api.web.dto.CookieTestResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 凭据池管理接口。
 */
@Slf4j
@RestController
@RequestMapping("/api/cookies")
@RequiredArgsConstructor
public class CredentialAdminController {

    private final CredentialPoolManager poolManager;
    private final PoolProperties poolProperties;

    @GetMapping
    public ApiResponse<PoolSnapshot> list() {
        return ApiResponse.ok(poolManager.listState());
    }

    /**
     * 用提交的列表整体替换凭据池，空白项会被忽略。
     */
    @PostMapping
    public ApiResponse<PoolSnapshot> replace(@RequestBody CookieListRequest request) {
        List<String> accepted = poolManager.replaceAll(request.getCookies());
        log.info("凭据池已被替换, 共 {} 个凭据", accepted.size());
        return ApiResponse.ok(poolManager.listState(), "已更新 " + accepted.size() + " 个 Cookie");
    }

    @DeleteMapping
    public ApiResponse<Void> clear() {
        poolManager.clearAll();
        log.info("凭据池已清空");
        return ApiResponse.ok(null, "已清空所有 Cookie");
    }

    @PostMapping("/test")
    public ApiResponse<CookieTestResult> test(@RequestBody CookieRequest request) {
        String cookie = requireCookie(request);
        boolean valid = poolManager.healthCheck(cookie);
        return ApiResponse.ok(new CookieTestResult(SecretMasker.mask(cookie), valid));
    }

    /**
     * 批量刷新所有带账号密码的凭据。
     *
     * @param maxConcurrent 同时在途的登录请求上限，不传则使用配置值
     */
    @PostMapping("/refresh")
    public ApiResponse<BatchRefreshResult> refreshAll(
            @RequestParam(value = "maxConcurrent", required = false) Integer maxConcurrent) {
        int limit = maxConcurrent != null ? maxConcurrent : poolProperties.getBatchRefreshMaxConcurrent();
        if (limit < 1) {
            throw new InvalidRequestException("maxConcurrent 必须大于 0");
        }
        BatchRefreshResult result = poolManager.batchRefresh(limit);
        return ApiResponse.ok(result, result.getMessage());
    }

    @PostMapping("/refresh-single")
    public ApiResponse<RefreshResult> refreshSingle(@RequestBody CookieRequest request) {
        RefreshResult result = poolManager.refreshSingle(requireCookie(request));
        if (!result.isSuccess()) {
            return ApiResponse.error("REFRESH_FAILED", result.getMessage());
        }
        return ApiResponse.ok(result, result.getMessage());
    }

    private String requireCookie(CookieRequest request) {
        if (request == null || request.getCookie() == null || request.getCookie().isBlank()) {
            throw new InvalidRequestException("cookie 不能为空");
        }
        return request.getCookie().trim();
    }
}
