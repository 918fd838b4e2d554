package com.z2api.web.service;

import com.z2api.common.exception.InvalidRequestException;
import com.z2api.common.util.SecretMasker;
import com.z2api.pool.config.PoolProperties;
import com.z2api.pool.store.ConfigStore;
import com.z2api.web.config.WebProperties;
import com.z2api.web.dto.ConfigUpdateRequest;
import com.z2api.web.dto.RuntimeConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 运行时可调整的配置：入站 API Key 和定期刷新开关/间隔。
 * <p>
 * 修改直接作用于内存中的配置对象，并以环境变量名写入持久化存储，重启后仍然生效。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuntimeConfigService {

    static final String API_KEY = "API_KEY";
    static final String AUTO_REFRESH_TOKENS = "AUTO_REFRESH_TOKENS";
    static final String REFRESH_CHECK_INTERVAL = "REFRESH_CHECK_INTERVAL";

    private final WebProperties webProperties;
    private final PoolProperties poolProperties;
    private final ConfigStore configStore;

    public RuntimeConfig current() {
        String apiKey = webProperties.getApiKey();
        return RuntimeConfig.builder()
                .apiKey(apiKey == null || apiKey.isEmpty() ? "" : SecretMasker.mask(apiKey))
                .autoRefreshTokens(poolProperties.isAutoRefreshEnabled())
                .refreshCheckInterval(poolProperties.getAutoRefreshIntervalSeconds())
                .build();
    }

    /**
     * 只更新请求中出现的字段，返回实际更新的字段名。
     */
    public List<String> update(ConfigUpdateRequest request) {
        if (request.getRefreshCheckInterval() != null && request.getRefreshCheckInterval() < 1) {
            throw new InvalidRequestException("refresh_check_interval 必须大于 0");
        }
        List<String> updated = new ArrayList<>();
        if (request.getApiKey() != null) {
            webProperties.setApiKey(request.getApiKey().trim());
            persist(API_KEY, webProperties.getApiKey());
            updated.add("api_key");
        }
        if (request.getAutoRefreshTokens() != null) {
            poolProperties.setAutoRefreshEnabled(request.getAutoRefreshTokens());
            persist(AUTO_REFRESH_TOKENS, String.valueOf(request.getAutoRefreshTokens()));
            updated.add("auto_refresh_tokens");
        }
        if (request.getRefreshCheckInterval() != null) {
            poolProperties.setAutoRefreshIntervalSeconds(request.getRefreshCheckInterval());
            persist(REFRESH_CHECK_INTERVAL, String.valueOf(request.getRefreshCheckInterval()));
            updated.add("refresh_check_interval");
        }
        log.info("运行时配置已更新: {}", updated);
        return updated;
    }

    private void persist(String key, String value) {
        try {
            configStore.setValue(key, value);
        } catch (Exception e) {
            log.warn("写入持久化存储失败（内存中的配置已生效）: {} {}", key, e.getMessage());
        }
    }
}
