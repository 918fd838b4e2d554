package com.z2api.pool.service;

import com.z2api.common.dto.BatchRefreshResult;
import com.z2api.pool.config.PoolProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * 定时任务：定期批量刷新所有带账号密码的凭据，避免令牌过期。
 * <p>
 * 开关和间隔都从 {@link PoolProperties} 实时读取，管理接口修改后下一次检查即生效。
 */
@Slf4j
public class TokenAutoRefreshScheduler {

    private final CredentialPoolManager poolManager;
    private final PoolProperties properties;

    private volatile long lastRunMillis;

    public TokenAutoRefreshScheduler(CredentialPoolManager poolManager, PoolProperties properties) {
        this.poolManager = poolManager;
        this.properties = properties;
        this.lastRunMillis = System.currentTimeMillis();
    }

    @Scheduled(fixedDelayString = "${z2api.pool.auto-refresh-check-seconds:60}000")
    public void tick() {
        if (!properties.isAutoRefreshEnabled()) {
            return;
        }
        long elapsed = System.currentTimeMillis() - lastRunMillis;
        if (elapsed >= properties.getAutoRefreshIntervalSeconds() * 1000L) {
            refreshAll();
        }
    }

    public BatchRefreshResult refreshAll() {
        lastRunMillis = System.currentTimeMillis();
        log.info("开始定期批量刷新令牌");
        BatchRefreshResult result = poolManager.batchRefresh(properties.getBatchRefreshMaxConcurrent());
        log.info("定期刷新结束: 成功 {}, 失败 {}, 共 {}",
                result.getRefreshedCount(), result.getFailedCount(), result.getTotalCount());
        return result;
    }
}
