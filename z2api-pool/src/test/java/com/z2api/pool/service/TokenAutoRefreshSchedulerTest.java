package com.z2api.pool.service;

import com.z2api.common.dto.BatchRefreshResult;
import com.z2api.pool.config.PoolProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class TokenAutoRefreshSchedulerTest {

    private CredentialPoolManager poolManager;
    private PoolProperties properties;
    private TokenAutoRefreshScheduler scheduler;

    @BeforeEach
    void setUp() {
        poolManager = mock(CredentialPoolManager.class);
        given(poolManager.batchRefresh(anyInt())).willReturn(BatchRefreshResult.empty());
        properties = new PoolProperties();
        properties.setBatchRefreshMaxConcurrent(7);
        scheduler = new TokenAutoRefreshScheduler(poolManager, properties);
    }

    @Test
    void disabledSchedulerNeverRefreshes() {
        properties.setAutoRefreshIntervalSeconds(0);

        scheduler.tick();

        verify(poolManager, never()).batchRefresh(anyInt());
    }

    @Test
    void enabledSchedulerRefreshesOnceIntervalHasPassed() {
        properties.setAutoRefreshEnabled(true);
        properties.setAutoRefreshIntervalSeconds(0);

        scheduler.tick();

        verify(poolManager).batchRefresh(7);
    }

    @Test
    void enabledSchedulerWaitsForInterval() {
        properties.setAutoRefreshEnabled(true);
        properties.setAutoRefreshIntervalSeconds(3600);

        scheduler.tick();

        verify(poolManager, never()).batchRefresh(anyInt());
    }

    @Test
    void switchingOnAtRuntimeTakesEffectOnNextTick() {
        properties.setAutoRefreshIntervalSeconds(0);
        scheduler.tick();

        properties.setAutoRefreshEnabled(true);
        scheduler.tick();

        verify(poolManager).batchRefresh(7);
    }
}
