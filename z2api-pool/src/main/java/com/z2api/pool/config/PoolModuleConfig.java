package com.z2api.pool.config;

import com.z2api.pool.credential.CredentialPool;
import com.z2api.pool.credential.InMemoryCredentialPool;
import com.z2api.pool.service.CredentialPoolManager;
import com.z2api.pool.service.CredentialRecoveryScheduler;
import com.z2api.pool.service.TokenAutoRefreshScheduler;
import com.z2api.pool.store.ConfigStore;
import com.z2api.pool.store.EnvFileConfigStore;
import com.z2api.pool.store.RedisConfigStore;
import com.z2api.upstream.client.UpstreamClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.file.Path;
import java.time.Duration;

/**
 * 凭据池模块配置。
 * <p>
 * 凭据池是显式构造的单个实例，由 Spring 注入到转发服务和管理接口；
 * 恢复循环随应用上下文启动、随其关闭而停止。
 * <p>
 * 通过 {@code z2api.pool.store-type} 切换凭据列表的持久化方式：
 * <ul>
 *   <li>{@code env}（默认）：写回 .env 文件</li>
 *   <li>{@code redis}：写入 Redis，适合多实例部署</li>
 *   <li>{@code none}：不持久化</li>
 * </ul>
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.z2api.pool")
@EnableConfigurationProperties(PoolProperties.class)
public class PoolModuleConfig {

    @Bean
    public CredentialPool credentialPool() {
        return new InMemoryCredentialPool();
    }

    @Bean
    public CredentialPoolManager credentialPoolManager(CredentialPool credentialPool, UpstreamClient upstreamClient,
                                                       ConfigStore configStore, PoolProperties properties) {
        return new CredentialPoolManager(credentialPool, upstreamClient, configStore, properties);
    }

    @Bean
    @ConditionalOnProperty(name = "z2api.pool.recovery-enabled", havingValue = "true", matchIfMissing = true)
    public CredentialRecoveryScheduler credentialRecoveryScheduler(CredentialPoolManager credentialPoolManager,
                                                                   PoolProperties properties) {
        return new CredentialRecoveryScheduler(credentialPoolManager,
                Duration.ofSeconds(properties.getRecoveryIntervalSeconds()),
                Duration.ofSeconds(properties.getRecoveryErrorBackoffSeconds()));
    }

    /**
     * 定期刷新任务始终注册，是否执行由 {@code z2api.pool.auto-refresh-enabled} 在运行时决定。
     */
    @Bean
    public TokenAutoRefreshScheduler tokenAutoRefreshScheduler(CredentialPoolManager credentialPoolManager,
                                                               PoolProperties properties) {
        log.info("定期批量刷新: {}，间隔 {} 秒", properties.isAutoRefreshEnabled() ? "开启" : "关闭",
                properties.getAutoRefreshIntervalSeconds());
        return new TokenAutoRefreshScheduler(credentialPoolManager, properties);
    }

    // ==================== 持久化存储 ====================

    @Bean
    @ConditionalOnProperty(name = "z2api.pool.store-type", havingValue = "env", matchIfMissing = true)
    public ConfigStore envFileConfigStore(PoolProperties properties) {
        log.info("凭据列表将写回环境文件: {}", properties.getEnvFile());
        return new EnvFileConfigStore(Path.of(properties.getEnvFile()));
    }

    @Bean
    @ConditionalOnProperty(name = "z2api.pool.store-type", havingValue = "redis")
    public ConfigStore redisConfigStore(StringRedisTemplate redisTemplate, PoolProperties properties) {
        log.info("凭据列表将写入 Redis（分布式模式）");
        return new RedisConfigStore(redisTemplate, properties.getRedisKeyPrefix());
    }

    @Bean
    @ConditionalOnProperty(name = "z2api.pool.store-type", havingValue = "none")
    public ConfigStore noopConfigStore() {
        log.info("凭据列表不做持久化");
        return (key, value) -> log.debug("跳过持久化: {}", key);
    }
}
