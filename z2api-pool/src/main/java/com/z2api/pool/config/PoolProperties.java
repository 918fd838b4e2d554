package com.z2api.pool.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 凭据池配置项。
 */
@Data
@ConfigurationProperties(prefix = "z2api.pool")
public class PoolProperties {

    /** 凭据列表的持久化方式: env（写回 .env 文件） / redis / none */
    private String storeType = "env";

    /** .env 文件路径，文件不存在时不写入 */
    private String envFile = ".env";

    /** 持久化时使用的键名 */
    private String persistKey = "Z_AI_COOKIES";

    /** Redis 存储时的键前缀 */
    private String redisKeyPrefix = "z2api:config:";

    /** 批量刷新时同时进行的登录请求上限 */
    private int batchRefreshMaxConcurrent = 20;

    /** 是否启动后台恢复循环 */
    private boolean recoveryEnabled = true;

    /** 恢复循环的执行间隔（秒） */
    private int recoveryIntervalSeconds = 600;

    /** 恢复循环出错后的重试间隔（秒） */
    private int recoveryErrorBackoffSeconds = 300;

    /** 是否定期批量刷新所有带账号密码的凭据 */
    private boolean autoRefreshEnabled = false;

    /** 定期批量刷新的间隔（秒） */
    private int autoRefreshIntervalSeconds = 3600;

    /** 检查是否到达刷新时间的周期（秒） */
    private int autoRefreshCheckSeconds = 60;

    /** 转发对话时单个请求最多换几次凭据重试 */
    private int retryCount = 2;

    /** 每次重试前的等待（毫秒），按重试次数递增 */
    private long retryBackoffMillis = 500;
}
