package com.z2api.pool.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 基于 Redis 的配置存储，适合多实例部署时共享凭据列表。
 */
@Slf4j
public class RedisConfigStore implements ConfigStore {

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisConfigStore(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public void setValue(String key, String value) {
        redisTemplate.opsForValue().set(keyPrefix + key, value);
        log.debug("已写入 Redis: {}{}", keyPrefix, key);
    }
}
