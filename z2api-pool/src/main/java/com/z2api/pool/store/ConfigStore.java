package com.z2api.pool.store;

/**
 * 持久化配置存储，凭据池在内容变化后把凭据列表写回这里。
 * <p>
 * 写入失败由调用方捕获并记录日志，池的正确性不依赖持久化是否成功。
 */
@FunctionalInterface
public interface ConfigStore {

    void setValue(String key, String value);
}
