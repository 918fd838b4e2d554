package com.z2api.common.util;

import java.util.UUID;

/**
 * ID 生成器工具类。
 */
public final class IdGenerator {

    private IdGenerator() {
    }

    /**
     * 标准格式 UUID（带连字符），上游的 chat_id / 消息 id 使用这种格式。
     */
    public static String uuid() {
        return UUID.randomUUID().toString();
    }

    /**
     * 生成带前缀的短 ID，如 "req-xxxx"，用于日志中关联一次转发。
     */
    public static String withPrefix(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
