package com.z2api.common.util;

/**
 * 日志脱敏工具：令牌、密码、邮箱只保留很短的前缀。
 */
public final class SecretMasker {

    private static final int VISIBLE_PREFIX = 8;

    private SecretMasker() {
    }

    /**
     * 保留前 8 个字符，其余替换为 {@code ***}；过短的值整体隐藏。
     */
    public static String mask(String secret) {
        if (secret == null || secret.length() <= VISIBLE_PREFIX) return "***";
        return secret.substring(0, VISIBLE_PREFIX) + "***";
    }

    /**
     * 邮箱只保留用户名前 3 个字符和域名，如 {@code abc***@example.com}。
     */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) return "unknown";
        int at = email.indexOf('@');
        if (at <= 0) return mask(email);
        String name = email.substring(0, at);
        String visible = name.length() <= 3 ? name.substring(0, 1) : name.substring(0, 3);
        return visible + "***" + email.substring(at);
    }
}
