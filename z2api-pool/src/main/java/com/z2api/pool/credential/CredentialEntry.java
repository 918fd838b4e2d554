package com.z2api.pool.credential;

import com.z2api.common.util.SecretMasker;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 池中的一个凭据，在放入池时解析一次。
 * <p>
 * 支持的存储格式：
 * <ul>
 *   <li>{@code token}：裸令牌，无法自动恢复</li>
 *   <li>{@code email----password----token}：完整凭据，可通过重新登录刷新</li>
 *   <li>{@code email----password}：尚未取得令牌的账号，刷新后变为完整凭据</li>
 * </ul>
 * 其它带分隔符的形状视为无法解析，不会被发往上游。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CredentialEntry {

    public static final String SEPARATOR = "----";

    public enum Kind {
        /** 裸令牌 */
        BARE,
        /** 账号 + 密码 + 令牌 */
        COMPOSITE,
        /** 账号 + 密码，尚无令牌 */
        PENDING,
        /** 格式不正确 */
        MALFORMED
    }

    Kind kind;

    /** 池中存储的原始字符串 */
    String raw;

    String email;

    String password;

    /** 发往上游的有效令牌，PENDING / MALFORMED 为 null */
    String token;

    public static CredentialEntry parse(String raw) {
        if (!raw.contains(SEPARATOR)) {
            return new CredentialEntry(Kind.BARE, raw, "", "", raw);
        }
        String[] parts = raw.split(SEPARATOR, -1);
        if (parts.length == 3 && !parts[2].isBlank()) {
            return new CredentialEntry(Kind.COMPOSITE, raw, parts[0], parts[1], parts[2]);
        }
        if (parts.length == 2 && !parts[0].isBlank() && !parts[1].isBlank()) {
            return new CredentialEntry(Kind.PENDING, raw, parts[0], parts[1], null);
        }
        return new CredentialEntry(Kind.MALFORMED, raw, "", "", null);
    }

    /**
     * 用账号密码和新令牌组装完整凭据。
     */
    public static CredentialEntry composite(String email, String password, String token) {
        return parse(email + SEPARATOR + password + SEPARATOR + token);
    }

    public Optional<String> effectiveToken() {
        return Optional.ofNullable(token);
    }

    /** 是否带有可用于重新登录的密码 */
    public boolean hasCredentials() {
        return (kind == Kind.COMPOSITE || kind == Kind.PENDING) && !password.isBlank();
    }

    /**
     * 能解析到这个凭据的所有别名：原始字符串和有效令牌。
     */
    public List<String> aliases() {
        List<String> aliases = new ArrayList<>(2);
        aliases.add(raw);
        if (token != null && !token.equals(raw)) {
            aliases.add(token);
        }
        return aliases;
    }

    /** 日志中使用的脱敏描述 */
    public String describe() {
        if (kind == Kind.COMPOSITE || kind == Kind.PENDING) {
            return SecretMasker.maskEmail(email) + " / " + (token != null ? SecretMasker.mask(token) : "(no token)");
        }
        return SecretMasker.mask(raw);
    }

    @Override
    public String toString() {
        return "CredentialEntry(" + kind + ", " + describe() + ")";
    }
}
