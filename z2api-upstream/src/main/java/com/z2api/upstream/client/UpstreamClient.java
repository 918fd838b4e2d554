package com.z2api.upstream.client;

import java.util.Optional;

/**
 * 上游服务客户端接口。
 * <p>
 * 凭据池只依赖这里的三个调用：探测令牌是否可用、用账号密码重新登录、转发对话请求。
 */
public interface UpstreamClient {

    /**
     * 用令牌发送一个最小的对话请求，判断令牌是否可用。
     * <p>
     * 超时、网络错误、非 2xx 状态一律返回 false，不抛异常。
     *
     * @param token 放在 Authorization: Bearer 中的令牌
     * @return 上游返回 2xx 时为 true
     */
    boolean probe(String token);

    /**
     * 用账号密码调用登录接口，取回新令牌。
     * <p>
     * 状态码错误、响应里没有 token 字段、网络错误时返回空。
     */
    Optional<String> signIn(String email, String password);

    /**
     * 将对话请求体原样转发给上游。
     *
     * @throws com.z2api.common.exception.UpstreamException 网络错误时抛出
     */
    UpstreamResponse chatCompletion(String requestBody, String token);
}
