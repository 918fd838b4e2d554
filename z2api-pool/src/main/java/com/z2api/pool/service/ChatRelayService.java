package com.z2api.pool.service;

import com.z2api.common.exception.CredentialPoolExhaustedException;
import com.z2api.common.exception.UpstreamException;
import com.z2api.common.util.IdGenerator;
import com.z2api.common.util.SecretMasker;
import com.z2api.pool.config.PoolProperties;
import com.z2api.upstream.client.UpstreamClient;
import com.z2api.upstream.client.UpstreamResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 对话转发服务：从凭据池取凭据调用上游，并把结果反馈给凭据池。
 * <p>
 * 鉴权失败、限流、上游 5xx 或网络错误时标记当前凭据失败并换下一个重试；
 * 2xx 标记成功；其它 4xx 属于请求本身的问题，原样返回。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatRelayService {

    private final CredentialPoolManager poolManager;
    private final UpstreamClient upstreamClient;
    private final PoolProperties properties;

    public UpstreamResponse relay(String requestBody) {
        String requestId = IdGenerator.withPrefix("req");
        int maxRetries = properties.getRetryCount();
        UpstreamResponse lastResponse = null;
        Exception lastException = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            String token = poolManager.acquire()
                    .orElseThrow(() -> new CredentialPoolExhaustedException("凭据池为空，请先在管理界面添加 Cookie"));
            try {
                UpstreamResponse response = upstreamClient.chatCompletion(requestBody, token);
                if (response.isSuccessful()) {
                    poolManager.markSuccess(token);
                    return response;
                }
                if (!response.isCredentialFailure()) {
                    return response;
                }
                log.warn("[{}] 上游返回 {}，更换凭据重试 (尝试 {}/{}): {}", requestId, response.getStatusCode(),
                        attempt + 1, maxRetries + 1, SecretMasker.mask(token));
                poolManager.markFailed(token);
                lastResponse = response;
            } catch (UpstreamException e) {
                log.warn("[{}] 上游调用失败 (尝试 {}/{}): {}", requestId, attempt + 1, maxRetries + 1, e.getMessage());
                poolManager.markFailed(token);
                lastException = e;
                lastResponse = null;
            }
            if (attempt < maxRetries) {
                sleep(properties.getRetryBackoffMillis() * (attempt + 1));
            }
        }

        if (lastResponse != null) {
            return lastResponse;
        }
        throw new UpstreamException("请求在 " + (maxRetries + 1) + " 次尝试后仍然失败", lastException);
    }

    private void sleep(long ms) {
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
