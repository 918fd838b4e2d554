package com.z2api.upstream.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.z2api.common.exception.UpstreamException;
import com.z2api.common.util.IdGenerator;
import com.z2api.common.util.SecretMasker;
import com.z2api.upstream.config.UpstreamProperties;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Z.AI 上游客户端实现。
 * <p>
 * 三类调用使用同一个连接池，但各自有独立的整体超时：
 * 探测要快速失败，登录允许稍慢，转发对话需要最长的读超时。
 */
@Slf4j
@Component
public class ZaiUpstreamClient implements UpstreamClient {

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");
    private static final DateTimeFormatter DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final UpstreamProperties properties;
    private final OkHttpClient chatClient;
    private final OkHttpClient probeClient;
    private final OkHttpClient signInClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ZaiUpstreamClient(OkHttpClient upstreamHttpClient, UpstreamProperties properties) {
        this.properties = properties;
        this.chatClient = upstreamHttpClient;
        this.probeClient = upstreamHttpClient.newBuilder()
                .callTimeout(Duration.ofSeconds(properties.getHealthCheckTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(properties.getHealthCheckTimeoutSeconds()))
                .build();
        this.signInClient = upstreamHttpClient.newBuilder()
                .callTimeout(Duration.ofSeconds(properties.getRefreshTimeoutSeconds()))
                .build();
    }

    // ======================== 健康探测 ========================

    @Override
    public boolean probe(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        try {
            Request request = browserHeaders(new Request.Builder())
                    .url(properties.getBaseUrl() + properties.getChatPath())
                    .addHeader("Authorization", "Bearer " + token)
                    .addHeader("Accept", "application/json, text/event-stream")
                    .post(RequestBody.create(buildProbeBody(), JSON_MEDIA))
                    .build();

            // 只看状态码，不读流式响应体
            try (Response response = probeClient.newCall(request).execute()) {
                boolean healthy = response.isSuccessful();
                if (healthy) {
                    log.debug("健康探测通过: {}", SecretMasker.mask(token));
                } else {
                    log.debug("健康探测失败: {} - HTTP {}", SecretMasker.mask(token), response.code());
                }
                return healthy;
            }
        } catch (Exception e) {
            log.debug("健康探测失败: {} - {}: {}", SecretMasker.mask(token),
                    e.getClass().getSimpleName(), e.getMessage());
            return false;
        }
    }

    /**
     * 构建探测用的最小对话请求，字段与网页端真实请求保持一致。
     */
    private String buildProbeBody() throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("stream", true);
        root.put("model", properties.getModel());

        ObjectNode message = root.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", "hi");

        ObjectNode backgroundTasks = root.putObject("background_tasks");
        backgroundTasks.put("title_generation", false);
        backgroundTasks.put("tags_generation", false);

        root.put("chat_id", IdGenerator.uuid());

        ObjectNode features = root.putObject("features");
        features.put("image_generation", false);
        features.put("code_interpreter", false);
        features.put("web_search", false);
        features.put("auto_web_search", false);

        root.put("id", IdGenerator.uuid());
        root.putArray("mcp_servers");

        ObjectNode modelItem = root.putObject("model_item");
        modelItem.put("id", properties.getModel());
        modelItem.put("name", properties.getModelName());
        modelItem.put("owned_by", "openai");

        root.putObject("params");
        root.putArray("tool_servers");

        ObjectNode variables = root.putObject("variables");
        variables.put("{{USER_NAME}}", "User");
        variables.put("{{USER_LOCATION}}", "Unknown");
        variables.put("{{CURRENT_DATETIME}}", LocalDateTime.now().format(DATETIME));

        return objectMapper.writeValueAsString(root);
    }

    // ======================== 登录刷新 ========================

    @Override
    public Optional<String> signIn(String email, String password) {
        String maskedEmail = SecretMasker.maskEmail(email);
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("email", email);
            payload.put("password", password);

            Request request = new Request.Builder()
                    .url(properties.getBaseUrl() + properties.getSigninPath())
                    .addHeader("Content-Type", "application/json")
                    .addHeader("User-Agent", properties.getUserAgent())
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON_MEDIA))
                    .build();

            try (Response response = signInClient.newCall(request).execute()) {
                String body = response.body() != null ? response.body().string() : "";

                if (!response.isSuccessful()) {
                    log.error("刷新令牌失败 {}: HTTP {}", maskedEmail, response.code());
                    return Optional.empty();
                }

                JsonNode json = objectMapper.readTree(body);
                String token = json.path("token").asText("");
                if (token.isBlank()) {
                    log.error("登录响应中没有 token 字段: {}", maskedEmail);
                    return Optional.empty();
                }

                log.info("刷新令牌成功: {}", maskedEmail);
                return Optional.of(token);
            }
        } catch (Exception e) {
            log.error("刷新令牌出错 {}: {}", maskedEmail, e.getMessage());
            return Optional.empty();
        }
    }

    // ======================== 对话转发 ========================

    @Override
    public UpstreamResponse chatCompletion(String requestBody, String token) {
        Request request = browserHeaders(new Request.Builder())
                .url(properties.getBaseUrl() + properties.getChatPath())
                .addHeader("Authorization", "Bearer " + token)
                .addHeader("Accept", "application/json, text/event-stream")
                .post(RequestBody.create(requestBody, JSON_MEDIA))
                .build();

        try (Response response = chatClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            String contentType = response.header("Content-Type", "application/json");
            if (!response.isSuccessful()) {
                log.warn("上游对话接口返回错误: HTTP {} (凭据 {})", response.code(), SecretMasker.mask(token));
            }
            return new UpstreamResponse(response.code(), contentType, body);
        } catch (IOException e) {
            throw new UpstreamException("调用上游对话接口时发生网络错误", e);
        }
    }

    /**
     * 模拟网页端请求头，上游会校验来源。
     */
    private Request.Builder browserHeaders(Request.Builder builder) {
        return builder
                .addHeader("Content-Type", "application/json")
                .addHeader("User-Agent", properties.getUserAgent())
                .addHeader("Accept-Language", "zh-CN")
                .addHeader("sec-ch-ua", "\"Not)A;Brand\";v=\"8\", \"Chromium\";v=\"138\", \"Google Chrome\";v=\"138\"")
                .addHeader("sec-ch-ua-mobile", "?0")
                .addHeader("sec-ch-ua-platform", "\"macOS\"")
                .addHeader("x-fe-version", properties.getFeVersion())
                .addHeader("Origin", properties.getBaseUrl())
                .addHeader("Referer", properties.getBaseUrl() + "/");
    }
}
