package com.z2api.upstream.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 上游服务配置项。
 */
@Data
@ConfigurationProperties(prefix = "z2api.upstream")
public class UpstreamProperties {

    /** 上游站点地址 */
    private String baseUrl = "https://chat.z.ai";

    /** 对话接口路径 */
    private String chatPath = "/api/chat/completions";

    /** 登录接口路径 */
    private String signinPath = "/api/v1/auths/signin";

    /** 健康探测使用的上游模型 ID */
    private String model = "0727-360B-API";

    /** 健康探测使用的模型展示名 */
    private String modelName = "GLM-4.5";

    private String userAgent = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/138.0.0.0 Safari/537.36";

    /** 上游前端版本号，随 x-fe-version 头发送 */
    private String feVersion = "prod-fe-1.0.53";

    /** 连接超时（秒） */
    private int connectTimeoutSeconds = 5;

    /** 健康探测的整体超时（秒） */
    private int healthCheckTimeoutSeconds = 10;

    /** 登录刷新的整体超时（秒） */
    private int refreshTimeoutSeconds = 30;

    /** 转发对话请求的读超时（秒） */
    private int requestTimeoutSeconds = 180;
}
