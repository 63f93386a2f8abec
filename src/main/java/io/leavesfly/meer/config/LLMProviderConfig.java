package io.leavesfly.meer.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * LLM 提供商配置
 * <p>
 * 所有提供商均按 OpenAI 兼容协议访问。未配置 base_url 时按 type 取默认地址，
 * CUSTOM 类型没有默认地址。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LLMProviderConfig {

    @JsonProperty("type")
    @Builder.Default
    private ProviderType type = ProviderType.CUSTOM;

    @JsonProperty("base_url")
    private String baseUrl;

    @JsonProperty("api_key")
    private String apiKey;

    /**
     * 自定义请求头
     */
    @JsonProperty("custom_headers")
    @Builder.Default
    private Map<String, String> customHeaders = new HashMap<>();

    /**
     * 限流配置，为空表示不限流
     */
    @JsonProperty("rate_limit")
    private RateLimitConfig rateLimit;

    /**
     * 滑动窗口限流配置
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RateLimitConfig {

        /**
         * 时间窗口（毫秒）
         */
        @JsonProperty("window_ms")
        private long windowMs;

        /**
         * 时间窗口内最大请求数
         */
        @JsonProperty("max_requests")
        private int maxRequests;

        /**
         * 超过限流时的等待时间（毫秒）
         */
        @JsonProperty("sleep_ms")
        private long sleepMs;
    }

    /**
     * @return 显式配置的 base_url，未配置时取 type 的默认地址；都没有时返回 null
     */
    public String resolveBaseUrl() {
        if (baseUrl != null && !baseUrl.isBlank()) {
            return baseUrl;
        }
        return type != null ? type.getDefaultBaseUrl() : null;
    }

    public enum ProviderType {
        @JsonProperty("openai") OPENAI("https://api.openai.com/v1"),

        @JsonProperty("deepseek") DEEPSEEK("https://api.deepseek.com/v1"),

        @JsonProperty("openrouter") OPENROUTER("https://openrouter.ai/api/v1"),

        @JsonProperty("ollama") OLLAMA("http://localhost:11434/v1"),

        @JsonProperty("custom") CUSTOM(null);

        private final String defaultBaseUrl;

        ProviderType(String defaultBaseUrl) {
            this.defaultBaseUrl = defaultBaseUrl;
        }

        public String getDefaultBaseUrl() {
            return defaultBaseUrl;
        }
    }
}
