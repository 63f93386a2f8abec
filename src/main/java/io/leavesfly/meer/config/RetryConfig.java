package io.leavesfly.meer.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * LLM 调用重试配置（指数退避）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryConfig {

    /**
     * 最大重试次数，0 表示不重试
     */
    @JsonProperty("max_attempts")
    @Builder.Default
    private int maxAttempts = 3;

    @JsonProperty("initial_backoff_ms")
    @Builder.Default
    private long initialBackoffMs = 1000L;

    @JsonProperty("max_backoff_ms")
    @Builder.Default
    private long maxBackoffMs = 10_000L;
}
