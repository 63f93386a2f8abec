package io.leavesfly.meer.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 子代理编排配置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrchestratorConfig {

    /**
     * 单个委派任务的默认超时（毫秒）
     */
    @JsonProperty("default_timeout_ms")
    @Builder.Default
    private long defaultTimeoutMs = 60_000L;
}
