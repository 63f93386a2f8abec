package io.leavesfly.meer.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Meer 全局配置，对应 ~/.meer/config.json
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeerConfig {

    /**
     * 默认模型（models 中的键）
     */
    @JsonProperty("default_model")
    @Builder.Default
    private String defaultModel = "";

    @JsonProperty("models")
    @Builder.Default
    private Map<String, LLMModelConfig> models = new HashMap<>();

    @JsonProperty("providers")
    @Builder.Default
    private Map<String, LLMProviderConfig> providers = new HashMap<>();

    @JsonProperty("loop_control")
    @Builder.Default
    private LoopControlConfig loopControl = LoopControlConfig.builder().build();

    @JsonProperty("orchestrator")
    @Builder.Default
    private OrchestratorConfig orchestrator = OrchestratorConfig.builder().build();

    @JsonProperty("retry")
    @Builder.Default
    private RetryConfig retry = RetryConfig.builder().build();

    /**
     * 验证配置一致性
     *
     * @throws IllegalStateException 配置不合法
     */
    public void validate() {
        if (models == null || providers == null) {
            throw new IllegalStateException("models and providers must not be null");
        }
        if (defaultModel != null && !defaultModel.isEmpty() && !models.containsKey(defaultModel)) {
            throw new IllegalStateException("Default model '" + defaultModel + "' is not defined in models");
        }
        for (Map.Entry<String, LLMModelConfig> entry : models.entrySet()) {
            String provider = entry.getValue().getProvider();
            if (provider == null || !providers.containsKey(provider)) {
                throw new IllegalStateException(
                        "Model '" + entry.getKey() + "' references unknown provider '" + provider + "'");
            }
        }
        if (loopControl == null || loopControl.getMaxIterations() < 1) {
            throw new IllegalStateException("loop_control.max_iterations must be at least 1");
        }
        if (orchestrator == null || orchestrator.getDefaultTimeoutMs() < 1) {
            throw new IllegalStateException("orchestrator.default_timeout_ms must be positive");
        }
        if (retry == null || retry.getMaxAttempts() < 0) {
            throw new IllegalStateException("retry.max_attempts must not be negative");
        }
    }
}
