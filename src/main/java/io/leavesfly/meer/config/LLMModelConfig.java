package io.leavesfly.meer.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 模型配置：模型别名 → 提供商 + 实际模型名
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LLMModelConfig {

    /**
     * 对应 providers 中的键
     */
    @JsonProperty("provider")
    private String provider;

    /**
     * 提供商侧的模型名
     */
    @JsonProperty("model")
    private String model;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("max_tokens")
    private Integer maxTokens;
}
