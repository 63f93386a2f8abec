package io.leavesfly.meer.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Agent 循环控制配置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoopControlConfig {

    /**
     * 单次运行的最大迭代次数
     */
    @JsonProperty("max_iterations")
    @Builder.Default
    private int maxIterations = 10;
}
