package io.leavesfly.meer.engine.toolcall;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 从一轮模型输出中解析出的工具调用
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolInvocation {

    private String toolName;

    /**
     * 属性表，保持出现顺序；未知属性原样保留，由工具自行校验
     */
    @Builder.Default
    private Map<String, String> params = new LinkedHashMap<>();

    /**
     * 标签体，自闭合形式为空串
     */
    @Builder.Default
    private String body = "";

    public String getParam(String name) {
        return params.get(name);
    }
}
