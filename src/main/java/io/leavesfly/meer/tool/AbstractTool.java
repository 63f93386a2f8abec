package io.leavesfly.meer.tool;

import lombok.Getter;

/**
 * 工具基类，保存名称、描述和参数类型
 */
@Getter
public abstract class AbstractTool<P> implements Tool<P> {

    private final String name;
    private final String description;
    private final Class<P> paramsType;

    protected AbstractTool(String name, String description, Class<P> paramsType) {
        this.name = name;
        this.description = description;
        this.paramsType = paramsType;
    }
}
