package io.leavesfly.meer.exception;

/**
 * 配置加载或校验失败
 */
public class ConfigException extends MeerException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
