package io.leavesfly.meer.exception;

import lombok.Getter;

/**
 * LLM 服务调用失败
 * <p>
 * statusCode 为 HTTP 状态码；网络错误为 0，其他错误为 -1。
 * 供重试包装器判断是否为可重试的瞬时错误。
 */
@Getter
public class ProviderException extends MeerException {

    private final int statusCode;

    public static final int NETWORK_ERROR = 0;

    public ProviderException(String message) {
        this(message, -1, null);
    }

    public ProviderException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * 网络错误、限流、服务端错误视为瞬时错误
     */
    public boolean isTransient() {
        return statusCode == NETWORK_ERROR || statusCode == 429 || statusCode >= 500;
    }
}
