package com.work.chainexec.core.exception;

/**
 * 单个私有 relay 调用失败（HTTP 错误、JSON-RPC error、响应无法解析）。
 * 调用方据此切换到下一个 relay，或在允许时回落到公开 mempool。
 */
public class RelayException extends ChainExecException {

    private final Integer rpcCode;

    public RelayException(String message) {
        this(message, null, null);
    }

    public RelayException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public RelayException(String message, Integer rpcCode, Throwable cause) {
        super(message, cause);
        this.rpcCode = rpcCode;
    }

    public Integer getRpcCode() {
        return rpcCode;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
