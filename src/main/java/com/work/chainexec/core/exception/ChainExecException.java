package com.work.chainexec.core.exception;

/**
 * 组件内部的统一异常根类型，便于业务侧捕获或转换为 RPC 错误码。
 */
public class ChainExecException extends RuntimeException {

    public ChainExecException(String message) {
        super(message);
    }

    public ChainExecException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过重试解决。默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
