package com.work.chainexec.core.exception;

/**
 * nonce 初始化 / 查询 / 重同步失败。
 *
 * <p>分配器自身不重试，直接抛给调用方；提交流水线把它当作可重试错误（本次不会发送交易）。</p>
 */
public class NonceException extends ChainExecException {

    public NonceException(String message) {
        super(message);
    }

    public NonceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
