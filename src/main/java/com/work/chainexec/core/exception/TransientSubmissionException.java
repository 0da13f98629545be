package com.work.chainexec.core.exception;

/**
 * 网络 / 超时类提交失败，按退避策略重试。
 */
public class TransientSubmissionException extends ChainExecException {

    public TransientSubmissionException(String message) {
        super(message);
    }

    public TransientSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
