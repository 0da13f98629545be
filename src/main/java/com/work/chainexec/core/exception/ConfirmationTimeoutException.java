package com.work.chainexec.core.exception;

/**
 * 等待确认超过截止时间。不代表链上交易已作废。
 */
public class ConfirmationTimeoutException extends ChainExecException {

    public ConfirmationTimeoutException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
