package com.work.chainexec.core.exception;

/**
 * 跨链桥在截止时间内未完成。
 */
public class BridgeTimeoutException extends ChainExecException {

    public BridgeTimeoutException(String message) {
        super(message);
    }
}
