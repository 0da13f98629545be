package com.work.chainexec.core.exception;

/**
 * gas 准入拒绝：未发送交易，也未消耗 nonce。
 */
public class GasSpikeRejectedException extends ChainExecException {

    public GasSpikeRejectedException(String reason) {
        super("Gas spike detected: " + reason);
    }
}
