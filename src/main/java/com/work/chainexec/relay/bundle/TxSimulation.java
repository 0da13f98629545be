package com.work.chainexec.relay.bundle;

import java.math.BigInteger;

/**
 * eth_callBundle 结果中单笔交易的执行情况。
 */
public class TxSimulation {

    private final String txHash;
    private final BigInteger gasUsed;
    private final BigInteger coinbaseDiff;
    private final boolean reverted;
    private final String revertReason;

    public TxSimulation(String txHash, BigInteger gasUsed, BigInteger coinbaseDiff, boolean reverted, String revertReason) {
        this.txHash = txHash;
        this.gasUsed = gasUsed == null ? BigInteger.ZERO : gasUsed;
        this.coinbaseDiff = coinbaseDiff == null ? BigInteger.ZERO : coinbaseDiff;
        this.reverted = reverted;
        this.revertReason = revertReason;
    }

    public String getTxHash() {
        return txHash;
    }

    public BigInteger getGasUsed() {
        return gasUsed;
    }

    public BigInteger getCoinbaseDiff() {
        return coinbaseDiff;
    }

    public boolean isReverted() {
        return reverted;
    }

    public String getRevertReason() {
        return revertReason;
    }
}
