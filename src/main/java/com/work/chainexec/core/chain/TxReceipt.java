package com.work.chainexec.core.chain;

import java.math.BigInteger;

/**
 * 最小 receipt 表达。
 *
 * <p>在 EVM 语义中，只要 receipt 出现，就意味着该 nonce 已被链消耗（无论 success=true/false）。</p>
 */
public class TxReceipt {

    private final String txHash;
    private final long blockNumber;
    private final String blockHash;
    private final boolean success;
    private final BigInteger gasUsed;

    public TxReceipt(String txHash, long blockNumber, String blockHash, boolean success, BigInteger gasUsed) {
        this.txHash = txHash;
        this.blockNumber = blockNumber;
        this.blockHash = blockHash;
        this.success = success;
        this.gasUsed = gasUsed == null ? BigInteger.ZERO : gasUsed;
    }

    public String getTxHash() {
        return txHash;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public String getBlockHash() {
        return blockHash;
    }

    public boolean isSuccess() {
        return success;
    }

    public BigInteger getGasUsed() {
        return gasUsed;
    }
}
