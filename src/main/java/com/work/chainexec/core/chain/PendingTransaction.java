package com.work.chainexec.core.chain;

import java.math.BigInteger;

/**
 * eth_getTransactionByHash 的最小视图。blockNumber 为 null 表示仍在 mempool。
 */
public class PendingTransaction {

    private final String hash;
    private final String from;
    private final String to;
    private final String data;
    private final BigInteger value;
    private final BigInteger gasLimit;
    private final BigInteger gasPrice;
    private final long nonce;
    private final Long blockNumber;

    public PendingTransaction(String hash,
                              String from,
                              String to,
                              String data,
                              BigInteger value,
                              BigInteger gasLimit,
                              BigInteger gasPrice,
                              long nonce,
                              Long blockNumber) {
        this.hash = hash;
        this.from = from;
        this.to = to;
        this.data = data;
        this.value = value;
        this.gasLimit = gasLimit;
        this.gasPrice = gasPrice;
        this.nonce = nonce;
        this.blockNumber = blockNumber;
    }

    public boolean isMined() {
        return blockNumber != null;
    }

    public String getHash() {
        return hash;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public String getData() {
        return data;
    }

    public BigInteger getValue() {
        return value;
    }

    public BigInteger getGasLimit() {
        return gasLimit;
    }

    public BigInteger getGasPrice() {
        return gasPrice;
    }

    public long getNonce() {
        return nonce;
    }

    public Long getBlockNumber() {
        return blockNumber;
    }
}
