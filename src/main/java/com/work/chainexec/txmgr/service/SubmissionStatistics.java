package com.work.chainexec.txmgr.service;

import java.math.BigInteger;

/**
 * 提交流水线计数快照。
 */
public class SubmissionStatistics {

    private final long totalTransactions;
    private final long successfulTransactions;
    private final long failedTransactions;
    private final long retriedTransactions;
    private final long replacedTransactions;
    private final long timeoutTransactions;
    private final BigInteger totalGasUsed;

    public SubmissionStatistics(long totalTransactions,
                                long successfulTransactions,
                                long failedTransactions,
                                long retriedTransactions,
                                long replacedTransactions,
                                long timeoutTransactions,
                                BigInteger totalGasUsed) {
        this.totalTransactions = totalTransactions;
        this.successfulTransactions = successfulTransactions;
        this.failedTransactions = failedTransactions;
        this.retriedTransactions = retriedTransactions;
        this.replacedTransactions = replacedTransactions;
        this.timeoutTransactions = timeoutTransactions;
        this.totalGasUsed = totalGasUsed;
    }

    public long getTotalTransactions() {
        return totalTransactions;
    }

    public long getSuccessfulTransactions() {
        return successfulTransactions;
    }

    public long getFailedTransactions() {
        return failedTransactions;
    }

    public long getRetriedTransactions() {
        return retriedTransactions;
    }

    public long getReplacedTransactions() {
        return replacedTransactions;
    }

    public long getTimeoutTransactions() {
        return timeoutTransactions;
    }

    public BigInteger getTotalGasUsed() {
        return totalGasUsed;
    }

    /**
     * 成功率（百分比）；无交易时为 0。
     */
    public double getSuccessRate() {
        return totalTransactions == 0 ? 0.0 : successfulTransactions * 100.0 / totalTransactions;
    }

    public double getRetryRate() {
        return totalTransactions == 0 ? 0.0 : retriedTransactions * 100.0 / totalTransactions;
    }
}
