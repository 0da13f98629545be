package com.work.chainexec.crosschain.domain;

import java.time.Instant;

/**
 * 单个 hop 的执行记录，只属于一次路径执行。
 */
public class ExecutionStep {

    private final Hop hop;
    private final Instant timestamp;
    private volatile StepStatus status = StepStatus.PENDING;
    private volatile String txHash;
    private volatile String error;

    public ExecutionStep(Hop hop, Instant timestamp) {
        this.hop = hop;
        this.timestamp = timestamp;
    }

    public ExecutionStep snapshot() {
        ExecutionStep copy = new ExecutionStep(hop, timestamp);
        copy.status = status;
        copy.txHash = txHash;
        copy.error = error;
        return copy;
    }

    public Hop getHop() {
        return hop;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public StepStatus getStatus() {
        return status;
    }

    public void setStatus(StepStatus status) {
        this.status = status;
    }

    public String getTxHash() {
        return txHash;
    }

    public void setTxHash(String txHash) {
        this.txHash = txHash;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
