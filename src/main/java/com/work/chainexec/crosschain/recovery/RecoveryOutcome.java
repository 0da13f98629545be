package com.work.chainexec.crosschain.recovery;

import com.work.chainexec.crosschain.domain.ExecutionResult;

import java.math.BigInteger;

/**
 * 恢复处置的结果，随失败的 {@link ExecutionResult} 一起返回。
 */
public class RecoveryOutcome {

    private final RecoveryDecision.Action action;
    private final String note;
    private final long strandedChainId;
    private final String strandedToken;
    private final BigInteger strandedAmount;
    private final ExecutionResult compensation;

    public RecoveryOutcome(RecoveryDecision.Action action, String note, long strandedChainId,
                           String strandedToken, BigInteger strandedAmount, ExecutionResult compensation) {
        this.action = action;
        this.note = note;
        this.strandedChainId = strandedChainId;
        this.strandedToken = strandedToken;
        this.strandedAmount = strandedAmount;
        this.compensation = compensation;
    }

    public RecoveryDecision.Action getAction() {
        return action;
    }

    public String getNote() {
        return note;
    }

    public long getStrandedChainId() {
        return strandedChainId;
    }

    public String getStrandedToken() {
        return strandedToken;
    }

    public BigInteger getStrandedAmount() {
        return strandedAmount;
    }

    /**
     * 补偿路径的执行结果；HOLD 时为 null。
     */
    public ExecutionResult getCompensation() {
        return compensation;
    }

    public boolean isCompensated() {
        return compensation != null && compensation.isSuccess();
    }
}
