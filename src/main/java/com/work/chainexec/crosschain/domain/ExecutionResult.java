package com.work.chainexec.crosschain.domain;

import com.work.chainexec.crosschain.recovery.RecoveryOutcome;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 路径执行结果。失败时 hopsCompleted / txHashes 反映已完成的部分。
 */
public class ExecutionResult {

    private final boolean success;
    private final CrossChainPath path;
    private final BigInteger actualProfit;
    private final long executionTimeMillis;
    private final int hopsCompleted;
    private final String error;
    private final List<String> txHashes;
    private final List<ExecutionStep> steps;
    private final RecoveryOutcome recovery;

    private ExecutionResult(boolean success, CrossChainPath path, BigInteger actualProfit, long executionTimeMillis,
                            int hopsCompleted, String error, List<String> txHashes, List<ExecutionStep> steps,
                            RecoveryOutcome recovery) {
        this.success = success;
        this.path = path;
        this.actualProfit = actualProfit;
        this.executionTimeMillis = executionTimeMillis;
        this.hopsCompleted = hopsCompleted;
        this.error = error;
        this.txHashes = txHashes == null ? Collections.<String>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(txHashes));
        this.steps = steps == null ? Collections.<ExecutionStep>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(steps));
        this.recovery = recovery;
    }

    public static ExecutionResult success(CrossChainPath path, BigInteger actualProfit, long executionTimeMillis,
                                          List<String> txHashes, List<ExecutionStep> steps) {
        return new ExecutionResult(true, path, actualProfit, executionTimeMillis,
                path.getHops().size(), null, txHashes, steps, null);
    }

    public static ExecutionResult failure(CrossChainPath path, long executionTimeMillis, int hopsCompleted,
                                          String error, List<String> txHashes, List<ExecutionStep> steps,
                                          RecoveryOutcome recovery) {
        return new ExecutionResult(false, path, null, executionTimeMillis,
                hopsCompleted, error, txHashes, steps, recovery);
    }

    public static ExecutionResult rejected(CrossChainPath path, String error) {
        return new ExecutionResult(false, path, null, 0L, 0, error, null, null, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public CrossChainPath getPath() {
        return path;
    }

    public BigInteger getActualProfit() {
        return actualProfit;
    }

    public long getExecutionTimeMillis() {
        return executionTimeMillis;
    }

    public int getHopsCompleted() {
        return hopsCompleted;
    }

    public String getError() {
        return error;
    }

    public List<String> getTxHashes() {
        return txHashes;
    }

    public List<ExecutionStep> getSteps() {
        return steps;
    }

    public RecoveryOutcome getRecovery() {
        return recovery;
    }
}
