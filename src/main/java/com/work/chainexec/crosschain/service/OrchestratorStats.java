package com.work.chainexec.crosschain.service;

public class OrchestratorStats {

    private final int activeExecutions;
    private final int maxConcurrentPaths;
    private final int retryAttempts;
    private final boolean recoveryEnabled;

    public OrchestratorStats(int activeExecutions, int maxConcurrentPaths, int retryAttempts, boolean recoveryEnabled) {
        this.activeExecutions = activeExecutions;
        this.maxConcurrentPaths = maxConcurrentPaths;
        this.retryAttempts = retryAttempts;
        this.recoveryEnabled = recoveryEnabled;
    }

    public int getActiveExecutions() {
        return activeExecutions;
    }

    public int getMaxConcurrentPaths() {
        return maxConcurrentPaths;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public boolean isRecoveryEnabled() {
        return recoveryEnabled;
    }
}
