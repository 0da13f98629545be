package com.work.chainexec.relay;

import java.time.Instant;

/**
 * 单个 relay 的计数（仅观测，不参与选择）。
 *
 * <p>accepted 表示 relay 接收了提交；included 只在看到上链 receipt 后计数。</p>
 */
public class RelayStats {

    private final RelayType type;
    private long totalSubmissions;
    private long acceptedSubmissions;
    private long successfulInclusions;
    private long failedSubmissions;
    private long simulations;
    private double avgAcceptanceMillis;
    private double avgInclusionMillis;
    private Instant lastSubmission;

    public RelayStats(RelayType type) {
        this.type = type;
    }

    synchronized void recordSubmission(Instant at) {
        totalSubmissions++;
        lastSubmission = at;
    }

    synchronized void recordFailure() {
        failedSubmissions++;
    }

    synchronized void recordAcceptance(long elapsedMillis) {
        acceptedSubmissions++;
        avgAcceptanceMillis = (avgAcceptanceMillis * (acceptedSubmissions - 1) + elapsedMillis) / acceptedSubmissions;
    }

    synchronized void recordInclusion(long elapsedMillis) {
        successfulInclusions++;
        avgInclusionMillis = (avgInclusionMillis * (successfulInclusions - 1) + elapsedMillis) / successfulInclusions;
    }

    synchronized void recordSimulation() {
        simulations++;
    }

    public synchronized RelayStats snapshot() {
        RelayStats copy = new RelayStats(type);
        copy.totalSubmissions = totalSubmissions;
        copy.acceptedSubmissions = acceptedSubmissions;
        copy.successfulInclusions = successfulInclusions;
        copy.failedSubmissions = failedSubmissions;
        copy.simulations = simulations;
        copy.avgAcceptanceMillis = avgAcceptanceMillis;
        copy.avgInclusionMillis = avgInclusionMillis;
        copy.lastSubmission = lastSubmission;
        return copy;
    }

    public RelayType getType() {
        return type;
    }

    public synchronized long getTotalSubmissions() {
        return totalSubmissions;
    }

    public synchronized long getAcceptedSubmissions() {
        return acceptedSubmissions;
    }

    public synchronized long getSuccessfulInclusions() {
        return successfulInclusions;
    }

    public synchronized long getFailedSubmissions() {
        return failedSubmissions;
    }

    public synchronized long getSimulations() {
        return simulations;
    }

    public synchronized double getAvgAcceptanceMillis() {
        return avgAcceptanceMillis;
    }

    public synchronized double getAvgInclusionMillis() {
        return avgInclusionMillis;
    }

    public synchronized Instant getLastSubmission() {
        return lastSubmission;
    }
}
