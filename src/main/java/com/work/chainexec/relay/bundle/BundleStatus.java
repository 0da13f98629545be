package com.work.chainexec.relay.bundle;

/**
 * eth_getBundleStats 的结果视图。
 */
public class BundleStatus {

    private final String bundleHash;
    private final boolean simulated;
    private final boolean sentToMiners;
    private final boolean highPriority;
    private final String simulatedAt;
    private final String submittedAt;
    private final String sentToMinersAt;
    private final String error;

    public BundleStatus(String bundleHash,
                        boolean simulated,
                        boolean sentToMiners,
                        boolean highPriority,
                        String simulatedAt,
                        String submittedAt,
                        String sentToMinersAt,
                        String error) {
        this.bundleHash = bundleHash;
        this.simulated = simulated;
        this.sentToMiners = sentToMiners;
        this.highPriority = highPriority;
        this.simulatedAt = simulatedAt;
        this.submittedAt = submittedAt;
        this.sentToMinersAt = sentToMinersAt;
        this.error = error;
    }

    public static BundleStatus unavailable(String bundleHash, String error) {
        return new BundleStatus(bundleHash, false, false, false, null, null, null, error);
    }

    public String getBundleHash() {
        return bundleHash;
    }

    public boolean isSimulated() {
        return simulated;
    }

    public boolean isSentToMiners() {
        return sentToMiners;
    }

    public boolean isHighPriority() {
        return highPriority;
    }

    public String getSimulatedAt() {
        return simulatedAt;
    }

    public String getSubmittedAt() {
        return submittedAt;
    }

    public String getSentToMinersAt() {
        return sentToMinersAt;
    }

    public String getError() {
        return error;
    }
}
