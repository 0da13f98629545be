package com.work.chainexec.relay;

/**
 * 私有提交 / bundle 提交结果。
 */
public class PrivateTxResult {

    private final boolean success;
    private final String txHash;
    private final String bundleHash;
    private final RelayType relayUsed;
    private final int relaysTried;
    private final boolean publicMempoolVisible;
    private final long elapsedMillis;
    private final String error;

    private PrivateTxResult(boolean success,
                            String txHash,
                            String bundleHash,
                            RelayType relayUsed,
                            int relaysTried,
                            boolean publicMempoolVisible,
                            long elapsedMillis,
                            String error) {
        this.success = success;
        this.txHash = txHash;
        this.bundleHash = bundleHash;
        this.relayUsed = relayUsed;
        this.relaysTried = relaysTried;
        this.publicMempoolVisible = publicMempoolVisible;
        this.elapsedMillis = elapsedMillis;
        this.error = error;
    }

    public static PrivateTxResult success(String txHash,
                                          String bundleHash,
                                          RelayType relayUsed,
                                          int relaysTried,
                                          long elapsedMillis) {
        return new PrivateTxResult(true, txHash, bundleHash, relayUsed, relaysTried,
                relayUsed == RelayType.PUBLIC_RPC, elapsedMillis, null);
    }

    public static PrivateTxResult failure(String error, int relaysTried) {
        return new PrivateTxResult(false, null, null, null, relaysTried, false, 0L, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getTxHash() {
        return txHash;
    }

    public String getBundleHash() {
        return bundleHash;
    }

    public RelayType getRelayUsed() {
        return relayUsed;
    }

    public int getRelaysTried() {
        return relaysTried;
    }

    public boolean isPublicMempoolVisible() {
        return publicMempoolVisible;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    public String getError() {
        return error;
    }
}
