package com.work.chainexec.relay.bundle;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * bundle 试运行结果。success=false 表示模拟调用本身失败（relay 不可用、参数错误）。
 */
public class BundleSimulation {

    private final boolean success;
    private final String bundleHash;
    private final BigInteger totalGasUsed;
    private final BigInteger coinbaseDiff;
    private final BigInteger gasFees;
    private final List<TxSimulation> results;
    private final String error;

    private BundleSimulation(boolean success,
                             String bundleHash,
                             BigInteger totalGasUsed,
                             BigInteger coinbaseDiff,
                             BigInteger gasFees,
                             List<TxSimulation> results,
                             String error) {
        this.success = success;
        this.bundleHash = bundleHash;
        this.totalGasUsed = totalGasUsed == null ? BigInteger.ZERO : totalGasUsed;
        this.coinbaseDiff = coinbaseDiff == null ? BigInteger.ZERO : coinbaseDiff;
        this.gasFees = gasFees == null ? BigInteger.ZERO : gasFees;
        this.results = results == null ? Collections.<TxSimulation>emptyList() : Collections.unmodifiableList(results);
        this.error = error;
    }

    public static BundleSimulation success(String bundleHash,
                                           BigInteger totalGasUsed,
                                           BigInteger coinbaseDiff,
                                           BigInteger gasFees,
                                           List<TxSimulation> results) {
        return new BundleSimulation(true, bundleHash, totalGasUsed, coinbaseDiff, gasFees, results, null);
    }

    public static BundleSimulation failure(String error) {
        return new BundleSimulation(false, null, null, null, null, null, error);
    }

    /**
     * 第一笔 revert 的交易；没有则返回 null。
     */
    public TxSimulation firstRevert() {
        for (TxSimulation r : results) {
            if (r.isReverted()) {
                return r;
            }
        }
        return null;
    }

    public boolean hasRevert() {
        return firstRevert() != null;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getBundleHash() {
        return bundleHash;
    }

    public BigInteger getTotalGasUsed() {
        return totalGasUsed;
    }

    public BigInteger getCoinbaseDiff() {
        return coinbaseDiff;
    }

    public BigInteger getGasFees() {
        return gasFees;
    }

    public List<TxSimulation> getResults() {
        return results;
    }

    public String getError() {
        return error;
    }
}
