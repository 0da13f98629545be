package com.work.chainexec.relay.bundle;

/**
 * 等待 bundle 上链的结果。included=false 且 error 为空表示在等待区块数内未被打包。
 */
public class BundleInclusion {

    private final String bundleHash;
    private final boolean included;
    private final Long blockNumber;
    private final long blocksWaited;
    private final String error;

    private BundleInclusion(String bundleHash, boolean included, Long blockNumber, long blocksWaited, String error) {
        this.bundleHash = bundleHash;
        this.included = included;
        this.blockNumber = blockNumber;
        this.blocksWaited = blocksWaited;
        this.error = error;
    }

    public static BundleInclusion included(String bundleHash, long blockNumber, long blocksWaited) {
        return new BundleInclusion(bundleHash, true, blockNumber, blocksWaited, null);
    }

    public static BundleInclusion notIncluded(String bundleHash, long blocksWaited) {
        return new BundleInclusion(bundleHash, false, null, blocksWaited, null);
    }

    public static BundleInclusion failure(String bundleHash, long blocksWaited, String error) {
        return new BundleInclusion(bundleHash, false, null, blocksWaited, error);
    }

    public String getBundleHash() {
        return bundleHash;
    }

    public boolean isIncluded() {
        return included;
    }

    public Long getBlockNumber() {
        return blockNumber;
    }

    public long getBlocksWaited() {
        return blocksWaited;
    }

    public String getError() {
        return error;
    }
}
