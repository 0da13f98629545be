package com.work.chainexec.relay.bundle;

import java.util.ArrayList;
import java.util.List;

public class BundleOptions {

    private Long minTimestamp;
    private Long maxTimestamp;
    private String replacementUuid;
    private List<String> revertingTxHashes = new ArrayList<>();

    public static BundleOptions defaults() {
        return new BundleOptions();
    }

    public BundleOptions window(Long minTimestamp, Long maxTimestamp) {
        this.minTimestamp = minTimestamp;
        this.maxTimestamp = maxTimestamp;
        return this;
    }

    public BundleOptions replacementUuid(String replacementUuid) {
        this.replacementUuid = replacementUuid;
        return this;
    }

    public BundleOptions revertingTxHashes(List<String> revertingTxHashes) {
        this.revertingTxHashes = revertingTxHashes == null ? new ArrayList<>() : new ArrayList<>(revertingTxHashes);
        return this;
    }

    public Long getMinTimestamp() {
        return minTimestamp;
    }

    public Long getMaxTimestamp() {
        return maxTimestamp;
    }

    public String getReplacementUuid() {
        return replacementUuid;
    }

    public List<String> getRevertingTxHashes() {
        return revertingTxHashes;
    }
}
