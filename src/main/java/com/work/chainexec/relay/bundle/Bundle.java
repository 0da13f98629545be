package com.work.chainexec.relay.bundle;

import org.web3j.crypto.Hash;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一组按顺序原子打包的已签名交易，只在 simulate -> submit -> poll 期间存在。
 */
public final class Bundle {

    private final List<String> signedTransactions;
    private final long targetBlockNumber;
    private final Long minTimestamp;
    private final Long maxTimestamp;
    private final List<String> revertingTxHashes;
    private final String replacementUuid;
    private final boolean allocatorNonced;

    public Bundle(List<String> signedTransactions,
                  long targetBlockNumber,
                  Long minTimestamp,
                  Long maxTimestamp,
                  List<String> revertingTxHashes,
                  String replacementUuid,
                  boolean allocatorNonced) {
        if (signedTransactions == null || signedTransactions.isEmpty()) {
            throw new IllegalArgumentException("signedTransactions 不能为空");
        }
        if (minTimestamp != null && maxTimestamp != null && minTimestamp > maxTimestamp) {
            throw new IllegalArgumentException("minTimestamp 不能大于 maxTimestamp");
        }
        this.signedTransactions = Collections.unmodifiableList(new ArrayList<>(signedTransactions));
        this.targetBlockNumber = targetBlockNumber;
        this.minTimestamp = minTimestamp;
        this.maxTimestamp = maxTimestamp;
        this.revertingTxHashes = revertingTxHashes == null
                ? Collections.<String>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(revertingTxHashes));
        this.replacementUuid = replacementUuid;
        this.allocatorNonced = allocatorNonced;
    }

    public static Bundle of(List<String> signedTransactions, long targetBlockNumber) {
        return new Bundle(signedTransactions, targetBlockNumber, null, null, null, null, false);
    }

    public Bundle withReplacementUuid(String uuid) {
        return new Bundle(signedTransactions, targetBlockNumber, minTimestamp, maxTimestamp,
                revertingTxHashes, uuid, allocatorNonced);
    }

    /**
     * 各交易的 hash（keccak256(raw)），与上链后的 receipt 对应。
     */
    public List<String> transactionHashes() {
        List<String> hashes = new ArrayList<>(signedTransactions.size());
        for (String raw : signedTransactions) {
            hashes.add(Hash.sha3(raw));
        }
        return hashes;
    }

    public List<String> getSignedTransactions() {
        return signedTransactions;
    }

    public long getTargetBlockNumber() {
        return targetBlockNumber;
    }

    public Long getMinTimestamp() {
        return minTimestamp;
    }

    public Long getMaxTimestamp() {
        return maxTimestamp;
    }

    public List<String> getRevertingTxHashes() {
        return revertingTxHashes;
    }

    public String getReplacementUuid() {
        return replacementUuid;
    }

    /**
     * nonce 是否由本进程的分配器发放；未被打包时需要让分配器重同步。
     */
    public boolean isAllocatorNonced() {
        return allocatorNonced;
    }
}
