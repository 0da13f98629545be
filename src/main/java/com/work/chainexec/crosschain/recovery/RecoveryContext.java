package com.work.chainexec.crosschain.recovery;

import com.work.chainexec.crosschain.domain.CrossChainPath;
import com.work.chainexec.crosschain.domain.Hop;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * 失败时的现场：资金停留在哪条链、哪个 token、多少金额。
 */
public class RecoveryContext {

    private final CrossChainPath path;
    private final int failedHopIndex;
    private final Hop failedHop;
    private final long strandedChainId;
    private final String strandedToken;
    private final BigInteger strandedAmount;
    private final String error;
    private final List<String> txHashes;

    public RecoveryContext(CrossChainPath path, int failedHopIndex, Hop failedHop, long strandedChainId,
                           String strandedToken, BigInteger strandedAmount, String error, List<String> txHashes) {
        this.path = path;
        this.failedHopIndex = failedHopIndex;
        this.failedHop = failedHop;
        this.strandedChainId = strandedChainId;
        this.strandedToken = strandedToken;
        this.strandedAmount = strandedAmount;
        this.error = error;
        this.txHashes = Collections.unmodifiableList(txHashes);
    }

    public CrossChainPath getPath() {
        return path;
    }

    public int getFailedHopIndex() {
        return failedHopIndex;
    }

    public Hop getFailedHop() {
        return failedHop;
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

    public String getError() {
        return error;
    }

    public List<String> getTxHashes() {
        return txHashes;
    }
}
