package com.work.chainexec.crosschain.bridge;

import static com.work.chainexec.core.support.ValidationUtils.requireNonEmpty;
import static com.work.chainexec.core.support.ValidationUtils.requireNonNull;

/**
 * 源链上已发出的 bridge 交易。
 */
public final class BridgeTransfer {

    private final String txHash;
    private final BridgeRoute route;

    public BridgeTransfer(String txHash, BridgeRoute route) {
        this.txHash = requireNonEmpty(txHash, "txHash");
        this.route = requireNonNull(route, "route");
    }

    public String getTxHash() {
        return txHash;
    }

    public BridgeRoute getRoute() {
        return route;
    }
}
