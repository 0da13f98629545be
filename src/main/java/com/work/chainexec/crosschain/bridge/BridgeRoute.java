package com.work.chainexec.crosschain.bridge;

import java.math.BigInteger;

import static com.work.chainexec.core.support.ValidationUtils.requireNonEmpty;
import static com.work.chainexec.core.support.ValidationUtils.requireNonNull;

public final class BridgeRoute {

    private final String bridge;
    private final long fromChainId;
    private final long toChainId;
    private final String token;
    private final BigInteger amount;
    private final BigInteger estimatedFee;
    private final long estimatedTimeSeconds;

    public BridgeRoute(String bridge, long fromChainId, long toChainId, String token,
                       BigInteger amount, BigInteger estimatedFee, long estimatedTimeSeconds) {
        this.bridge = requireNonEmpty(bridge, "bridge");
        this.fromChainId = fromChainId;
        this.toChainId = toChainId;
        this.token = requireNonEmpty(token, "token");
        this.amount = requireNonNull(amount, "amount");
        this.estimatedFee = estimatedFee == null ? BigInteger.ZERO : estimatedFee;
        this.estimatedTimeSeconds = estimatedTimeSeconds;
    }

    /**
     * 到账金额估算：amount - estimatedFee。
     */
    public BigInteger amountOut() {
        return amount.subtract(estimatedFee);
    }

    public String getBridge() {
        return bridge;
    }

    public long getFromChainId() {
        return fromChainId;
    }

    public long getToChainId() {
        return toChainId;
    }

    public String getToken() {
        return token;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public BigInteger getEstimatedFee() {
        return estimatedFee;
    }

    public long getEstimatedTimeSeconds() {
        return estimatedTimeSeconds;
    }
}
