package com.work.chainexec.crosschain.domain;

import java.math.BigInteger;

import static com.work.chainexec.core.support.ValidationUtils.requireNonEmpty;
import static com.work.chainexec.core.support.ValidationUtils.requireNonNull;

/**
 * 路径中的一步：同链 swap 或跨链 bridge。
 *
 * <p>amountIn / amountOut 是寻路时的估算值；执行时输入金额取上一步的实际产出。</p>
 */
public final class Hop {

    private final HopType type;
    private final long chainId;
    private final String poolAddress;
    private final String tokenIn;
    private final String tokenOut;
    private final BigInteger amountIn;
    private final BigInteger amountOut;
    private final String bridgeName;
    private final Long toChainId;
    private final long estimatedTimeSeconds;

    private Hop(HopType type, long chainId, String poolAddress, String tokenIn, String tokenOut,
                BigInteger amountIn, BigInteger amountOut, String bridgeName, Long toChainId,
                long estimatedTimeSeconds) {
        this.type = type;
        this.chainId = chainId;
        this.poolAddress = poolAddress;
        this.tokenIn = requireNonEmpty(tokenIn, "tokenIn");
        this.tokenOut = tokenOut;
        this.amountIn = requireNonNull(amountIn, "amountIn");
        this.amountOut = amountOut == null ? amountIn : amountOut;
        this.bridgeName = bridgeName;
        this.toChainId = toChainId;
        this.estimatedTimeSeconds = estimatedTimeSeconds;
    }

    public static Hop swap(long chainId, String poolAddress, String tokenIn, String tokenOut,
                           BigInteger amountIn, BigInteger expectedAmountOut) {
        requireNonEmpty(poolAddress, "poolAddress");
        requireNonEmpty(tokenOut, "tokenOut");
        return new Hop(HopType.SWAP, chainId, poolAddress, tokenIn, tokenOut,
                amountIn, expectedAmountOut, null, null, 0L);
    }

    public static Hop bridge(long fromChainId, long toChainId, String token, BigInteger amountIn,
                             String bridgeName, long estimatedTimeSeconds) {
        return new Hop(HopType.BRIDGE, fromChainId, null, token, token,
                amountIn, amountIn, bridgeName, toChainId, estimatedTimeSeconds);
    }

    public boolean isBridge() {
        return type == HopType.BRIDGE;
    }

    public HopType getType() {
        return type;
    }

    public long getChainId() {
        return chainId;
    }

    public String getPoolAddress() {
        return poolAddress;
    }

    public String getTokenIn() {
        return tokenIn;
    }

    public String getTokenOut() {
        return tokenOut;
    }

    public BigInteger getAmountIn() {
        return amountIn;
    }

    public BigInteger getAmountOut() {
        return amountOut;
    }

    public String getBridgeName() {
        return bridgeName;
    }

    public Long getToChainId() {
        return toChainId;
    }

    public long getEstimatedTimeSeconds() {
        return estimatedTimeSeconds;
    }

    @Override
    public String toString() {
        if (isBridge()) {
            return "BRIDGE(" + chainId + "->" + toChainId + ", " + tokenIn + ", " + amountIn + ")";
        }
        return "SWAP(" + chainId + ", " + tokenIn + "->" + tokenOut + ", " + amountIn + ")";
    }
}
