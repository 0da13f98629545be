package com.work.chainexec.crosschain.adapter;

import java.math.BigInteger;

import static com.work.chainexec.core.support.ValidationUtils.requireNonEmpty;
import static com.work.chainexec.core.support.ValidationUtils.requireNonNull;

public final class SwapParams {

    private final String tokenIn;
    private final String tokenOut;
    private final BigInteger amountIn;
    private final BigInteger minAmountOut;
    private final long deadline;
    private final String recipient;

    /**
     * @param deadline unix 秒
     */
    public SwapParams(String tokenIn, String tokenOut, BigInteger amountIn, BigInteger minAmountOut,
                      long deadline, String recipient) {
        this.tokenIn = requireNonEmpty(tokenIn, "tokenIn");
        this.tokenOut = requireNonEmpty(tokenOut, "tokenOut");
        this.amountIn = requireNonNull(amountIn, "amountIn");
        this.minAmountOut = requireNonNull(minAmountOut, "minAmountOut");
        this.deadline = deadline;
        this.recipient = requireNonEmpty(recipient, "recipient");
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

    public BigInteger getMinAmountOut() {
        return minAmountOut;
    }

    public long getDeadline() {
        return deadline;
    }

    public String getRecipient() {
        return recipient;
    }
}
