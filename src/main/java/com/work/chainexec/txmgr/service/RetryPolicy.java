package com.work.chainexec.txmgr.service;

import com.work.chainexec.txmgr.config.TxMgrProperties;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;

import static com.work.chainexec.core.support.ValidationUtils.requireNonNegative;
import static com.work.chainexec.core.support.ValidationUtils.requirePositive;

/**
 * 单笔交易的重试参数：次数、退避、gas 递增。
 *
 * <p>gas 递增用十进制精确相乘后向下取整（1.1 -> *1.1，1.125 -> *1.125）。</p>
 */
public final class RetryPolicy {

    private final int maxRetries;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double backoffMultiplier;
    private final double gasPriceIncrement;

    public RetryPolicy(int maxRetries,
                       Duration initialDelay,
                       Duration maxDelay,
                       double backoffMultiplier,
                       double gasPriceIncrement) {
        requireNonNegative(maxRetries, "maxRetries");
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier 不能小于1");
        }
        if (gasPriceIncrement < 1.0) {
            throw new IllegalArgumentException("gasPriceIncrement 不能小于1");
        }
        this.maxRetries = maxRetries;
        this.initialDelay = requirePositive(initialDelay, "initialDelay");
        this.maxDelay = requirePositive(maxDelay, "maxDelay");
        this.backoffMultiplier = backoffMultiplier;
        this.gasPriceIncrement = gasPriceIncrement;
    }

    public static RetryPolicy from(TxMgrProperties props) {
        return new RetryPolicy(props.getMaxRetries(), props.getInitialDelay(), props.getMaxDelay(),
                props.getBackoffMultiplier(), props.getGasPriceIncrement());
    }

    /**
     * 用调用方给出的部分覆盖项生成新策略；为 null 的项沿用当前值。
     */
    public RetryPolicy override(Integer maxRetries,
                                Duration initialDelay,
                                Duration maxDelay,
                                Double backoffMultiplier,
                                Double gasPriceIncrement) {
        return new RetryPolicy(
                maxRetries == null ? this.maxRetries : maxRetries,
                initialDelay == null ? this.initialDelay : initialDelay,
                maxDelay == null ? this.maxDelay : maxDelay,
                backoffMultiplier == null ? this.backoffMultiplier : backoffMultiplier,
                gasPriceIncrement == null ? this.gasPriceIncrement : gasPriceIncrement);
    }

    /**
     * 第 attempt 次失败后的等待：min(initialDelay * multiplier^attempt, maxDelay)。
     */
    public Duration backoff(int attempt) {
        double ms = initialDelay.toMillis() * Math.pow(backoffMultiplier, Math.max(0, attempt));
        long capped = (long) Math.min(ms, (double) maxDelay.toMillis());
        return Duration.ofMillis(Math.max(0L, capped));
    }

    /**
     * 单步递增：price * increment。
     */
    public BigInteger escalate(BigInteger price) {
        if (price == null) {
            return null;
        }
        return new BigDecimal(price)
                .multiply(BigDecimal.valueOf(gasPriceIncrement))
                .setScale(0, RoundingMode.DOWN)
                .toBigInteger();
    }

    /**
     * 第 attempt 次尝试使用的价格：在 base 上连续递增 attempt 步。
     */
    public BigInteger priceForAttempt(BigInteger base, int attempt) {
        BigInteger price = base;
        for (int i = 0; i < attempt && price != null; i++) {
            price = escalate(price);
        }
        return price;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public double getGasPriceIncrement() {
        return gasPriceIncrement;
    }
}
