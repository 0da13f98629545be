package com.work.chainexec.txmgr.service;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

/**
 * executeTransaction 的可选参数。全部为 null 时使用配置默认值。
 */
public class TransactionOptions {

    private BigInteger gasLimit;
    private BigInteger gasPrice;
    private BigInteger maxFeePerGas;
    private BigInteger maxPriorityFeePerGas;
    private BigInteger value;
    /**
     * 调用方显式指定的 nonce；为 null 时由分配器发放。
     */
    private Long nonce;
    /**
     * 确认等待截止时间；为 null 时使用 txmgr.confirmation-timeout。
     */
    private Instant deadline;
    private Integer maxRetries;
    private Duration initialDelay;
    private Duration maxDelay;
    private Double backoffMultiplier;
    private Double gasPriceIncrement;

    public static TransactionOptions defaults() {
        return new TransactionOptions();
    }

    public TransactionOptions gasLimit(BigInteger gasLimit) {
        this.gasLimit = gasLimit;
        return this;
    }

    public TransactionOptions gasPrice(BigInteger gasPrice) {
        this.gasPrice = gasPrice;
        return this;
    }

    public TransactionOptions eip1559(BigInteger maxFeePerGas, BigInteger maxPriorityFeePerGas) {
        this.maxFeePerGas = maxFeePerGas;
        this.maxPriorityFeePerGas = maxPriorityFeePerGas;
        return this;
    }

    public TransactionOptions value(BigInteger value) {
        this.value = value;
        return this;
    }

    public TransactionOptions nonce(Long nonce) {
        this.nonce = nonce;
        return this;
    }

    public TransactionOptions deadline(Instant deadline) {
        this.deadline = deadline;
        return this;
    }

    public TransactionOptions maxRetries(Integer maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    public TransactionOptions initialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
        return this;
    }

    public TransactionOptions maxDelay(Duration maxDelay) {
        this.maxDelay = maxDelay;
        return this;
    }

    public TransactionOptions backoffMultiplier(Double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
        return this;
    }

    public TransactionOptions gasPriceIncrement(Double gasPriceIncrement) {
        this.gasPriceIncrement = gasPriceIncrement;
        return this;
    }

    public BigInteger getGasLimit() {
        return gasLimit;
    }

    public BigInteger getGasPrice() {
        return gasPrice;
    }

    public BigInteger getMaxFeePerGas() {
        return maxFeePerGas;
    }

    public BigInteger getMaxPriorityFeePerGas() {
        return maxPriorityFeePerGas;
    }

    public BigInteger getValue() {
        return value;
    }

    public Long getNonce() {
        return nonce;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public Integer getMaxRetries() {
        return maxRetries;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public Double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public Double getGasPriceIncrement() {
        return gasPriceIncrement;
    }
}
