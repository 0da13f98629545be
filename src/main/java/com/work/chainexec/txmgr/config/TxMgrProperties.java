package com.work.chainexec.txmgr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 提交流水线配置：重试退避、gas 递增、确认等待、gas 准入。
 */
@ConfigurationProperties(prefix = "txmgr")
public class TxMgrProperties {

    /**
     * 最大重试次数（总尝试次数 = maxRetries + 1）。
     */
    private int maxRetries = 3;

    /**
     * 首次重试前的等待。
     */
    private Duration initialDelay = Duration.ofSeconds(2);

    /**
     * 退避上限。
     */
    private Duration maxDelay = Duration.ofSeconds(30);

    private double backoffMultiplier = 2.0;

    /**
     * 每次重试的 gas 价格乘数（1.1 即 +10%）。
     */
    private double gasPriceIncrement = 1.1;

    /**
     * 未指定 deadline 时的确认等待时长。
     */
    private Duration confirmationTimeout = Duration.ofMinutes(2);

    private int confirmations = 1;

    /**
     * gas 价格绝对上限（Gwei），超过则拒绝准入。
     */
    private long maxGasPriceGwei = 500;

    /**
     * 滑动窗口内的涨幅阈值（百分比）。
     */
    private double spikeThresholdPercent = 50;

    private Duration spikeCheckWindow = Duration.ofMinutes(1);

    /**
     * 交易登记表初始容量；已终结的条目会被复用槽位。
     */
    private int registryCapacity = 10_000;

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
        this.maxDelay = maxDelay;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public double getGasPriceIncrement() {
        return gasPriceIncrement;
    }

    public void setGasPriceIncrement(double gasPriceIncrement) {
        this.gasPriceIncrement = gasPriceIncrement;
    }

    public Duration getConfirmationTimeout() {
        return confirmationTimeout;
    }

    public void setConfirmationTimeout(Duration confirmationTimeout) {
        this.confirmationTimeout = confirmationTimeout;
    }

    public int getConfirmations() {
        return confirmations;
    }

    public void setConfirmations(int confirmations) {
        this.confirmations = confirmations;
    }

    public long getMaxGasPriceGwei() {
        return maxGasPriceGwei;
    }

    public void setMaxGasPriceGwei(long maxGasPriceGwei) {
        this.maxGasPriceGwei = maxGasPriceGwei;
    }

    public double getSpikeThresholdPercent() {
        return spikeThresholdPercent;
    }

    public void setSpikeThresholdPercent(double spikeThresholdPercent) {
        this.spikeThresholdPercent = spikeThresholdPercent;
    }

    public Duration getSpikeCheckWindow() {
        return spikeCheckWindow;
    }

    public void setSpikeCheckWindow(Duration spikeCheckWindow) {
        this.spikeCheckWindow = spikeCheckWindow;
    }

    public int getRegistryCapacity() {
        return registryCapacity;
    }

    public void setRegistryCapacity(int registryCapacity) {
        this.registryCapacity = registryCapacity;
    }
}
