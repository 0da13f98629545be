package com.work.chainexec.crosschain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 跨链编排配置。
 */
@ConfigurationProperties(prefix = "crosschain")
public class CrossChainProperties {

    private int maxConcurrentPaths = 3;

    /**
     * executeWithRetry 的总尝试次数（含第一次）。
     */
    private int retryAttempts = 3;

    /**
     * 整条路径重试的退避基数：第 n 次重试前等待 base * 2^n。
     */
    private Duration retryBaseDelay = Duration.ofSeconds(1);

    private Duration bridgeTimeout = Duration.ofMinutes(30);

    private Duration swapConfirmationTimeout = Duration.ofSeconds(60);

    /**
     * swap 滑点，单位 bp（50 = 0.5%）。
     */
    private int slippageBps = 50;

    private Duration swapDeadline = Duration.ofMinutes(20);

    private boolean enableEmergencyRecovery = true;

    /**
     * swap 收款地址；为空时使用该链签名地址。
     */
    private String recipient;

    /**
     * 额外的链（chain.mode=web3j 时生效），每条链单独一套 pipeline。
     */
    private List<ChainEntry> chains = new ArrayList<>();

    public int getMaxConcurrentPaths() {
        return maxConcurrentPaths;
    }

    public void setMaxConcurrentPaths(int maxConcurrentPaths) {
        this.maxConcurrentPaths = maxConcurrentPaths;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public void setRetryAttempts(int retryAttempts) {
        this.retryAttempts = retryAttempts;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public void setRetryBaseDelay(Duration retryBaseDelay) {
        this.retryBaseDelay = retryBaseDelay;
    }

    public Duration getBridgeTimeout() {
        return bridgeTimeout;
    }

    public void setBridgeTimeout(Duration bridgeTimeout) {
        this.bridgeTimeout = bridgeTimeout;
    }

    public Duration getSwapConfirmationTimeout() {
        return swapConfirmationTimeout;
    }

    public void setSwapConfirmationTimeout(Duration swapConfirmationTimeout) {
        this.swapConfirmationTimeout = swapConfirmationTimeout;
    }

    public int getSlippageBps() {
        return slippageBps;
    }

    public void setSlippageBps(int slippageBps) {
        this.slippageBps = slippageBps;
    }

    public Duration getSwapDeadline() {
        return swapDeadline;
    }

    public void setSwapDeadline(Duration swapDeadline) {
        this.swapDeadline = swapDeadline;
    }

    public boolean isEnableEmergencyRecovery() {
        return enableEmergencyRecovery;
    }

    public void setEnableEmergencyRecovery(boolean enableEmergencyRecovery) {
        this.enableEmergencyRecovery = enableEmergencyRecovery;
    }

    public String getRecipient() {
        return recipient;
    }

    public void setRecipient(String recipient) {
        this.recipient = recipient;
    }

    public List<ChainEntry> getChains() {
        return chains;
    }

    public void setChains(List<ChainEntry> chains) {
        this.chains = chains;
    }

    public static class ChainEntry {

        private long chainId;
        private String rpcUrl;

        public long getChainId() {
            return chainId;
        }

        public void setChainId(long chainId) {
            this.chainId = chainId;
        }

        public String getRpcUrl() {
            return rpcUrl;
        }

        public void setRpcUrl(String rpcUrl) {
            this.rpcUrl = rpcUrl;
        }
    }
}
