package com.work.chainexec.relay.config;

import com.work.chainexec.relay.PrivacyLevel;
import com.work.chainexec.relay.RelayType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 私有 relay 配置。relays 为空时使用 Flashbots Protect + MEV-Share 主网默认端点。
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    private List<Entry> relays = new ArrayList<>();

    private PrivacyLevel defaultPrivacyLevel = PrivacyLevel.BASIC;

    /**
     * 全局开关：关闭后即使调用方允许也不会回落到公开 mempool。
     */
    private boolean enableFallback = true;

    /**
     * Flashbots 信誉签名私钥（与交易签名私钥无关）；为空则不带签名头。
     */
    private String authPrivateKey;

    private Duration requestTimeout = Duration.ofSeconds(10);

    /**
     * 已提交 bundle 的跟踪时长，覆盖 simulate -> submit -> poll 全程。
     */
    private Duration bundleTrackingTtl = Duration.ofMinutes(10);

    private Duration pollInterval = Duration.ofSeconds(2);

    private int maxBundleWaitBlocks = 25;

    public List<Entry> getRelays() {
        return relays;
    }

    public void setRelays(List<Entry> relays) {
        this.relays = relays;
    }

    public PrivacyLevel getDefaultPrivacyLevel() {
        return defaultPrivacyLevel;
    }

    public void setDefaultPrivacyLevel(PrivacyLevel defaultPrivacyLevel) {
        this.defaultPrivacyLevel = defaultPrivacyLevel;
    }

    public boolean isEnableFallback() {
        return enableFallback;
    }

    public void setEnableFallback(boolean enableFallback) {
        this.enableFallback = enableFallback;
    }

    public String getAuthPrivateKey() {
        return authPrivateKey;
    }

    public void setAuthPrivateKey(String authPrivateKey) {
        this.authPrivateKey = authPrivateKey;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getBundleTrackingTtl() {
        return bundleTrackingTtl;
    }

    public void setBundleTrackingTtl(Duration bundleTrackingTtl) {
        this.bundleTrackingTtl = bundleTrackingTtl;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getMaxBundleWaitBlocks() {
        return maxBundleWaitBlocks;
    }

    public void setMaxBundleWaitBlocks(int maxBundleWaitBlocks) {
        this.maxBundleWaitBlocks = maxBundleWaitBlocks;
    }

    public static class Entry {

        private RelayType type;
        private String name;
        private String endpoint;
        private int priority;
        private boolean enabled = true;

        public RelayType getType() {
            return type;
        }

        public void setType(RelayType type) {
            this.type = type;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
