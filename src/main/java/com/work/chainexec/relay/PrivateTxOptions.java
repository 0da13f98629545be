package com.work.chainexec.relay;

import java.util.ArrayList;
import java.util.List;

/**
 * 私有提交参数。allowPublicFallback 默认关闭，需调用方显式打开。
 */
public class PrivateTxOptions {

    private PrivacyLevel privacyLevel;
    private RelayType preferredRelay;
    private boolean fastMode;
    private boolean allowPublicFallback;
    private int maxBlockWait = 25;
    private List<String> hints = new ArrayList<>();
    private List<String> builders = new ArrayList<>();

    public static PrivateTxOptions defaults() {
        return new PrivateTxOptions();
    }

    public PrivateTxOptions privacyLevel(PrivacyLevel privacyLevel) {
        this.privacyLevel = privacyLevel;
        return this;
    }

    public PrivateTxOptions preferredRelay(RelayType preferredRelay) {
        this.preferredRelay = preferredRelay;
        return this;
    }

    /**
     * 开启后一个 relay 失败会继续尝试下一个；关闭时只尝试第一个。
     */
    public PrivateTxOptions fastMode(boolean fastMode) {
        this.fastMode = fastMode;
        return this;
    }

    public PrivateTxOptions allowPublicFallback(boolean allowPublicFallback) {
        this.allowPublicFallback = allowPublicFallback;
        return this;
    }

    public PrivateTxOptions maxBlockWait(int maxBlockWait) {
        this.maxBlockWait = maxBlockWait;
        return this;
    }

    public PrivateTxOptions hints(List<String> hints) {
        this.hints = hints == null ? new ArrayList<>() : new ArrayList<>(hints);
        return this;
    }

    public PrivateTxOptions builders(List<String> builders) {
        this.builders = builders == null ? new ArrayList<>() : new ArrayList<>(builders);
        return this;
    }

    public PrivacyLevel getPrivacyLevel() {
        return privacyLevel;
    }

    public RelayType getPreferredRelay() {
        return preferredRelay;
    }

    public boolean isFastMode() {
        return fastMode;
    }

    public boolean isAllowPublicFallback() {
        return allowPublicFallback;
    }

    public int getMaxBlockWait() {
        return maxBlockWait;
    }

    public List<String> getHints() {
        return hints;
    }

    public List<String> getBuilders() {
        return builders;
    }
}
