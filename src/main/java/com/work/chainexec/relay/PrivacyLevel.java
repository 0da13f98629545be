package com.work.chainexec.relay;

/**
 * 隐私等级决定可用的 relay 子集。NONE 不选任何私有 relay（只能走公开 mempool 回落）。
 */
public enum PrivacyLevel {
    NONE,
    BASIC,
    ENHANCED,
    MAXIMUM;

    public boolean accepts(RelayType type) {
        switch (this) {
            case MAXIMUM:
                return type == RelayType.BUILDER_RPC;
            case ENHANCED:
                return type == RelayType.MEV_SHARE || type == RelayType.BUILDER_RPC;
            case BASIC:
                return type == RelayType.FLASHBOTS_PROTECT;
            case NONE:
            default:
                return false;
        }
    }
}
