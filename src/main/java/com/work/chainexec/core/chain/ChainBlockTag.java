package com.work.chainexec.core.chain;

/**
 * 链侧“视图/区块高度”选择，命名与常见节点/客户端保持一致。
 *
 * <p>nonce 分配只关心 LATEST（已打包）与 PENDING（含 mempool）两种视图，
 * SAFE / FINALIZED 供需要更强最终性的调用方使用。</p>
 */
public enum ChainBlockTag {
    LATEST("latest"),
    PENDING("pending"),
    SAFE("safe"),
    FINALIZED("finalized");

    private final String value;

    ChainBlockTag(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
