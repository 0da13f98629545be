package com.work.chainexec.core.exception;

/**
 * RPC 错误的封闭分类，在 RPC 边界处一次性打标，下游只按该枚举分支。
 */
public enum RpcErrorKind {
    /**
     * nonce 相关：触发后台重同步，本次尝试仍按可重试处理。
     */
    NONCE,
    /**
     * 不可恢复：余额不足、revert、非法指令等，重试循环立即终止。
     */
    FATAL,
    /**
     * 网络 / 超时 / 节点暂不可用等，退避后重试。
     */
    TRANSIENT;

    public boolean isRetryable() {
        return this != FATAL;
    }
}
