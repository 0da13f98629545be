package com.work.chainexec.txmgr.domain;

/**
 * 单笔交易状态机：PENDING -> SUBMITTED -> {CONFIRMED | FAILED | REPLACED | TIMEOUT}。
 *
 * <p>REPLACED 之后由新的 {@link TransactionMetadata} 继续走同一状态机。</p>
 */
public enum TxState {
    PENDING,
    SUBMITTED,
    CONFIRMED,
    FAILED,
    REPLACED,
    TIMEOUT;

    public boolean isTerminal() {
        return this == CONFIRMED || this == FAILED || this == TIMEOUT || this == REPLACED;
    }
}
