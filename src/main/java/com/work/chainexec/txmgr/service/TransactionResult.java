package com.work.chainexec.txmgr.service;

import com.work.chainexec.core.chain.TxReceipt;
import com.work.chainexec.txmgr.domain.TransactionMetadata;

/**
 * executeTransaction / replaceTransaction 的返回值；预期内的失败不抛异常，以 success=false + error 表达。
 */
public class TransactionResult {

    private final boolean success;
    private final TransactionMetadata metadata;
    private final TxReceipt receipt;
    private final String error;

    private TransactionResult(boolean success, TransactionMetadata metadata, TxReceipt receipt, String error) {
        this.success = success;
        this.metadata = metadata;
        this.receipt = receipt;
        this.error = error;
    }

    public static TransactionResult success(TransactionMetadata metadata, TxReceipt receipt) {
        return new TransactionResult(true, metadata, receipt, null);
    }

    public static TransactionResult failure(TransactionMetadata metadata, String error) {
        return new TransactionResult(false, metadata, null, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public TransactionMetadata getMetadata() {
        return metadata;
    }

    public TxReceipt getReceipt() {
        return receipt;
    }

    public String getError() {
        return error;
    }
}
