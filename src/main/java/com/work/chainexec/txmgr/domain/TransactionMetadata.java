package com.work.chainexec.txmgr.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * 单笔逻辑交易的跟踪信息。
 *
 * <p>只由提交流水线修改；读方可能在别的线程，因此字段用 volatile，复合读用 {@link #snapshot()}。</p>
 */
public class TransactionMetadata {

    private final TxId id;
    private volatile TxState state = TxState.PENDING;
    private volatile String hash;
    private volatile Long nonce;
    private volatile int attempts;
    private volatile Instant submittedAt;
    private volatile Instant confirmedAt;
    private volatile BigInteger gasPrice;
    private volatile BigInteger gasUsed;
    private volatile String error;
    private volatile String replacedBy;
    private volatile TxId replacedById;
    private volatile TxId replaces;

    public TransactionMetadata(TxId id) {
        this.id = id;
    }

    public TxId getId() {
        return id;
    }

    public TxState getState() {
        return state;
    }

    public void setState(TxState state) {
        this.state = state;
    }

    public String getHash() {
        return hash;
    }

    public void setHash(String hash) {
        this.hash = hash;
    }

    public Long getNonce() {
        return nonce;
    }

    public void setNonce(Long nonce) {
        this.nonce = nonce;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public void setSubmittedAt(Instant submittedAt) {
        this.submittedAt = submittedAt;
    }

    public Instant getConfirmedAt() {
        return confirmedAt;
    }

    public void setConfirmedAt(Instant confirmedAt) {
        this.confirmedAt = confirmedAt;
    }

    public BigInteger getGasPrice() {
        return gasPrice;
    }

    public void setGasPrice(BigInteger gasPrice) {
        this.gasPrice = gasPrice;
    }

    public BigInteger getGasUsed() {
        return gasUsed;
    }

    public void setGasUsed(BigInteger gasUsed) {
        this.gasUsed = gasUsed;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getReplacedBy() {
        return replacedBy;
    }

    public void setReplacedBy(String replacedBy) {
        this.replacedBy = replacedBy;
    }

    public TxId getReplacedById() {
        return replacedById;
    }

    public void setReplacedById(TxId replacedById) {
        this.replacedById = replacedById;
    }

    /**
     * 若本条是替换交易，指向被替换的原交易。
     */
    public TxId getReplaces() {
        return replaces;
    }

    public void setReplaces(TxId replaces) {
        this.replaces = replaces;
    }

    public TransactionMetadata snapshot() {
        TransactionMetadata copy = new TransactionMetadata(id);
        copy.state = state;
        copy.hash = hash;
        copy.nonce = nonce;
        copy.attempts = attempts;
        copy.submittedAt = submittedAt;
        copy.confirmedAt = confirmedAt;
        copy.gasPrice = gasPrice;
        copy.gasUsed = gasUsed;
        copy.error = error;
        copy.replacedBy = replacedBy;
        copy.replacedById = replacedById;
        copy.replaces = replaces;
        return copy;
    }
}
