package com.work.chainexec.core.nonce;

import com.work.chainexec.core.chain.ChainBlockTag;
import com.work.chainexec.core.chain.ChainRpcClient;
import com.work.chainexec.core.exception.NonceException;
import com.work.chainexec.core.exception.RpcErrorClassifier;
import com.work.chainexec.core.exception.RpcErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

import static com.work.chainexec.core.support.ValidationUtils.requireNonEmpty;
import static com.work.chainexec.core.support.ValidationUtils.requireNonNull;

/**
 * 单个签名地址的 nonce 分配器：max(chain pending, 内部计数) 策略。
 *
 * <p>约束：</p>
 * <ul>
 *   <li>同一地址的所有读-改-写串行（同一把锁），返回值严格递增、无重复</li>
 *   <li>链查询失败时抛 {@link NonceException}，内部状态不变，不发放 nonce</li>
 *   <li>锁只覆盖 nonce 查询本身，确认等待 / 退避睡眠等都不在锁内</li>
 * </ul>
 */
public class NonceAllocator {

    private static final Logger log = LoggerFactory.getLogger(NonceAllocator.class);

    private final ChainRpcClient chain;
    private final String address;
    private final Executor resyncExecutor;
    private final ReentrantLock lock = new ReentrantLock();

    // 以下两个字段只在 lock 内读写
    private long nextNonce;
    private boolean initialized;

    public NonceAllocator(ChainRpcClient chain, String address, Executor resyncExecutor) {
        this.chain = requireNonNull(chain, "chain");
        this.address = requireNonEmpty(address, "address");
        this.resyncExecutor = requireNonNull(resyncExecutor, "resyncExecutor");
    }

    public String getAddress() {
        return address;
    }

    /**
     * 发放下一个 nonce。
     *
     * <p>未初始化时先以链上 latest 计数为起点；每次都再查一次 pending 计数，
     * 若更高则采纳（吸收分配器之外消耗的 nonce，例如手工交易）。</p>
     */
    public long getNextNonce() {
        return getNextNonces(1);
    }

    /**
     * 一次发放 count 个连续 nonce，返回第一个；用于 bundle 等要求 nonce 连续的场景。
     */
    public long getNextNonces(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count 必须大于0");
        }
        lock.lock();
        try {
            long current = nextNonce;
            if (!initialized) {
                current = fetchCount(ChainBlockTag.LATEST, "Nonce initialization failed");
            }
            long pending = fetchCount(ChainBlockTag.PENDING, "Failed to fetch pending nonce");
            if (pending > current) {
                log.info("nonce adopt pending address={} internal={} pending={}", address, current, pending);
                current = pending;
            }
            // 两次查询都成功后才落状态
            nextNonce = current + count;
            initialized = true;
            return current;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 丢弃内部状态并从链上 latest 重新推导；与 {@link #getNextNonce()} 共用一把锁。
     * 查询失败时保持未初始化，下一次分配会重新惰性初始化。
     */
    public void resyncNonce() {
        lock.lock();
        try {
            initialized = false;
            long latest = fetchCount(ChainBlockTag.LATEST, "Nonce resynchronization failed");
            nextNonce = latest;
            initialized = true;
            log.info("nonce resynced address={} next={}", address, latest);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 后台重同步，不阻塞观测到错误的调用方。
     */
    public void resyncAsync() {
        resyncExecutor.execute(() -> {
            try {
                resyncNonce();
            } catch (NonceException e) {
                log.warn("background nonce resync failed address={} err={}", address, e.toString());
            }
        });
    }

    /**
     * 若错误属于 nonce 类，触发后台重同步并返回 true；错误本身仍由调用方继续传播。
     */
    public boolean handleSendError(Throwable error) {
        if (!isNonceError(error)) {
            return false;
        }
        log.info("nonce error detected address={} err={}, scheduling resync", address,
                error == null ? null : error.getMessage());
        resyncAsync();
        return true;
    }

    public static boolean isNonceError(Throwable error) {
        return RpcErrorClassifier.classify(error) == RpcErrorKind.NONCE;
    }

    /**
     * 当前内部计数快照（仅用于观测）；未初始化返回 -1。
     */
    public long peekNextNonce() {
        lock.lock();
        try {
            return initialized ? nextNonce : -1L;
        } finally {
            lock.unlock();
        }
    }

    private long fetchCount(ChainBlockTag tag, String failureMessage) {
        try {
            return chain.getTransactionCount(address, tag);
        } catch (RuntimeException e) {
            throw new NonceException(failureMessage + ": " + e.getMessage(), e);
        }
    }
}
