package com.work.chainexec.txmgr.service;

import com.work.chainexec.core.chain.ChainRpcClient;
import com.work.chainexec.core.chain.PendingTransaction;
import com.work.chainexec.core.chain.TransactionSigner;
import com.work.chainexec.core.chain.TxReceipt;
import com.work.chainexec.core.chain.TxRequest;
import com.work.chainexec.core.exception.ConfirmationTimeoutException;
import com.work.chainexec.core.exception.FatalSubmissionException;
import com.work.chainexec.core.exception.GasSpikeRejectedException;
import com.work.chainexec.core.exception.RpcErrorClassifier;
import com.work.chainexec.core.exception.RpcErrorKind;
import com.work.chainexec.core.exception.TransientSubmissionException;
import com.work.chainexec.core.nonce.NonceAllocator;
import com.work.chainexec.core.support.Sleeper;
import com.work.chainexec.txmgr.config.TxMgrProperties;
import com.work.chainexec.txmgr.domain.TransactionMetadata;
import com.work.chainexec.txmgr.domain.TxId;
import com.work.chainexec.txmgr.domain.TxState;
import com.work.chainexec.txmgr.service.gas.GasAdmission;
import com.work.chainexec.txmgr.service.gas.GasSpikeGuard;
import com.work.chainexec.txmgr.support.metrics.TxMgrMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static com.work.chainexec.core.support.ValidationUtils.requireAddress;
import static com.work.chainexec.core.support.ValidationUtils.requireNonNull;

/**
 * 单链提交流水线：准入 -> 分配 nonce -> 签名 -> 发送 -> 等确认，失败按错误分类重试。
 *
 * <p>关键约束：</p>
 * <ul>
 *   <li>一笔逻辑交易只占用一个 nonce，重试是同 nonce + 递增 gas 的替换</li>
 *   <li>只有 NONCE 类错误且该 nonce 尚未广播过时才放弃该 nonce，下次尝试重新分配</li>
 *   <li>重试前先查已广播 hash 的 receipt，已上链则直接收尾，不再重发</li>
 *   <li>FATAL 错误立即终止；发送次数不超过 maxRetries + 1</li>
 *   <li>预期内的失败一律以 {@link TransactionResult} 返回，不抛出</li>
 * </ul>
 */
public class SubmissionPipeline {

    private static final Logger log = LoggerFactory.getLogger(SubmissionPipeline.class);

    private static final BigInteger REPLACEMENT_PERCENT = BigInteger.valueOf(110);
    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private final ChainRpcClient chain;
    private final TransactionSigner signer;
    private final NonceAllocator allocator;
    private final TxRegistry registry;
    private final GasSpikeGuard gasGuard;
    private final TxMgrProperties props;
    private final TxMgrMetrics metrics;
    private final Sleeper sleeper;
    private final Clock clock;

    private final AtomicLong totalTransactions = new AtomicLong();
    private final AtomicLong successfulTransactions = new AtomicLong();
    private final AtomicLong failedTransactions = new AtomicLong();
    private final AtomicLong retriedTransactions = new AtomicLong();
    private final AtomicLong replacedTransactions = new AtomicLong();
    private final AtomicLong timeoutTransactions = new AtomicLong();
    private final AtomicReference<BigInteger> totalGasUsed = new AtomicReference<>(BigInteger.ZERO);

    public SubmissionPipeline(ChainRpcClient chain,
                              TransactionSigner signer,
                              NonceAllocator allocator,
                              TxRegistry registry,
                              GasSpikeGuard gasGuard,
                              TxMgrProperties props,
                              TxMgrMetrics metrics,
                              Sleeper sleeper,
                              Clock clock) {
        this.chain = requireNonNull(chain, "chain");
        this.signer = requireNonNull(signer, "signer");
        this.allocator = requireNonNull(allocator, "allocator");
        this.registry = requireNonNull(registry, "registry");
        this.gasGuard = requireNonNull(gasGuard, "gasGuard");
        this.props = requireNonNull(props, "props");
        this.metrics = requireNonNull(metrics, "metrics");
        this.sleeper = requireNonNull(sleeper, "sleeper");
        this.clock = requireNonNull(clock, "clock");
    }

    public String getSignerAddress() {
        return signer.getAddress();
    }

    public ChainRpcClient getChain() {
        return chain;
    }

    public TransactionResult executeTransaction(String to, String data, TransactionOptions options) {
        requireAddress(to, "to");
        TransactionOptions opts = options == null ? TransactionOptions.defaults() : options;

        TransactionMetadata metadata = registry.create();
        totalTransactions.incrementAndGet();
        log.info("tx start id={} to={} from={}", metadata.getId(), to, signer.getAddress());

        GasAdmission admission = gasGuard.check();
        if (!admission.isAllowed()) {
            GasSpikeRejectedException rejected = new GasSpikeRejectedException(admission.getReason());
            log.warn("tx rejected by gas admission id={} reason={}", metadata.getId(), admission.getReason());
            metrics.gasSpikeRejected(admission.getReason());
            return finishFailed(metadata, TxState.FAILED, rejected.getMessage());
        }

        RetryPolicy policy = RetryPolicy.from(props).override(opts.getMaxRetries(), opts.getInitialDelay(),
                opts.getMaxDelay(), opts.getBackoffMultiplier(), opts.getGasPriceIncrement());
        return runWithRetry(metadata, to, data, opts, policy, admission.getCurrentGasPrice());
    }

    private TransactionResult runWithRetry(TransactionMetadata metadata,
                                           String to,
                                           String data,
                                           TransactionOptions opts,
                                           RetryPolicy policy,
                                           BigInteger observedGasPrice) {
        List<String> broadcastHashes = new ArrayList<>();
        Long nonce = opts.getNonce();
        boolean nonceBroadcast = false;
        BigInteger baseGasPrice = opts.getGasPrice() != null ? opts.getGasPrice() : observedGasPrice;
        RuntimeException lastError = null;

        for (int attempt = 0; attempt <= policy.getMaxRetries(); attempt++) {
            TxReceipt mined = findMinedReceipt(broadcastHashes);
            if (mined != null) {
                return finishMined(metadata, mined);
            }

            Duration waitTimeout = remainingConfirmationWindow(opts.getDeadline());
            if (waitTimeout == null) {
                // 截止时间已过，再退避也发不出去
                lastError = new ConfirmationTimeoutException("Transaction deadline exceeded: " + opts.getDeadline());
                metadata.setError(lastError.getMessage());
                log.warn("tx deadline exceeded id={} attempt={} deadline={}",
                        metadata.getId(), attempt + 1, opts.getDeadline());
                break;
            }
            metadata.setAttempts(attempt + 1);

            try {
                if (nonce == null) {
                    nonce = allocator.getNextNonce();
                    nonceBroadcast = false;
                }
                metadata.setNonce(nonce);

                if (baseGasPrice == null && !isEip1559(opts)) {
                    baseGasPrice = chain.getGasPrice();
                }
                TxRequest request = buildRequest(to, data, opts, policy, baseGasPrice, attempt);
                metadata.setGasPrice(request.isEip1559() ? request.getMaxFeePerGas() : request.getGasPrice());

                String signed = signer.sign(request, nonce);
                String hash = chain.sendRawTransaction(signed);
                broadcastHashes.add(hash);
                nonceBroadcast = true;

                metadata.setHash(hash);
                metadata.setState(TxState.SUBMITTED);
                metadata.setSubmittedAt(clock.instant());
                log.info("tx submitted id={} hash={} nonce={} attempt={} gasPrice={}",
                        metadata.getId(), hash, nonce, attempt + 1, metadata.getGasPrice());

                TxReceipt receipt = chain.waitForTransaction(hash, props.getConfirmations(), waitTimeout);
                if (receipt == null) {
                    throw new ConfirmationTimeoutException("Transaction confirmation timeout after "
                            + waitTimeout.toMillis() + "ms: " + hash);
                }
                return finishMined(metadata, receipt);
            } catch (RuntimeException e) {
                lastError = e;
                metadata.setError(e.getMessage());
                RpcErrorKind kind = RpcErrorClassifier.classify(e);

                if (kind == RpcErrorKind.FATAL) {
                    log.error("tx fatal error id={} attempt={} err={}", metadata.getId(), attempt + 1, e.getMessage());
                    break;
                }
                if (kind == RpcErrorKind.NONCE && opts.getNonce() == null) {
                    allocator.handleSendError(e);
                    metrics.nonceResync(signer.getAddress());
                    if (!nonceBroadcast) {
                        // 该 nonce 从未广播过，放弃它，下次尝试重新分配
                        nonce = null;
                    }
                }
                if (attempt >= policy.getMaxRetries()) {
                    break;
                }

                Duration delay = policy.backoff(attempt);
                if (attempt == 0) {
                    retriedTransactions.incrementAndGet();
                }
                metrics.retry(attempt + 1, kind.name());
                log.warn("tx attempt failed id={} attempt={} kind={} retryIn={}ms err={}",
                        metadata.getId(), attempt + 1, kind, delay.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    lastError = new TransientSubmissionException("Interrupted during retry backoff", ie);
                    break;
                }
            }
        }

        TxReceipt mined = findMinedReceipt(broadcastHashes);
        if (mined != null) {
            return finishMined(metadata, mined);
        }
        if (nonce != null && !nonceBroadcast && opts.getNonce() == null) {
            // 分配器已越过一个链上从未见过的 nonce，不回收就会留下空洞
            log.warn("tx abandoned unbroadcast nonce id={} nonce={}, scheduling resync", metadata.getId(), nonce);
            allocator.resyncAsync();
        }
        String error = lastError == null ? "Transaction failed" : lastError.getMessage();
        TxState terminal = lastError instanceof ConfirmationTimeoutException ? TxState.TIMEOUT : TxState.FAILED;
        return finishFailed(metadata, terminal, error);
    }

    /**
     * 用同一 nonce 提交更高 gas 的替换交易。
     *
     * <p>新价格取 max(newGasPrice, 原价 * 1.10)；原交易已上链时直接返回原 hash，不重发。</p>
     */
    public TransactionResult replaceTransaction(TxId id, BigInteger newGasPrice) {
        TransactionMetadata original = registry.get(id);
        if (original == null) {
            return TransactionResult.failure(null, "Transaction not found: " + id);
        }
        String originalHash = original.getHash();
        if (originalHash == null) {
            return TransactionResult.failure(original.snapshot(), "Transaction has not been submitted: " + id);
        }

        TransactionMetadata replacement = null;
        try {
            PendingTransaction pending = chain.getTransaction(originalHash);
            if (pending == null) {
                return TransactionResult.failure(original.snapshot(),
                        "Original transaction not found on chain: " + originalHash);
            }
            if (pending.isMined()) {
                log.info("tx already mined, replacement skipped id={} hash={}", id, originalHash);
                metrics.replacement("already_mined");
                return TransactionResult.success(original.snapshot(), chain.getTransactionReceipt(originalHash));
            }

            BigInteger originalPrice = pending.getGasPrice() == null ? BigInteger.ZERO : pending.getGasPrice();
            BigInteger minReplacement = originalPrice.multiply(REPLACEMENT_PERCENT).divide(HUNDRED);
            BigInteger gasPrice = newGasPrice == null ? minReplacement : newGasPrice.max(minReplacement);

            replacement = registry.create();
            totalTransactions.incrementAndGet();
            replacement.setReplaces(id);
            replacement.setNonce(pending.getNonce());
            replacement.setAttempts(1);
            replacement.setGasPrice(gasPrice);

            TxRequest request = TxRequest.builder()
                    .to(pending.getTo())
                    .data(pending.getData())
                    .value(pending.getValue())
                    .gasLimit(pending.getGasLimit())
                    .gasPrice(gasPrice)
                    .build();
            String hash = chain.sendRawTransaction(signer.sign(request, pending.getNonce()));

            original.setState(TxState.REPLACED);
            original.setReplacedBy(hash);
            original.setReplacedById(replacement.getId());
            replacement.setHash(hash);
            replacement.setState(TxState.SUBMITTED);
            replacement.setSubmittedAt(clock.instant());
            replacedTransactions.incrementAndGet();
            metrics.replacement("submitted");
            log.info("tx replaced id={} oldHash={} newId={} newHash={} nonce={} gasPrice={}",
                    id, originalHash, replacement.getId(), hash, pending.getNonce(), gasPrice);

            Duration timeout = props.getConfirmationTimeout();
            TxReceipt receipt = chain.waitForTransaction(hash, props.getConfirmations(), timeout);
            if (receipt == null) {
                return finishFailed(replacement, TxState.TIMEOUT,
                        "Replacement confirmation timeout after " + timeout.toMillis() + "ms: " + hash);
            }
            return finishMined(replacement, receipt);
        } catch (RuntimeException e) {
            log.warn("tx replacement failed id={} err={}", id, e.getMessage());
            metrics.replacement("error");
            if (replacement == null) {
                return TransactionResult.failure(original.snapshot(), e.getMessage());
            }
            return finishFailed(replacement, TxState.FAILED, e.getMessage());
        }
    }

    public TransactionResult replaceTransaction(String id, BigInteger newGasPrice) {
        TxId txId = TxId.parse(id);
        if (txId == null) {
            return TransactionResult.failure(null, "Transaction not found: " + id);
        }
        return replaceTransaction(txId, newGasPrice);
    }

    /**
     * 返回当前状态快照；id 未知或已被回收返回 null。
     */
    public TransactionMetadata getTransactionStatus(TxId id) {
        TransactionMetadata metadata = registry.get(id);
        return metadata == null ? null : metadata.snapshot();
    }

    public TransactionMetadata getTransactionStatus(String id) {
        return getTransactionStatus(TxId.parse(id));
    }

    public SubmissionStatistics getStatistics() {
        return new SubmissionStatistics(
                totalTransactions.get(),
                successfulTransactions.get(),
                failedTransactions.get(),
                retriedTransactions.get(),
                replacedTransactions.get(),
                timeoutTransactions.get(),
                totalGasUsed.get());
    }

    private TxRequest buildRequest(String to,
                                   String data,
                                   TransactionOptions opts,
                                   RetryPolicy policy,
                                   BigInteger baseGasPrice,
                                   int attempt) {
        TxRequest.Builder builder = TxRequest.builder()
                .to(to)
                .data(data)
                .value(opts.getValue())
                .gasLimit(opts.getGasLimit());
        if (isEip1559(opts)) {
            builder.maxFeePerGas(policy.priceForAttempt(opts.getMaxFeePerGas(), attempt))
                    .maxPriorityFeePerGas(policy.priceForAttempt(opts.getMaxPriorityFeePerGas(), attempt));
        } else {
            builder.gasPrice(policy.priceForAttempt(baseGasPrice, attempt));
        }
        return builder.build();
    }

    private static boolean isEip1559(TransactionOptions opts) {
        return opts.getMaxFeePerGas() != null && opts.getMaxPriorityFeePerGas() != null;
    }

    /**
     * 本次尝试可用的确认等待时间；截止时间已过返回 null。
     */
    private Duration remainingConfirmationWindow(Instant deadline) {
        if (deadline == null) {
            return props.getConfirmationTimeout();
        }
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            return null;
        }
        return remaining;
    }

    /**
     * 查已广播 hash 中是否有已上链的；查询失败视为未上链。
     */
    private TxReceipt findMinedReceipt(List<String> hashes) {
        for (String hash : hashes) {
            try {
                TxReceipt receipt = chain.getTransactionReceipt(hash);
                if (receipt != null) {
                    return receipt;
                }
            } catch (RuntimeException e) {
                log.warn("receipt lookup failed hash={} err={}", hash, e.getMessage());
            }
        }
        return null;
    }

    private TransactionResult finishMined(TransactionMetadata metadata, TxReceipt receipt) {
        metadata.setHash(receipt.getTxHash() == null ? metadata.getHash() : receipt.getTxHash());
        metadata.setGasUsed(receipt.getGasUsed());
        totalGasUsed.accumulateAndGet(receipt.getGasUsed(), BigInteger::add);
        if (!receipt.isSuccess()) {
            FatalSubmissionException reverted =
                    new FatalSubmissionException("Transaction reverted on-chain: " + receipt.getTxHash());
            log.error("tx reverted id={} hash={} block={}", metadata.getId(), receipt.getTxHash(), receipt.getBlockNumber());
            return finishFailed(metadata, TxState.FAILED, reverted.getMessage());
        }
        metadata.setState(TxState.CONFIRMED);
        metadata.setConfirmedAt(clock.instant());
        metadata.setError(null);
        successfulTransactions.incrementAndGet();
        metrics.submission("confirmed");
        log.info("tx confirmed id={} hash={} block={} attempts={}",
                metadata.getId(), receipt.getTxHash(), receipt.getBlockNumber(), metadata.getAttempts());
        return TransactionResult.success(metadata.snapshot(), receipt);
    }

    private TransactionResult finishFailed(TransactionMetadata metadata, TxState state, String error) {
        metadata.setState(state);
        metadata.setError(error);
        if (state == TxState.TIMEOUT) {
            timeoutTransactions.incrementAndGet();
            metrics.submission("timeout");
        } else {
            failedTransactions.incrementAndGet();
            metrics.submission("failed");
        }
        log.warn("tx finished without confirmation id={} state={} attempts={} err={}",
                metadata.getId(), state, metadata.getAttempts(), error);
        return TransactionResult.failure(metadata.snapshot(), error);
    }
}
