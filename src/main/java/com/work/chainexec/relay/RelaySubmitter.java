package com.work.chainexec.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.work.chainexec.core.chain.ChainRpcClient;
import com.work.chainexec.core.chain.TransactionSigner;
import com.work.chainexec.core.chain.TxReceipt;
import com.work.chainexec.core.chain.TxRequest;
import com.work.chainexec.core.nonce.NonceAllocator;
import com.work.chainexec.core.support.Sleeper;
import com.work.chainexec.relay.bundle.Bundle;
import com.work.chainexec.relay.bundle.BundleInclusion;
import com.work.chainexec.relay.bundle.BundleOptions;
import com.work.chainexec.relay.bundle.BundleSimulation;
import com.work.chainexec.relay.bundle.BundleStatus;
import com.work.chainexec.relay.bundle.TxSimulation;
import com.work.chainexec.relay.config.RelayProperties;
import com.work.chainexec.relay.transport.RelayTransport;
import com.work.chainexec.txmgr.support.metrics.TxMgrMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.chainexec.core.support.ValidationUtils.requireNonEmpty;
import static com.work.chainexec.core.support.ValidationUtils.requireNonNull;

/**
 * 私有 relay 提交通道：单笔私有交易 + Flashbots 风格 bundle 生命周期。
 *
 * <ul>
 *   <li>relay 按 priority 降序尝试；fastMode 关闭时只试第一个</li>
 *   <li>只有调用方允许且全局开关打开时才回落到公开 mempool</li>
 *   <li>已分配但最终没有任何通道接收的 nonce 通过后台重同步归还</li>
 *   <li>预期内的失败以结果对象返回，不抛出</li>
 * </ul>
 */
public class RelaySubmitter {

    private static final Logger log = LoggerFactory.getLogger(RelaySubmitter.class);

    private static final int DEFAULT_MEV_SHARE_BLOCK_RANGE = 5;
    private static final int POLLS_PER_BLOCK_LIMIT = 10;

    private final RelayRegistry registry;
    private final RelayTransport transport;
    private final ChainRpcClient chain;
    private final TransactionSigner signer;
    private final NonceAllocator allocator;
    private final RelayProperties props;
    private final TxMgrMetrics metrics;
    private final Sleeper sleeper;
    private final Clock clock;

    private final Map<RelayType, RelayStats> stats = new ConcurrentHashMap<>();
    private final Cache<String, TrackedBundle> trackedBundles;

    public RelaySubmitter(RelayRegistry registry,
                          RelayTransport transport,
                          ChainRpcClient chain,
                          TransactionSigner signer,
                          NonceAllocator allocator,
                          RelayProperties props,
                          TxMgrMetrics metrics,
                          Sleeper sleeper,
                          Clock clock) {
        this.registry = requireNonNull(registry, "registry");
        this.transport = requireNonNull(transport, "transport");
        this.chain = requireNonNull(chain, "chain");
        this.signer = requireNonNull(signer, "signer");
        this.allocator = requireNonNull(allocator, "allocator");
        this.props = requireNonNull(props, "props");
        this.metrics = requireNonNull(metrics, "metrics");
        this.sleeper = requireNonNull(sleeper, "sleeper");
        this.clock = requireNonNull(clock, "clock");
        this.trackedBundles = Caffeine.newBuilder()
                .expireAfterWrite(props.getBundleTrackingTtl())
                .build();
    }

    public RelayRegistry getRegistry() {
        return registry;
    }

    public PrivateTxResult submitPrivateTransaction(TxRequest tx, PrivateTxOptions options) {
        requireNonNull(tx, "tx");
        PrivateTxOptions opts = options == null ? PrivateTxOptions.defaults() : options;
        PrivacyLevel level = opts.getPrivacyLevel() == null ? props.getDefaultPrivacyLevel() : opts.getPrivacyLevel();
        long start = clock.millis();

        List<RelayConfig> relays = registry.select(level, opts.getPreferredRelay());
        boolean fallbackAllowed = opts.isAllowPublicFallback() && props.isEnableFallback();
        if (relays.isEmpty() && !fallbackAllowed) {
            log.warn("no private relay available privacyLevel={}", level);
            return PrivateTxResult.failure("No private relays available and public fallback disabled", 0);
        }

        long nonce;
        try {
            nonce = allocator.getNextNonce();
        } catch (RuntimeException e) {
            return PrivateTxResult.failure("Failed to allocate nonce: " + e.getMessage(), 0);
        }
        String signed;
        try {
            signed = signer.sign(tx, nonce);
        } catch (RuntimeException e) {
            allocator.resyncAsync();
            return PrivateTxResult.failure("Failed to sign transaction: " + e.getMessage(), 0);
        }
        String txHash = Hash.sha3(signed);
        log.info("private tx prepared hash={} nonce={} privacyLevel={} relays={}", txHash, nonce, level, relays.size());

        String lastError = null;
        int tried = 0;
        for (RelayConfig relay : relays) {
            tried++;
            RelayStats relayStats = statsOf(relay.getType());
            relayStats.recordSubmission(clock.instant());
            try {
                Accepted accepted = sendToRelay(relay, signed, txHash, opts);
                long elapsed = clock.millis() - start;
                relayStats.recordAcceptance(elapsed);
                metrics.relaySubmission(relay.getType().name(), "accepted");
                log.info("private tx accepted relay={} hash={} bundleHash={} tried={}",
                        relay.getName(), accepted.txHash, accepted.bundleHash, tried);
                return PrivateTxResult.success(accepted.txHash, accepted.bundleHash, relay.getType(), tried, elapsed);
            } catch (RuntimeException e) {
                relayStats.recordFailure();
                metrics.relaySubmission(relay.getType().name(), "failed");
                lastError = e.getMessage();
                log.warn("private tx relay failed relay={} hash={} err={}", relay.getName(), txHash, lastError);
            }
            if (!opts.isFastMode()) {
                break;
            }
        }

        if (fallbackAllowed) {
            log.info("falling back to public mempool hash={} tried={}", txHash, tried);
            statsOf(RelayType.PUBLIC_RPC).recordSubmission(clock.instant());
            try {
                String hash = chain.sendRawTransaction(signed);
                long elapsed = clock.millis() - start;
                statsOf(RelayType.PUBLIC_RPC).recordAcceptance(elapsed);
                metrics.relaySubmission(RelayType.PUBLIC_RPC.name(), "accepted");
                log.warn("private tx sent to public mempool hash={}", hash);
                return PrivateTxResult.success(hash, null, RelayType.PUBLIC_RPC, tried, elapsed);
            } catch (RuntimeException e) {
                statsOf(RelayType.PUBLIC_RPC).recordFailure();
                metrics.relaySubmission(RelayType.PUBLIC_RPC.name(), "failed");
                if (!allocator.handleSendError(e)) {
                    allocator.resyncAsync();
                }
                log.error("public mempool fallback failed hash={} err={}", txHash, e.getMessage());
                return PrivateTxResult.failure("Public mempool submission failed: " + e.getMessage(), tried);
            }
        }

        allocator.resyncAsync();
        return PrivateTxResult.failure("All private relays failed. Last error: " + lastError, tried);
    }

    /**
     * eth_cancelPrivateTransaction。只对尚未打包的交易有效，返回 relay 是否确认取消。
     */
    public boolean cancelPrivateTransaction(String txHash) {
        requireNonEmpty(txHash, "txHash");
        RelayConfig relay = registry.get(RelayType.FLASHBOTS_PROTECT);
        if (relay == null || !relay.isEnabled()) {
            log.warn("cancel private tx skipped, no Flashbots relay hash={}", txHash);
            return false;
        }
        Map<String, Object> param = new LinkedHashMap<>();
        param.put("txHash", txHash);
        try {
            JsonNode result = transport.call(relay, "eth_cancelPrivateTransaction", Collections.singletonList(param));
            boolean cancelled = result.asBoolean(false);
            log.info("cancel private tx hash={} cancelled={}", txHash, cancelled);
            return cancelled;
        } catch (RuntimeException e) {
            log.warn("cancel private tx failed hash={} err={}", txHash, e.getMessage());
            return false;
        }
    }

    /**
     * 用一段连续 nonce 签名 bundle 内全部交易；targetBlock &lt;= 0 时取下一个区块。
     *
     * <p>nonce 查询或签名失败时抛出 {@link com.work.chainexec.core.exception.ChainExecException} 家族异常。</p>
     */
    public Bundle createBundle(List<TxRequest> transactions, long targetBlock, BundleOptions options) {
        if (transactions == null || transactions.isEmpty()) {
            throw new IllegalArgumentException("transactions 不能为空");
        }
        BundleOptions opts = options == null ? BundleOptions.defaults() : options;
        long target = targetBlock > 0 ? targetBlock : chain.getLatestBlockNumber() + 1;

        long first = allocator.getNextNonces(transactions.size());
        List<String> signed = new ArrayList<>(transactions.size());
        try {
            for (int i = 0; i < transactions.size(); i++) {
                signed.add(signer.sign(transactions.get(i), first + i));
            }
        } catch (RuntimeException e) {
            allocator.resyncAsync();
            throw e;
        }
        log.info("bundle created txs={} firstNonce={} target={}", signed.size(), first, target);
        return new Bundle(signed, target, opts.getMinTimestamp(), opts.getMaxTimestamp(),
                opts.getRevertingTxHashes(), opts.getReplacementUuid(), true);
    }

    /**
     * eth_callBundle 试运行：返回每笔交易是否 revert 以及 coinbase 收益。
     */
    public BundleSimulation simulateBundle(Bundle bundle) {
        requireNonNull(bundle, "bundle");
        RelayConfig relay = registry.bundleRelay();
        if (relay == null) {
            return BundleSimulation.failure("No Flashbots relay configured");
        }
        Map<String, Object> param = new LinkedHashMap<>();
        param.put("txs", bundle.getSignedTransactions());
        param.put("blockNumber", hex(bundle.getTargetBlockNumber()));
        param.put("stateBlockNumber", "latest");

        statsOf(relay.getType()).recordSimulation();
        try {
            JsonNode result = transport.call(relay, "eth_callBundle", Collections.singletonList(param));
            List<TxSimulation> txs = new ArrayList<>();
            for (JsonNode r : result.path("results")) {
                JsonNode revert = r.get("revert");
                JsonNode error = r.get("error");
                boolean reverted = isPresent(revert) || isPresent(error);
                String reason = isPresent(revert) ? revert.asText() : (isPresent(error) ? error.asText() : null);
                txs.add(new TxSimulation(
                        r.path("txHash").asText(null),
                        quantity(r.get("gasUsed")),
                        quantity(r.get("coinbaseDiff")),
                        reverted,
                        reason));
            }
            BundleSimulation simulation = BundleSimulation.success(
                    result.path("bundleHash").asText(null),
                    quantity(result.get("totalGasUsed")),
                    quantity(result.get("coinbaseDiff")),
                    quantity(result.get("gasFees")),
                    txs);
            log.info("bundle simulated relay={} target={} gas={} coinbaseDiff={} reverted={}",
                    relay.getName(), bundle.getTargetBlockNumber(), simulation.getTotalGasUsed(),
                    simulation.getCoinbaseDiff(), simulation.hasRevert());
            return simulation;
        } catch (RuntimeException e) {
            log.warn("bundle simulation failed relay={} err={}", relay.getName(), e.getMessage());
            return BundleSimulation.failure(e.getMessage());
        }
    }

    /**
     * 先模拟再提交：任一交易 revert 或 coinbase 收益低于 minProfitWei 时拒绝，不调用提交。
     */
    public PrivateTxResult submitBundleWithValidation(Bundle bundle, BigInteger minProfitWei) {
        requireNonNull(bundle, "bundle");
        BundleSimulation simulation = simulateBundle(bundle);
        if (!simulation.isSuccess()) {
            releaseBundleNonces(bundle);
            return PrivateTxResult.failure("Bundle simulation failed: " + simulation.getError(), 0);
        }
        TxSimulation reverted = simulation.firstRevert();
        if (reverted != null) {
            releaseBundleNonces(bundle);
            log.warn("bundle rejected, simulated revert tx={} reason={}", reverted.getTxHash(), reverted.getRevertReason());
            return PrivateTxResult.failure("Bundle simulation reverted: tx " + reverted.getTxHash()
                    + " " + reverted.getRevertReason(), 0);
        }
        BigInteger min = minProfitWei == null ? BigInteger.ZERO : minProfitWei;
        if (simulation.getCoinbaseDiff().compareTo(min) < 0) {
            releaseBundleNonces(bundle);
            log.warn("bundle rejected, profit below minimum coinbaseDiff={} min={}", simulation.getCoinbaseDiff(), min);
            return PrivateTxResult.failure("Insufficient bundle profit: coinbaseDiff "
                    + simulation.getCoinbaseDiff() + " < minimum " + min, 0);
        }
        return submitFlashbotsBundle(bundle);
    }

    /**
     * eth_sendBundle；成功后按 bundleHash 跟踪，供等待 / 取消 / 查询使用。
     */
    public PrivateTxResult submitFlashbotsBundle(Bundle bundle) {
        requireNonNull(bundle, "bundle");
        long start = clock.millis();
        RelayConfig relay = registry.bundleRelay();
        if (relay == null) {
            return PrivateTxResult.failure("No Flashbots relay configured", 0);
        }
        Map<String, Object> param = new LinkedHashMap<>();
        param.put("txs", bundle.getSignedTransactions());
        param.put("blockNumber", hex(bundle.getTargetBlockNumber()));
        if (bundle.getMinTimestamp() != null) {
            param.put("minTimestamp", bundle.getMinTimestamp());
        }
        if (bundle.getMaxTimestamp() != null) {
            param.put("maxTimestamp", bundle.getMaxTimestamp());
        }
        param.put("revertingTxHashes", bundle.getRevertingTxHashes());
        if (bundle.getReplacementUuid() != null) {
            param.put("replacementUuid", bundle.getReplacementUuid());
        }

        RelayStats relayStats = statsOf(relay.getType());
        relayStats.recordSubmission(clock.instant());
        try {
            JsonNode result = transport.call(relay, "eth_sendBundle", Collections.singletonList(param));
            String bundleHash = result.path("bundleHash").asText(null);
            if (bundleHash == null) {
                bundleHash = Hash.sha3String(String.join(",", bundle.transactionHashes()));
            }
            trackedBundles.put(bundleHash, new TrackedBundle(bundle, relay.getType(), start));
            relayStats.recordAcceptance(clock.millis() - start);
            metrics.relaySubmission(relay.getType().name(), "bundle_submitted");
            log.info("bundle submitted relay={} bundleHash={} target={} txs={}",
                    relay.getName(), bundleHash, bundle.getTargetBlockNumber(), bundle.getSignedTransactions().size());
            return PrivateTxResult.success(null, bundleHash, relay.getType(), 1, clock.millis() - start);
        } catch (RuntimeException e) {
            relayStats.recordFailure();
            metrics.relaySubmission(relay.getType().name(), "failed");
            releaseBundleNonces(bundle);
            log.error("bundle submission failed relay={} err={}", relay.getName(), e.getMessage());
            return PrivateTxResult.failure(e.getMessage(), 1);
        }
    }

    /**
     * 逐块轮询 bundle 内全部交易的 receipt，最多等待 maxBlocks 个区块。
     *
     * <p>未被打包时：登记了 replacementUuid 的 bundle 会被取消；nonce 来自分配器的会触发重同步。</p>
     */
    public BundleInclusion waitForBundleInclusion(String bundleHash, int maxBlocks) {
        requireNonEmpty(bundleHash, "bundleHash");
        TrackedBundle tracked = trackedBundles.getIfPresent(bundleHash);
        if (tracked == null) {
            return BundleInclusion.failure(bundleHash, 0, "Bundle not tracked: " + bundleHash);
        }
        int limit = maxBlocks > 0 ? maxBlocks : props.getMaxBundleWaitBlocks();
        List<String> hashes = tracked.bundle.transactionHashes();

        long startBlock;
        try {
            startBlock = chain.getLatestBlockNumber();
        } catch (RuntimeException e) {
            return BundleInclusion.failure(bundleHash, 0, "Failed to read block number: " + e.getMessage());
        }

        long waited = 0;
        int polls = 0;
        int maxPolls = Math.max(1, limit) * POLLS_PER_BLOCK_LIMIT;
        while (true) {
            try {
                Long includedAt = includedBlock(hashes);
                if (includedAt != null) {
                    long elapsed = clock.millis() - tracked.submittedAtMillis;
                    statsOf(tracked.relayType).recordInclusion(elapsed);
                    metrics.bundleInclusion("included", waited);
                    trackedBundles.invalidate(bundleHash);
                    log.info("bundle included bundleHash={} block={} blocksWaited={}", bundleHash, includedAt, waited);
                    return BundleInclusion.included(bundleHash, includedAt, waited);
                }
                waited = chain.getLatestBlockNumber() - startBlock;
            } catch (RuntimeException e) {
                log.warn("bundle inclusion poll failed bundleHash={} err={}", bundleHash, e.getMessage());
            }
            polls++;
            if (waited >= limit || polls >= maxPolls) {
                break;
            }
            try {
                sleeper.sleep(props.getPollInterval());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return BundleInclusion.failure(bundleHash, waited, "Interrupted while waiting for bundle inclusion");
            }
        }

        metrics.bundleInclusion("not_included", waited);
        log.warn("bundle not included bundleHash={} blocksWaited={}", bundleHash, waited);
        if (tracked.bundle.getReplacementUuid() != null) {
            cancelBundle(tracked.bundle.getReplacementUuid());
        }
        releaseBundleNonces(tracked.bundle);
        trackedBundles.invalidate(bundleHash);
        return BundleInclusion.notIncluded(bundleHash, waited);
    }

    /**
     * eth_cancelBundle。参数可以是 replacementUuid，也可以是已跟踪 bundle 的 hash（取其 replacementUuid）。
     */
    public boolean cancelBundle(String bundleHashOrUuid) {
        requireNonEmpty(bundleHashOrUuid, "bundleHashOrUuid");
        TrackedBundle tracked = trackedBundles.getIfPresent(bundleHashOrUuid);
        String uuid = tracked != null && tracked.bundle.getReplacementUuid() != null
                ? tracked.bundle.getReplacementUuid()
                : bundleHashOrUuid;
        RelayConfig relay = registry.bundleRelay();
        if (relay == null) {
            return false;
        }
        Map<String, Object> param = new LinkedHashMap<>();
        param.put("replacementUuid", uuid);
        try {
            transport.call(relay, "eth_cancelBundle", Collections.singletonList(param));
            log.info("bundle cancelled replacementUuid={}", uuid);
            return true;
        } catch (RuntimeException e) {
            log.warn("bundle cancel failed replacementUuid={} err={}", uuid, e.getMessage());
            return false;
        }
    }

    /**
     * eth_getBundleStats。
     */
    public BundleStatus getBundleStatus(String bundleHash) {
        requireNonEmpty(bundleHash, "bundleHash");
        RelayConfig relay = registry.bundleRelay();
        if (relay == null) {
            return BundleStatus.unavailable(bundleHash, "No Flashbots relay configured");
        }
        try {
            TrackedBundle tracked = trackedBundles.getIfPresent(bundleHash);
            long block = tracked != null ? tracked.bundle.getTargetBlockNumber() : chain.getLatestBlockNumber();
            Map<String, Object> param = new LinkedHashMap<>();
            param.put("bundleHash", bundleHash);
            param.put("blockNumber", hex(block));
            JsonNode r = transport.call(relay, "eth_getBundleStats", Collections.singletonList(param));
            return new BundleStatus(
                    bundleHash,
                    r.path("isSimulated").asBoolean(false),
                    r.path("isSentToMiners").asBoolean(false),
                    r.path("isHighPriority").asBoolean(false),
                    r.path("simulatedAt").asText(null),
                    r.path("submittedAt").asText(null),
                    r.path("sentToMinersAt").asText(null),
                    null);
        } catch (RuntimeException e) {
            log.warn("bundle stats failed bundleHash={} err={}", bundleHash, e.getMessage());
            return BundleStatus.unavailable(bundleHash, e.getMessage());
        }
    }

    public Map<RelayType, RelayStats> getStats() {
        Map<RelayType, RelayStats> copy = new EnumMap<>(RelayType.class);
        for (Map.Entry<RelayType, RelayStats> e : stats.entrySet()) {
            copy.put(e.getKey(), e.getValue().snapshot());
        }
        return copy;
    }

    public RelayStats getRelayStats(RelayType type) {
        RelayStats s = stats.get(type);
        return s == null ? null : s.snapshot();
    }

    private Accepted sendToRelay(RelayConfig relay, String signed, String txHash, PrivateTxOptions opts) {
        switch (relay.getType()) {
            case FLASHBOTS_PROTECT: {
                long current = chain.getLatestBlockNumber();
                Map<String, Object> preferences = new LinkedHashMap<>();
                preferences.put("fast", opts.isFastMode());
                Map<String, Object> param = new LinkedHashMap<>();
                param.put("tx", signed);
                param.put("maxBlockNumber", hex(current + Math.max(1, opts.getMaxBlockWait())));
                param.put("preferences", preferences);
                JsonNode result = transport.call(relay, "eth_sendPrivateTransaction", Collections.singletonList(param));
                return new Accepted(textOr(result, txHash), null);
            }
            case MEV_SHARE: {
                long target = chain.getLatestBlockNumber() + 1;
                int range = opts.getMaxBlockWait() > 0 ? opts.getMaxBlockWait() : DEFAULT_MEV_SHARE_BLOCK_RANGE;
                Map<String, Object> inclusion = new LinkedHashMap<>();
                inclusion.put("block", hex(target));
                inclusion.put("maxBlock", hex(target + range));
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("tx", signed);
                body.put("canRevert", false);
                Map<String, Object> privacy = new LinkedHashMap<>();
                privacy.put("hints", opts.getHints());
                privacy.put("builders", opts.getBuilders());
                Map<String, Object> param = new LinkedHashMap<>();
                param.put("version", "v0.1");
                param.put("inclusion", inclusion);
                param.put("body", Collections.singletonList(body));
                param.put("privacy", privacy);
                JsonNode result = transport.call(relay, "mev_sendBundle", Collections.singletonList(param));
                return new Accepted(txHash, result.path("bundleHash").asText(null));
            }
            case BUILDER_RPC:
            case PUBLIC_RPC:
            default: {
                JsonNode result = transport.call(relay, "eth_sendRawTransaction", Collections.singletonList(signed));
                return new Accepted(textOr(result, txHash), null);
            }
        }
    }

    private Long includedBlock(List<String> hashes) {
        long max = -1L;
        for (String hash : hashes) {
            TxReceipt receipt = chain.getTransactionReceipt(hash);
            if (receipt == null) {
                return null;
            }
            max = Math.max(max, receipt.getBlockNumber());
        }
        return max;
    }

    private void releaseBundleNonces(Bundle bundle) {
        if (bundle.isAllocatorNonced()) {
            allocator.resyncAsync();
        }
    }

    private RelayStats statsOf(RelayType type) {
        return stats.computeIfAbsent(type, RelayStats::new);
    }

    private static String hex(long value) {
        return Numeric.encodeQuantity(BigInteger.valueOf(value));
    }

    private static String textOr(JsonNode node, String fallback) {
        if (node == null || node.isNull() || !node.isTextual()) {
            return fallback;
        }
        return node.asText();
    }

    private static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull() && !node.asText().isEmpty();
    }

    private static BigInteger quantity(JsonNode node) {
        if (node == null || node.isNull()) {
            return BigInteger.ZERO;
        }
        if (node.isNumber()) {
            return node.bigIntegerValue();
        }
        String text = node.asText().trim();
        if (text.isEmpty()) {
            return BigInteger.ZERO;
        }
        if (text.startsWith("0x") || text.startsWith("0X")) {
            return Numeric.decodeQuantity(text);
        }
        return new BigInteger(text);
    }

    private static final class Accepted {
        private final String txHash;
        private final String bundleHash;

        private Accepted(String txHash, String bundleHash) {
            this.txHash = txHash;
            this.bundleHash = bundleHash;
        }
    }

    private static final class TrackedBundle {
        private final Bundle bundle;
        private final RelayType relayType;
        private final long submittedAtMillis;

        private TrackedBundle(Bundle bundle, RelayType relayType, long submittedAtMillis) {
            this.bundle = bundle;
            this.relayType = relayType;
            this.submittedAtMillis = submittedAtMillis;
        }
    }
}
