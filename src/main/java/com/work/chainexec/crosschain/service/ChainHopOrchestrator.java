package com.work.chainexec.crosschain.service;

import com.work.chainexec.core.exception.BridgeTimeoutException;
import com.work.chainexec.core.exception.ConfirmationTimeoutException;
import com.work.chainexec.core.support.Sleeper;
import com.work.chainexec.crosschain.adapter.ChainAdapter;
import com.work.chainexec.crosschain.adapter.SwapParams;
import com.work.chainexec.crosschain.bridge.BridgeManager;
import com.work.chainexec.crosschain.bridge.BridgeRoute;
import com.work.chainexec.crosschain.bridge.BridgeTransfer;
import com.work.chainexec.crosschain.config.CrossChainProperties;
import com.work.chainexec.crosschain.domain.CrossChainPath;
import com.work.chainexec.crosschain.domain.ExecutionResult;
import com.work.chainexec.crosschain.domain.ExecutionStep;
import com.work.chainexec.crosschain.domain.Hop;
import com.work.chainexec.crosschain.domain.StepStatus;
import com.work.chainexec.crosschain.recovery.RecoveryContext;
import com.work.chainexec.crosschain.recovery.RecoveryDecision;
import com.work.chainexec.crosschain.recovery.RecoveryHook;
import com.work.chainexec.crosschain.recovery.RecoveryOutcome;
import com.work.chainexec.txmgr.support.metrics.TxMgrMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

import static com.work.chainexec.core.support.ValidationUtils.requireNonNull;

/**
 * 跨链路径编排：按顺序执行 hop，上一步的产出作为下一步的输入。
 *
 * <p>任一 hop 失败即停止，结果里带上已完成的 hop 数和已发出的交易 hash，
 * 并按 {@link RecoveryHook} 的决定处置停留在中途的资金。</p>
 *
 * <p>所有公开方法对预期内的失败都返回 {@link ExecutionResult}，不抛出。</p>
 */
public class ChainHopOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ChainHopOrchestrator.class);

    private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);

    private final BridgeManager bridges;
    private final Map<Long, ChainAdapter> adapters;
    private final CrossChainProperties props;
    private final RecoveryHook recoveryHook;
    private final TxMgrMetrics metrics;
    private final ExecutorService pathExecutor;
    private final Sleeper sleeper;
    private final Clock clock;

    private final Map<String, List<ExecutionStep>> activeExecutions = new ConcurrentHashMap<>();
    private final AtomicLong executionSeq = new AtomicLong();

    public ChainHopOrchestrator(BridgeManager bridges,
                                Collection<? extends ChainAdapter> adapters,
                                CrossChainProperties props,
                                RecoveryHook recoveryHook,
                                TxMgrMetrics metrics,
                                ExecutorService pathExecutor,
                                Sleeper sleeper,
                                Clock clock) {
        this.bridges = requireNonNull(bridges, "bridges");
        this.props = requireNonNull(props, "props");
        this.recoveryHook = recoveryHook == null ? RecoveryHook.holdAll() : recoveryHook;
        this.metrics = requireNonNull(metrics, "metrics");
        this.pathExecutor = requireNonNull(pathExecutor, "pathExecutor");
        this.sleeper = requireNonNull(sleeper, "sleeper");
        this.clock = requireNonNull(clock, "clock");
        Map<Long, ChainAdapter> byChain = new HashMap<>();
        if (adapters != null) {
            for (ChainAdapter adapter : adapters) {
                byChain.put(adapter.getChainId(), adapter);
            }
        }
        this.adapters = byChain;
        if (props.getMaxConcurrentPaths() <= 0) {
            throw new IllegalArgumentException("maxConcurrentPaths 必须大于0");
        }
        if (props.getSlippageBps() < 0 || props.getSlippageBps() >= 10_000) {
            throw new IllegalArgumentException("slippageBps 必须在 [0, 10000) 之间");
        }
    }

    public ExecutionResult executePath(CrossChainPath path) {
        requireNonNull(path, "path");
        return execute(path, true);
    }

    /**
     * 分批并发执行，每批不超过 maxConcurrentPaths；单条路径异常只影响它自己的结果。
     * 返回顺序与入参一致。
     */
    public List<ExecutionResult> executeMultiplePaths(List<CrossChainPath> paths) {
        List<ExecutionResult> results = new ArrayList<>();
        if (paths == null || paths.isEmpty()) {
            return results;
        }
        int batchSize = props.getMaxConcurrentPaths();
        for (int from = 0; from < paths.size(); from += batchSize) {
            List<CrossChainPath> batch = paths.subList(from, Math.min(from + batchSize, paths.size()));
            List<Future<ExecutionResult>> futures = new ArrayList<>(batch.size());
            List<String> rejections = new ArrayList<>(batch.size());
            for (CrossChainPath path : batch) {
                try {
                    futures.add(pathExecutor.submit(() -> executePath(path)));
                    rejections.add(null);
                } catch (RejectedExecutionException e) {
                    futures.add(null);
                    rejections.add("Execution rejected: " + e.getMessage());
                }
            }
            for (int i = 0; i < batch.size(); i++) {
                results.add(await(batch.get(i), futures.get(i), rejections.get(i)));
            }
        }
        return results;
    }

    /**
     * 整条路径失败后从第一个 hop 重新执行，第 n 次重试前等待 retryBaseDelay * 2^n。
     * 全部失败时返回最后一次的结果。
     */
    public ExecutionResult executeWithRetry(CrossChainPath path) {
        requireNonNull(path, "path");
        int attempts = Math.max(1, props.getRetryAttempts());
        ExecutionResult last = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                last = executePath(path);
            } catch (RuntimeException e) {
                last = ExecutionResult.rejected(path, messageOf(e));
            }
            if (last.isSuccess()) {
                return last;
            }
            log.warn("path attempt failed pathId={} attempt={}/{} hopsCompleted={} err={}",
                    path.getId(), attempt + 1, attempts, last.getHopsCompleted(), last.getError());
            if (attempt < attempts - 1) {
                Duration delay = props.getRetryBaseDelay().multipliedBy(1L << attempt);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.error("path failed after retries pathId={} attempts={} err={}", path.getId(), attempts, last.getError());
        return last;
    }

    /**
     * 正在执行的路径及其各 hop 状态（快照）。
     */
    public Map<String, List<ExecutionStep>> getActiveExecutions() {
        Map<String, List<ExecutionStep>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<ExecutionStep>> e : activeExecutions.entrySet()) {
            copy.put(e.getKey(), snapshot(e.getValue()));
        }
        return copy;
    }

    public boolean isBusy() {
        return activeExecutions.size() >= props.getMaxConcurrentPaths();
    }

    public OrchestratorStats getStats() {
        return new OrchestratorStats(
                activeExecutions.size(),
                props.getMaxConcurrentPaths(),
                props.getRetryAttempts(),
                props.isEnableEmergencyRecovery());
    }

    private ExecutionResult execute(CrossChainPath path, boolean allowRecovery) {
        String executionId = "exec-" + executionSeq.incrementAndGet();
        long start = clock.millis();
        List<ExecutionStep> steps = new CopyOnWriteArrayList<>();
        List<String> txHashes = new ArrayList<>();
        BigInteger current = path.firstHop().getAmountIn();

        activeExecutions.put(executionId, steps);
        log.info("path execution started id={} pathId={} hops={} bridges={} chains={}",
                executionId, path.getId(), path.getHops().size(), path.getBridgeCount(), path.getChains());
        try {
            List<Hop> hops = path.getHops();
            for (int i = 0; i < hops.size(); i++) {
                Hop hop = hops.get(i);
                ExecutionStep step = new ExecutionStep(hop, clock.instant());
                steps.add(step);
                step.setStatus(StepStatus.EXECUTING);
                try {
                    current = hop.isBridge()
                            ? executeBridgeHop(hop, current, step, txHashes)
                            : executeSwapHop(hop, current, step, txHashes);
                    step.setStatus(StepStatus.COMPLETED);
                    metrics.hop(hop.getType().name(), "completed");
                    log.info("hop completed id={} index={} hop={} tx={} amountOut={}",
                            executionId, i, hop, step.getTxHash(), current);
                } catch (RuntimeException e) {
                    String error = messageOf(e);
                    step.setStatus(StepStatus.FAILED);
                    step.setError(error);
                    metrics.hop(hop.getType().name(), "failed");
                    int completed = countCompleted(steps);
                    log.error("hop failed id={} index={} hop={} hopsCompleted={} err={}",
                            executionId, i, hop, completed, error);

                    RecoveryOutcome recovery = null;
                    if (allowRecovery && props.isEnableEmergencyRecovery()) {
                        recovery = attemptRecovery(path, i, hop, current, error, txHashes);
                    }
                    return ExecutionResult.failure(path, clock.millis() - start, completed, error,
                            txHashes, snapshot(steps), recovery);
                }
            }
            BigInteger profit = current.subtract(path.firstHop().getAmountIn());
            long elapsed = clock.millis() - start;
            log.info("path execution completed id={} pathId={} profit={} elapsedMs={}",
                    executionId, path.getId(), profit, elapsed);
            return ExecutionResult.success(path, profit, elapsed, txHashes, snapshot(steps));
        } finally {
            activeExecutions.remove(executionId);
        }
    }

    private BigInteger executeSwapHop(Hop hop, BigInteger amountIn, ExecutionStep step, List<String> txHashes) {
        ChainAdapter adapter = adapters.get(hop.getChainId());
        if (adapter == null) {
            throw new IllegalStateException("Adapter not found for chain " + hop.getChainId());
        }
        BigInteger expectedOut = expectedAmountOut(hop, amountIn);
        BigInteger minAmountOut = expectedOut
                .multiply(BPS_DENOMINATOR.subtract(BigInteger.valueOf(props.getSlippageBps())))
                .divide(BPS_DENOMINATOR);
        long deadline = clock.instant().plus(props.getSwapDeadline()).getEpochSecond();
        String recipient = hasText(props.getRecipient()) ? props.getRecipient() : adapter.getAccountAddress();

        SwapParams params = new SwapParams(hop.getTokenIn(), hop.getTokenOut(), amountIn, minAmountOut, deadline, recipient);
        String txHash = adapter.executeSwap(params, hop.getPoolAddress());
        step.setTxHash(txHash);
        txHashes.add(txHash);

        if (!adapter.waitForTransaction(txHash, props.getSwapConfirmationTimeout())) {
            throw new ConfirmationTimeoutException("Transaction confirmation timeout: " + txHash);
        }
        return expectedOut;
    }

    private BigInteger executeBridgeHop(Hop hop, BigInteger amount, ExecutionStep step, List<String> txHashes) {
        if (hop.getToChainId() == null) {
            throw new IllegalStateException("Bridge info missing");
        }
        BridgeRoute route = bridges.selectBridge(hop.getChainId(), hop.getToChainId(), hop.getTokenIn(), amount);
        if (route == null) {
            throw new IllegalStateException("No bridge route available");
        }
        BridgeTransfer transfer = bridges.executeBridge(route);
        step.setTxHash(transfer.getTxHash());
        txHashes.add(transfer.getTxHash());
        log.info("bridge sent bridge={} plannedBridge={} from={} to={} amount={} fee={} estimatedSec={} plannedSec={} tx={}",
                route.getBridge(), hop.getBridgeName(), route.getFromChainId(), route.getToChainId(),
                amount, route.getEstimatedFee(), route.getEstimatedTimeSeconds(), hop.getEstimatedTimeSeconds(),
                transfer.getTxHash());

        boolean arrived;
        try {
            arrived = bridges.waitForBridge(transfer.getTxHash(), props.getBridgeTimeout());
        } catch (RuntimeException e) {
            log.warn("bridge wait failed tx={} err={}", transfer.getTxHash(), e.getMessage());
            arrived = false;
        }
        if (!arrived) {
            throw new BridgeTimeoutException("Bridge timeout: " + transfer.getTxHash());
        }
        return amount.subtract(route.getEstimatedFee());
    }

    private RecoveryOutcome attemptRecovery(CrossChainPath path, int failedIndex, Hop failedHop,
                                            BigInteger strandedAmount, String error, List<String> txHashes) {
        RecoveryContext ctx = new RecoveryContext(path, failedIndex, failedHop, failedHop.getChainId(),
                failedHop.getTokenIn(), strandedAmount, error, new ArrayList<>(txHashes));
        RecoveryDecision decision;
        try {
            decision = recoveryHook.decide(ctx);
        } catch (RuntimeException e) {
            log.error("recovery hook failed pathId={} err={}", path.getId(), e.getMessage(), e);
            decision = null;
        }
        if (decision == null) {
            decision = RecoveryDecision.hold("No recovery decision, funds held");
        }
        metrics.recoveryDecision(decision.getAction().name());
        log.warn("recovery decision action={} chainId={} token={} amount={} afterHops={} note={}",
                decision.getAction(), ctx.getStrandedChainId(), ctx.getStrandedToken(), strandedAmount,
                failedIndex, decision.getNote());

        if (decision.getAction() == RecoveryDecision.Action.HOLD) {
            return new RecoveryOutcome(RecoveryDecision.Action.HOLD, decision.getNote(),
                    ctx.getStrandedChainId(), ctx.getStrandedToken(), strandedAmount, null);
        }
        // 补偿路径只跑一次，失败不再嵌套恢复
        ExecutionResult compensation = execute(decision.getCompensationPath(), false);
        if (compensation.isSuccess()) {
            log.info("compensation path completed pathId={} txs={}", path.getId(), compensation.getTxHashes());
        } else {
            log.error("compensation path failed pathId={} hopsCompleted={} err={}",
                    path.getId(), compensation.getHopsCompleted(), compensation.getError());
        }
        return new RecoveryOutcome(RecoveryDecision.Action.COMPENSATE, decision.getNote(),
                ctx.getStrandedChainId(), ctx.getStrandedToken(), strandedAmount, compensation);
    }

    private ExecutionResult await(CrossChainPath path, Future<ExecutionResult> future, String rejection) {
        if (future == null) {
            return ExecutionResult.rejected(path, rejection);
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("path execution threw pathId={} err={}", path == null ? null : path.getId(), cause.getMessage());
            return ExecutionResult.rejected(path, messageOf(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ExecutionResult.rejected(path, "Interrupted while waiting for path execution");
        }
    }

    /**
     * 实际输入与寻路估算不同时，按比例缩放预期产出。
     */
    static BigInteger expectedAmountOut(Hop hop, BigInteger amountIn) {
        if (hop.getAmountIn().signum() == 0 || hop.getAmountIn().equals(amountIn)) {
            return hop.getAmountOut();
        }
        return hop.getAmountOut().multiply(amountIn).divide(hop.getAmountIn());
    }

    private static int countCompleted(List<ExecutionStep> steps) {
        int n = 0;
        for (ExecutionStep s : steps) {
            if (s.getStatus() == StepStatus.COMPLETED) {
                n++;
            }
        }
        return n;
    }

    private static List<ExecutionStep> snapshot(List<ExecutionStep> steps) {
        List<ExecutionStep> copy = new ArrayList<>(steps.size());
        for (ExecutionStep s : steps) {
            copy.add(s.snapshot());
        }
        return copy;
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static boolean hasText(String s) {
        return s != null && !s.trim().isEmpty();
    }
}
