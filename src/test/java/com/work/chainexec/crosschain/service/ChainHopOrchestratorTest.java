package com.work.chainexec.crosschain.service;

import com.work.chainexec.crosschain.adapter.ChainAdapter;
import com.work.chainexec.crosschain.adapter.SwapParams;
import com.work.chainexec.crosschain.bridge.BridgeManager;
import com.work.chainexec.crosschain.bridge.BridgeRoute;
import com.work.chainexec.crosschain.bridge.BridgeTransfer;
import com.work.chainexec.crosschain.config.CrossChainProperties;
import com.work.chainexec.crosschain.domain.CrossChainPath;
import com.work.chainexec.crosschain.domain.ExecutionResult;
import com.work.chainexec.crosschain.domain.Hop;
import com.work.chainexec.crosschain.domain.StepStatus;
import com.work.chainexec.crosschain.recovery.RecoveryContext;
import com.work.chainexec.crosschain.recovery.RecoveryDecision;
import com.work.chainexec.crosschain.recovery.RecoveryHook;
import com.work.chainexec.txmgr.support.metrics.TxMgrMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class ChainHopOrchestratorTest {

    private static final long ETH = 1L;
    private static final long ARB = 42161L;
    private static final String USDC = "0x00000000000000000000000000000000000000c1";
    private static final String WETH = "0x00000000000000000000000000000000000000c2";
    private static final String POOL = "0x00000000000000000000000000000000000000d1";
    private static final String ACCOUNT = "0x00000000000000000000000000000000000000a1";
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private ChainAdapter eth;
    private ChainAdapter arb;
    private BridgeManager bridges;
    private TxMgrMetrics metrics;
    private CrossChainProperties props;
    private ExecutorService executor;
    private List<Duration> sleeps;

    @BeforeEach
    public void setUp() {
        eth = adapter(ETH);
        arb = adapter(ARB);
        bridges = mock(BridgeManager.class);
        metrics = mock(TxMgrMetrics.class);
        props = new CrossChainProperties();
        props.setRetryBaseDelay(Duration.ofMillis(100));
        executor = Executors.newFixedThreadPool(2);
        sleeps = Collections.synchronizedList(new ArrayList<Duration>());
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    private static ChainAdapter adapter(long chainId) {
        ChainAdapter a = mock(ChainAdapter.class);
        when(a.getChainId()).thenReturn(chainId);
        when(a.getAccountAddress()).thenReturn(ACCOUNT);
        when(a.executeSwap(any(SwapParams.class), anyString())).thenReturn("0xswap" + chainId);
        when(a.waitForTransaction(anyString(), any(Duration.class))).thenReturn(true);
        return a;
    }

    private ChainHopOrchestrator orchestrator(RecoveryHook hook) {
        return new ChainHopOrchestrator(bridges, Arrays.asList(eth, arb), props, hook, metrics, executor,
                d -> sleeps.add(d), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void bridgeRoute(BigInteger fee, boolean arrives) {
        when(bridges.selectBridge(eq(ETH), eq(ARB), anyString(), any(BigInteger.class))).thenAnswer(inv ->
                new BridgeRoute("stargate", ETH, ARB, inv.getArgument(2), inv.getArgument(3), fee, 60));
        when(bridges.executeBridge(any(BridgeRoute.class))).thenAnswer(inv ->
                new BridgeTransfer("0xbridge", inv.getArgument(0)));
        when(bridges.waitForBridge(eq("0xbridge"), any(Duration.class))).thenReturn(arrives);
    }

    private static BigInteger n(long v) {
        return BigInteger.valueOf(v);
    }

    private static CrossChainPath swapBridgeSwap() {
        return new CrossChainPath("p1", Arrays.asList(
                Hop.swap(ETH, POOL, USDC, WETH, n(100_000), n(200_000)),
                Hop.bridge(ETH, ARB, WETH, n(200_000), "stargate", 60),
                Hop.swap(ARB, POOL, WETH, USDC, n(200_000), n(400_000))), null);
    }

    @Test
    public void amounts_flow_through_hops_and_bridge_fee_is_deducted() {
        bridgeRoute(n(5_000), true);

        ExecutionResult r = orchestrator(null).executePath(swapBridgeSwap());

        assertTrue(r.isSuccess(), r.getError());
        assertEquals(3, r.getHopsCompleted());
        assertEquals(Arrays.asList("0xswap1", "0xbridge", "0xswap42161"), r.getTxHashes());
        // 第三跳实际输入 195000，预期产出按比例缩放为 390000
        assertEquals(n(290_000), r.getActualProfit());

        ArgumentCaptor<SwapParams> captor = ArgumentCaptor.forClass(SwapParams.class);
        verify(arb).executeSwap(captor.capture(), eq(POOL));
        SwapParams last = captor.getValue();
        assertEquals(n(195_000), last.getAmountIn());
        assertEquals(n(388_050), last.getMinAmountOut());
        assertEquals(NOW.plus(Duration.ofMinutes(20)).getEpochSecond(), last.getDeadline());
        assertEquals(ACCOUNT, last.getRecipient());

        verify(bridges).selectBridge(ETH, ARB, WETH, n(200_000));
    }

    @Test
    public void configured_recipient_overrides_account_address() {
        props.setRecipient("0x00000000000000000000000000000000000000e1");

        orchestrator(null).executePath(CrossChainPath.of(Hop.swap(ETH, POOL, USDC, WETH, n(100), n(200))));

        ArgumentCaptor<SwapParams> captor = ArgumentCaptor.forClass(SwapParams.class);
        verify(eth).executeSwap(captor.capture(), eq(POOL));
        assertEquals("0x00000000000000000000000000000000000000e1", captor.getValue().getRecipient());
    }

    @Test
    public void bridge_timeout_reports_completed_hops_and_holds_funds() {
        bridgeRoute(n(5_000), false);

        ExecutionResult r = orchestrator(null).executePath(swapBridgeSwap());

        assertFalse(r.isSuccess());
        assertEquals(1, r.getHopsCompleted());
        assertEquals("Bridge timeout: 0xbridge", r.getError());
        assertEquals(Arrays.asList("0xswap1", "0xbridge"), r.getTxHashes());
        assertEquals(StepStatus.COMPLETED, r.getSteps().get(0).getStatus());
        assertEquals(StepStatus.FAILED, r.getSteps().get(1).getStatus());
        assertEquals(2, r.getSteps().size());

        assertNotNull(r.getRecovery());
        assertEquals(RecoveryDecision.Action.HOLD, r.getRecovery().getAction());
        assertEquals(ETH, r.getRecovery().getStrandedChainId());
        assertEquals(WETH, r.getRecovery().getStrandedToken());
        assertEquals(n(200_000), r.getRecovery().getStrandedAmount());
        verify(arb, never()).executeSwap(any(SwapParams.class), anyString());
        verify(metrics).recoveryDecision("HOLD");
    }

    @Test
    public void bridge_wait_exception_counts_as_timeout() {
        bridgeRoute(n(0), true);
        when(bridges.waitForBridge(eq("0xbridge"), any(Duration.class))).thenThrow(new RuntimeException("rpc down"));

        ExecutionResult r = orchestrator(null).executePath(swapBridgeSwap());

        assertFalse(r.isSuccess());
        assertEquals("Bridge timeout: 0xbridge", r.getError());
    }

    @Test
    public void missing_bridge_route_fails_hop() {
        when(bridges.selectBridge(anyLong(), anyLong(), anyString(), any(BigInteger.class))).thenReturn(null);

        ExecutionResult r = orchestrator(null).executePath(swapBridgeSwap());

        assertFalse(r.isSuccess());
        assertEquals(1, r.getHopsCompleted());
        assertEquals("No bridge route available", r.getError());
    }

    @Test
    public void compensating_decision_runs_compensation_path_once() {
        bridgeRoute(n(5_000), false);
        AtomicReference<RecoveryContext> seen = new AtomicReference<>();
        CrossChainPath back = new CrossChainPath("back", Collections.singletonList(
                Hop.swap(ETH, POOL, WETH, USDC, n(200_000), n(99_000))), null);
        RecoveryHook hook = ctx -> {
            seen.set(ctx);
            return RecoveryDecision.compensate(back, "swap back to USDC");
        };

        ExecutionResult r = orchestrator(hook).executePath(swapBridgeSwap());

        assertFalse(r.isSuccess());
        assertTrue(r.getRecovery().isCompensated());
        assertTrue(r.getRecovery().getCompensation().isSuccess());
        assertEquals(1, seen.get().getFailedHopIndex());
        assertEquals(Arrays.asList("0xswap1", "0xbridge"), seen.get().getTxHashes());
        verify(eth, times(2)).executeSwap(any(SwapParams.class), eq(POOL));
    }

    @Test
    public void failing_compensation_is_not_recovered_again() {
        bridgeRoute(n(5_000), false);
        CrossChainPath back = CrossChainPath.of(Hop.swap(999L, POOL, WETH, USDC, n(1), n(1)));
        RecoveryHook hook = mock(RecoveryHook.class);
        when(hook.decide(any(RecoveryContext.class))).thenReturn(RecoveryDecision.compensate(back, "back"));

        ExecutionResult r = orchestrator(hook).executePath(swapBridgeSwap());

        ExecutionResult compensation = r.getRecovery().getCompensation();
        assertFalse(compensation.isSuccess());
        assertEquals("Adapter not found for chain 999", compensation.getError());
        assertNull(compensation.getRecovery());
        verify(hook, times(1)).decide(any(RecoveryContext.class));
    }

    @Test
    public void throwing_hook_falls_back_to_hold() {
        bridgeRoute(n(5_000), false);
        RecoveryHook hook = ctx -> {
            throw new IllegalStateException("hook bug");
        };

        ExecutionResult r = orchestrator(hook).executePath(swapBridgeSwap());

        assertEquals(RecoveryDecision.Action.HOLD, r.getRecovery().getAction());
    }

    @Test
    public void recovery_disabled_leaves_no_outcome() {
        props.setEnableEmergencyRecovery(false);
        bridgeRoute(n(5_000), false);

        ExecutionResult r = orchestrator(null).executePath(swapBridgeSwap());

        assertFalse(r.isSuccess());
        assertNull(r.getRecovery());
    }

    @Test
    public void swap_confirmation_timeout_fails_first_hop() {
        when(eth.waitForTransaction(eq("0xswap1"), any(Duration.class))).thenReturn(false);

        ExecutionResult r = orchestrator(null).executePath(swapBridgeSwap());

        assertFalse(r.isSuccess());
        assertEquals(0, r.getHopsCompleted());
        assertEquals("Transaction confirmation timeout: 0xswap1", r.getError());
        assertEquals(Collections.singletonList("0xswap1"), r.getTxHashes());
        verify(bridges, never()).selectBridge(anyLong(), anyLong(), anyString(), any(BigInteger.class));
    }

    @Test
    public void unknown_chain_fails_without_sending() {
        ExecutionResult r = orchestrator(null).executePath(
                CrossChainPath.of(Hop.swap(7L, POOL, USDC, WETH, n(10), n(20))));

        assertFalse(r.isSuccess());
        assertEquals("Adapter not found for chain 7", r.getError());
        assertTrue(r.getTxHashes().isEmpty());
    }

    @Test
    public void multiple_paths_keep_order_and_never_throw() {
        when(eth.executeSwap(any(SwapParams.class), eq("0xbad"))).thenThrow(new RuntimeException("swap reverted"));
        CrossChainPath ok1 = new CrossChainPath("ok1", Collections.singletonList(
                Hop.swap(ETH, POOL, USDC, WETH, n(10), n(20))), null);
        CrossChainPath bad = new CrossChainPath("bad", Collections.singletonList(
                Hop.swap(ETH, "0xbad", USDC, WETH, n(10), n(20))), null);
        CrossChainPath ok2 = new CrossChainPath("ok2", Collections.singletonList(
                Hop.swap(ARB, POOL, USDC, WETH, n(10), n(30))), null);
        props.setMaxConcurrentPaths(2);

        List<ExecutionResult> results = orchestrator(null).executeMultiplePaths(Arrays.asList(ok1, bad, null, ok2));

        assertEquals(4, results.size());
        assertTrue(results.get(0).isSuccess());
        assertEquals("ok1", results.get(0).getPath().getId());
        assertFalse(results.get(1).isSuccess());
        assertEquals("swap reverted", results.get(1).getError());
        assertFalse(results.get(2).isSuccess());
        assertNull(results.get(2).getPath());
        assertTrue(results.get(3).isSuccess());
        assertEquals(n(20), results.get(3).getActualProfit());
    }

    @Test
    public void empty_path_list_returns_empty_results() {
        assertTrue(orchestrator(null).executeMultiplePaths(Collections.<CrossChainPath>emptyList()).isEmpty());
        assertTrue(orchestrator(null).executeMultiplePaths(null).isEmpty());
    }

    @Test
    public void retry_backs_off_exponentially_and_returns_last_failure() {
        props.setRetryAttempts(3);
        when(eth.waitForTransaction(anyString(), any(Duration.class))).thenReturn(false);

        ExecutionResult r = orchestrator(null).executeWithRetry(
                CrossChainPath.of(Hop.swap(ETH, POOL, USDC, WETH, n(10), n(20))));

        assertFalse(r.isSuccess());
        assertEquals(Arrays.asList(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
        verify(eth, times(3)).executeSwap(any(SwapParams.class), eq(POOL));
    }

    @Test
    public void retry_stops_after_first_success() {
        props.setRetryAttempts(3);
        when(eth.waitForTransaction(anyString(), any(Duration.class))).thenReturn(false, true);

        ExecutionResult r = orchestrator(null).executeWithRetry(
                CrossChainPath.of(Hop.swap(ETH, POOL, USDC, WETH, n(10), n(20))));

        assertTrue(r.isSuccess());
        assertEquals(Collections.singletonList(Duration.ofMillis(100)), sleeps);
    }

    @Test
    public void no_active_executions_after_completion() {
        ChainHopOrchestrator o = orchestrator(null);
        o.executePath(CrossChainPath.of(Hop.swap(ETH, POOL, USDC, WETH, n(10), n(20))));

        assertTrue(o.getActiveExecutions().isEmpty());
        assertFalse(o.isBusy());
        assertEquals(3, o.getStats().getMaxConcurrentPaths());
    }

    @Test
    public void invalid_slippage_is_rejected_at_construction() {
        props.setSlippageBps(10_000);
        assertThrows(IllegalArgumentException.class, () -> orchestrator(null));
    }

    @Test
    public void expected_output_scales_with_actual_input() {
        Hop hop = Hop.swap(ETH, POOL, USDC, WETH, n(1000), n(3000));
        assertEquals(n(3000), ChainHopOrchestrator.expectedAmountOut(hop, n(1000)));
        assertEquals(n(1500), ChainHopOrchestrator.expectedAmountOut(hop, n(500)));
    }
}
