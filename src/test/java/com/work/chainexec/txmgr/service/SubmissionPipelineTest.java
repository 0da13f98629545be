package com.work.chainexec.txmgr.service;

import com.work.chainexec.core.chain.ChainBlockTag;
import com.work.chainexec.core.chain.ChainRpcClient;
import com.work.chainexec.core.chain.PendingTransaction;
import com.work.chainexec.core.chain.TransactionSigner;
import com.work.chainexec.core.chain.TxReceipt;
import com.work.chainexec.core.chain.TxRequest;
import com.work.chainexec.core.exception.ChainRpcException;
import com.work.chainexec.core.nonce.NonceAllocator;
import com.work.chainexec.core.support.Sleeper;
import com.work.chainexec.txmgr.config.TxMgrProperties;
import com.work.chainexec.txmgr.domain.TransactionMetadata;
import com.work.chainexec.txmgr.domain.TxState;
import com.work.chainexec.txmgr.service.gas.GasSpikeGuard;
import com.work.chainexec.txmgr.support.metrics.TxMgrMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class SubmissionPipelineTest {

    private static final String FROM = "0x00000000000000000000000000000000000000f1";
    private static final String TO = "0x00000000000000000000000000000000000000b2";
    private static final BigInteger GWEI = BigInteger.TEN.pow(9);

    private ChainRpcClient chain;
    private TransactionSigner signer;
    private NonceAllocator allocator;
    private TxMgrProperties props;
    private TxMgrMetrics metrics;
    private List<Duration> sleeps;

    @BeforeEach
    public void setUp() {
        chain = mock(ChainRpcClient.class);
        when(chain.getChainId()).thenReturn(1L);
        when(chain.getGasPrice()).thenReturn(GWEI.multiply(BigInteger.valueOf(20)));
        when(chain.getTransactionCount(anyString(), any(ChainBlockTag.class))).thenReturn(0L);

        signer = mock(TransactionSigner.class);
        when(signer.getAddress()).thenReturn(FROM);
        when(signer.sign(any(TxRequest.class), anyLong())).thenReturn("0xsigned");

        allocator = new NonceAllocator(chain, FROM, Runnable::run);
        metrics = mock(TxMgrMetrics.class);
        sleeps = new ArrayList<>();

        props = new TxMgrProperties();
        props.setInitialDelay(Duration.ofMillis(1));
        props.setMaxDelay(Duration.ofMillis(5));
        props.setBackoffMultiplier(2.0);
        props.setConfirmationTimeout(Duration.ofSeconds(1));
    }

    private SubmissionPipeline pipeline() {
        Sleeper recording = d -> sleeps.add(d);
        return new SubmissionPipeline(chain, signer, allocator, new TxRegistry(100),
                new GasSpikeGuard(chain, props, Clock.systemUTC()), props, metrics, recording, Clock.systemUTC());
    }

    private static TxReceipt receipt(String hash, boolean success) {
        return new TxReceipt(hash, 10L, "0xblock", success, BigInteger.valueOf(21_000));
    }

    @Test
    public void transient_error_then_success_confirms_on_second_attempt() {
        props.setMaxRetries(1);
        when(chain.sendRawTransaction(anyString()))
                .thenThrow(new RuntimeException("Network error"))
                .thenReturn("0xh1");
        when(chain.waitForTransaction(eq("0xh1"), anyInt(), any(Duration.class))).thenReturn(receipt("0xh1", true));

        TransactionResult r = pipeline().executeTransaction(TO, "0x", TransactionOptions.defaults());

        assertTrue(r.isSuccess());
        assertEquals(2, r.getMetadata().getAttempts());
        assertEquals(TxState.CONFIRMED, r.getMetadata().getState());
        verify(chain, times(2)).sendRawTransaction(anyString());
        // 同一笔逻辑交易的重试沿用同一个 nonce
        verify(signer, times(2)).sign(any(TxRequest.class), eq(0L));
    }

    @Test
    public void fatal_error_stops_after_one_send() {
        props.setMaxRetries(3);
        when(chain.sendRawTransaction(anyString()))
                .thenThrow(new RuntimeException("insufficient funds for gas * price + value"));

        TransactionResult r = pipeline().executeTransaction(TO, "0x", TransactionOptions.defaults());

        assertFalse(r.isSuccess());
        assertEquals(TxState.FAILED, r.getMetadata().getState());
        assertTrue(r.getError().contains("insufficient funds"));
        verify(chain, times(1)).sendRawTransaction(anyString());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    public void never_sends_more_than_max_retries_plus_one() {
        props.setMaxRetries(3);
        when(chain.sendRawTransaction(anyString())).thenThrow(new RuntimeException("Network error"));

        TransactionResult r = pipeline().executeTransaction(TO, "0x", TransactionOptions.defaults());

        assertFalse(r.isSuccess());
        assertEquals(4, r.getMetadata().getAttempts());
        verify(chain, times(4)).sendRawTransaction(anyString());
        assertEquals(Arrays.asList(Duration.ofMillis(1), Duration.ofMillis(2), Duration.ofMillis(4)), sleeps);
        verify(metrics, times(3)).retry(anyInt(), eq("TRANSIENT"));
    }

    @Test
    public void backoff_is_capped_by_max_delay() {
        props.setMaxRetries(4);
        props.setMaxDelay(Duration.ofMillis(3));
        when(chain.sendRawTransaction(anyString())).thenThrow(new RuntimeException("Network error"));

        pipeline().executeTransaction(TO, "0x", TransactionOptions.defaults());

        assertEquals(Arrays.asList(Duration.ofMillis(1), Duration.ofMillis(2), Duration.ofMillis(3), Duration.ofMillis(3)),
                sleeps);
    }

    @Test
    public void legacy_gas_price_escalates_by_increment_each_retry() {
        props.setMaxRetries(3);
        when(chain.sendRawTransaction(anyString())).thenThrow(new RuntimeException("Network error"));

        pipeline().executeTransaction(TO, "0x", TransactionOptions.defaults().gasPrice(BigInteger.valueOf(1000)));

        ArgumentCaptor<TxRequest> captor = ArgumentCaptor.forClass(TxRequest.class);
        verify(signer, times(4)).sign(captor.capture(), eq(0L));
        List<BigInteger> prices = new ArrayList<>();
        for (TxRequest req : captor.getAllValues()) {
            prices.add(req.getGasPrice());
        }
        assertEquals(Arrays.asList(BigInteger.valueOf(1000), BigInteger.valueOf(1100),
                BigInteger.valueOf(1210), BigInteger.valueOf(1331)), prices);
    }

    @Test
    public void eip1559_fee_fields_escalate_together() {
        props.setMaxRetries(1);
        when(chain.sendRawTransaction(anyString())).thenThrow(new RuntimeException("Network error"));

        pipeline().executeTransaction(TO, "0x", TransactionOptions.defaults()
                .eip1559(BigInteger.valueOf(2000), BigInteger.valueOf(100)));

        ArgumentCaptor<TxRequest> captor = ArgumentCaptor.forClass(TxRequest.class);
        verify(signer, times(2)).sign(captor.capture(), eq(0L));
        TxRequest second = captor.getAllValues().get(1);
        assertTrue(second.isEip1559());
        assertEquals(BigInteger.valueOf(2200), second.getMaxFeePerGas());
        assertEquals(BigInteger.valueOf(110), second.getMaxPriorityFeePerGas());
    }

    @Test
    public void gas_ceiling_rejects_before_any_send_or_nonce() {
        when(chain.getGasPrice()).thenReturn(GWEI.multiply(BigInteger.valueOf(600)));
        props.setMaxGasPriceGwei(500);

        TransactionResult r = pipeline().executeTransaction(TO, "0x", TransactionOptions.defaults());

        assertFalse(r.isSuccess());
        assertTrue(r.getError().contains("Gas spike detected"));
        assertEquals(0, r.getMetadata().getAttempts());
        assertNull(r.getMetadata().getNonce());
        verify(chain, never()).sendRawTransaction(anyString());
        verify(chain, never()).getTransactionCount(anyString(), any(ChainBlockTag.class));
        verify(metrics, times(1)).gasSpikeRejected(anyString());
    }

    @Test
    public void nonce_error_before_broadcast_resyncs_and_allocates_fresh_nonce() {
        props.setMaxRetries(2);
        when(chain.getTransactionCount(eq(FROM), eq(ChainBlockTag.LATEST))).thenReturn(0L, 3L);
        when(chain.getTransactionCount(eq(FROM), eq(ChainBlockTag.PENDING))).thenReturn(0L);
        when(chain.sendRawTransaction(anyString()))
                .thenThrow(ChainRpcException.classified("nonce too low: next nonce 3, tx nonce 0"))
                .thenReturn("0xh1");
        when(chain.waitForTransaction(eq("0xh1"), anyInt(), any(Duration.class))).thenReturn(receipt("0xh1", true));

        TransactionResult r = pipeline().executeTransaction(TO, "0x", TransactionOptions.defaults());

        assertTrue(r.isSuccess());
        assertEquals(Long.valueOf(3L), r.getMetadata().getNonce());
        verify(signer).sign(any(TxRequest.class), eq(0L));
        verify(signer).sign(any(TxRequest.class), eq(3L));
        verify(metrics).nonceResync(FROM);
    }

    @Test
    public void confirmation_timeout_on_every_attempt_ends_in_timeout_state() {
        props.setMaxRetries(1);
        when(chain.sendRawTransaction(anyString())).thenReturn("0xh1", "0xh2");
        when(chain.waitForTransaction(anyString(), anyInt(), any(Duration.class))).thenReturn(null);

        SubmissionPipeline p = pipeline();
        TransactionResult r = p.executeTransaction(TO, "0x", TransactionOptions.defaults());

        assertFalse(r.isSuccess());
        assertEquals(TxState.TIMEOUT, r.getMetadata().getState());
        assertEquals("0xh2", r.getMetadata().getHash());
        verify(chain, times(2)).sendRawTransaction(anyString());
        verify(signer, times(2)).sign(any(TxRequest.class), eq(0L));
        assertEquals(1L, p.getStatistics().getTimeoutTransactions());
    }

    @Test
    public void earlier_broadcast_mined_during_backoff_is_not_resent() {
        props.setMaxRetries(2);
        when(chain.sendRawTransaction(anyString())).thenReturn("0xh1");
        when(chain.waitForTransaction(anyString(), anyInt(), any(Duration.class))).thenReturn(null);
        when(chain.getTransactionReceipt("0xh1")).thenReturn(receipt("0xh1", true));

        TransactionResult r = pipeline().executeTransaction(TO, "0x", TransactionOptions.defaults());

        assertTrue(r.isSuccess());
        assertEquals("0xh1", r.getMetadata().getHash());
        verify(chain, times(1)).sendRawTransaction(anyString());
    }

    @Test
    public void reverted_receipt_is_terminal_failure() {
        props.setMaxRetries(3);
        when(chain.sendRawTransaction(anyString())).thenReturn("0xh1");
        when(chain.waitForTransaction(eq("0xh1"), anyInt(), any(Duration.class))).thenReturn(receipt("0xh1", false));

        TransactionResult r = pipeline().executeTransaction(TO, "0x", TransactionOptions.defaults());

        assertFalse(r.isSuccess());
        assertEquals(TxState.FAILED, r.getMetadata().getState());
        assertTrue(r.getError().contains("reverted"));
        verify(chain, times(1)).sendRawTransaction(anyString());
    }

    @Test
    public void expired_deadline_fails_without_sending_or_backing_off() {
        props.setMaxRetries(3);

        TransactionResult r = pipeline().executeTransaction(TO, "0x",
                TransactionOptions.defaults().deadline(Instant.now().minusSeconds(5)));

        assertFalse(r.isSuccess());
        assertTrue(r.getError().contains("deadline"));
        assertEquals(TxState.TIMEOUT, r.getMetadata().getState());
        assertEquals(0, r.getMetadata().getAttempts());
        assertTrue(sleeps.isEmpty());
        verify(chain, never()).sendRawTransaction(anyString());
        verify(chain, never()).getTransactionCount(anyString(), any(ChainBlockTag.class));
        verify(metrics, never()).retry(anyInt(), anyString());
    }

    @Test
    public void fatal_send_rejection_does_not_leave_nonce_gap() {
        props.setMaxRetries(3);
        when(chain.sendRawTransaction(anyString()))
                .thenThrow(new RuntimeException("insufficient funds for gas * price + value"))
                .thenReturn("0xh2");
        when(chain.waitForTransaction(eq("0xh2"), anyInt(), any(Duration.class))).thenReturn(receipt("0xh2", true));

        SubmissionPipeline p = pipeline();
        TransactionResult first = p.executeTransaction(TO, "0x", TransactionOptions.defaults());
        TransactionResult second = p.executeTransaction(TO, "0x", TransactionOptions.defaults());

        assertEquals(TxState.FAILED, first.getMetadata().getState());
        assertTrue(second.isSuccess());
        // 链上从未见过 nonce 0，第二笔必须补上它
        assertEquals(Long.valueOf(0L), second.getMetadata().getNonce());
        verify(signer, times(2)).sign(any(TxRequest.class), eq(0L));
        verify(signer, never()).sign(any(TxRequest.class), eq(1L));
    }

    @Test
    public void exhausted_transient_send_errors_hand_nonce_back() {
        props.setMaxRetries(2);
        when(chain.sendRawTransaction(anyString())).thenThrow(new RuntimeException("Network error"));

        TransactionResult r = pipeline().executeTransaction(TO, "0x", TransactionOptions.defaults());

        assertEquals(TxState.FAILED, r.getMetadata().getState());
        assertEquals(0L, allocator.peekNextNonce());
    }

    @Test
    public void caller_supplied_nonce_does_not_trigger_resync() {
        props.setMaxRetries(0);
        when(chain.sendRawTransaction(anyString()))
                .thenThrow(new RuntimeException("insufficient funds for gas * price + value"));

        pipeline().executeTransaction(TO, "0x", TransactionOptions.defaults().nonce(5L));

        verify(chain, never()).getTransactionCount(anyString(), any(ChainBlockTag.class));
    }

    @Test
    public void malformed_recipient_is_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> pipeline().executeTransaction("not-an-address", "0x", TransactionOptions.defaults()));
        verify(chain, never()).sendRawTransaction(anyString());
    }

    @Test
    public void replace_uses_same_nonce_and_at_least_ten_percent_more_gas() {
        props.setMaxRetries(0);
        when(chain.sendRawTransaction(anyString())).thenReturn("0xh1", "0xh2");
        when(chain.waitForTransaction(eq("0xh1"), anyInt(), any(Duration.class))).thenReturn(null);
        when(chain.waitForTransaction(eq("0xh2"), anyInt(), any(Duration.class))).thenReturn(receipt("0xh2", true));

        SubmissionPipeline p = pipeline();
        TransactionResult first = p.executeTransaction(TO, "0x", TransactionOptions.defaults().gasPrice(BigInteger.valueOf(1000)));
        assertEquals(TxState.TIMEOUT, first.getMetadata().getState());

        when(chain.getTransaction("0xh1")).thenReturn(new PendingTransaction("0xh1", FROM, TO, "0x",
                BigInteger.ZERO, BigInteger.valueOf(21_000), BigInteger.valueOf(1000), 0L, null));

        TransactionResult replaced = p.replaceTransaction(first.getMetadata().getId(), BigInteger.valueOf(1050));

        assertTrue(replaced.isSuccess());
        assertEquals(first.getMetadata().getId(), replaced.getMetadata().getReplaces());
        assertEquals(BigInteger.valueOf(1100), replaced.getMetadata().getGasPrice());

        ArgumentCaptor<TxRequest> captor = ArgumentCaptor.forClass(TxRequest.class);
        verify(signer, times(2)).sign(captor.capture(), eq(0L));
        assertEquals(BigInteger.valueOf(1100), captor.getAllValues().get(1).getGasPrice());

        TransactionMetadata original = p.getTransactionStatus(first.getMetadata().getId());
        assertEquals(TxState.REPLACED, original.getState());
        assertEquals("0xh2", original.getReplacedBy());
        assertEquals(1L, p.getStatistics().getReplacedTransactions());
    }

    @Test
    public void replace_of_already_mined_transaction_does_not_resend() {
        props.setMaxRetries(0);
        when(chain.sendRawTransaction(anyString())).thenReturn("0xh1");
        when(chain.waitForTransaction(anyString(), anyInt(), any(Duration.class))).thenReturn(null);

        SubmissionPipeline p = pipeline();
        TransactionResult first = p.executeTransaction(TO, "0x", TransactionOptions.defaults());

        when(chain.getTransaction("0xh1")).thenReturn(new PendingTransaction("0xh1", FROM, TO, "0x",
                BigInteger.ZERO, BigInteger.valueOf(21_000), BigInteger.valueOf(1000), 0L, 12L));
        when(chain.getTransactionReceipt("0xh1")).thenReturn(receipt("0xh1", true));

        TransactionResult r = p.replaceTransaction(first.getMetadata().getId(), BigInteger.valueOf(5000));

        assertTrue(r.isSuccess());
        assertEquals("0xh1", r.getMetadata().getHash());
        verify(chain, times(1)).sendRawTransaction(anyString());
    }

    @Test
    public void replace_of_unknown_id_returns_failure() {
        TransactionResult r = pipeline().replaceTransaction("tx-99-0", BigInteger.ONE);

        assertFalse(r.isSuccess());
        assertNull(r.getMetadata());
        assertTrue(r.getError().contains("not found"));
        assertNull(pipeline().getTransactionStatus("garbage"));
    }

    @Test
    public void statistics_track_outcomes() {
        props.setMaxRetries(1);
        when(chain.sendRawTransaction(anyString()))
                .thenThrow(new RuntimeException("Network error"))
                .thenReturn("0xh1")
                .thenThrow(new RuntimeException("execution reverted"));
        when(chain.waitForTransaction(eq("0xh1"), anyInt(), any(Duration.class))).thenReturn(receipt("0xh1", true));

        SubmissionPipeline p = pipeline();
        assertTrue(p.executeTransaction(TO, "0x", TransactionOptions.defaults()).isSuccess());
        assertFalse(p.executeTransaction(TO, "0x", TransactionOptions.defaults()).isSuccess());

        SubmissionStatistics s = p.getStatistics();
        assertEquals(2L, s.getTotalTransactions());
        assertEquals(1L, s.getSuccessfulTransactions());
        assertEquals(1L, s.getFailedTransactions());
        assertEquals(1L, s.getRetriedTransactions());
        assertEquals(BigInteger.valueOf(21_000), s.getTotalGasUsed());
        assertEquals(50.0, s.getSuccessRate(), 0.001);
    }
}
