package com.work.chainexec.crosschain.adapter;

import com.work.chainexec.core.chain.ChainRpcClient;
import com.work.chainexec.core.chain.TxReceipt;
import com.work.chainexec.core.exception.FatalSubmissionException;
import com.work.chainexec.core.exception.TransientSubmissionException;
import com.work.chainexec.txmgr.domain.TransactionMetadata;
import com.work.chainexec.txmgr.domain.TxId;
import com.work.chainexec.txmgr.domain.TxState;
import com.work.chainexec.txmgr.service.SubmissionPipeline;
import com.work.chainexec.txmgr.service.TransactionOptions;
import com.work.chainexec.txmgr.service.TransactionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class PipelineChainAdapterTest {

    private static final String POOL = "0x7a250d5630b4cf539739df2c5dacb4c659f2488d";
    private static final String TOKEN_A = "0x00000000000000000000000000000000000000a1";
    private static final String TOKEN_B = "0x00000000000000000000000000000000000000b1";
    private static final String RECIPIENT = "0x00000000000000000000000000000000000000c1";

    private SubmissionPipeline pipeline;
    private ChainRpcClient chain;
    private PipelineChainAdapter adapter;

    @BeforeEach
    public void setUp() {
        pipeline = mock(SubmissionPipeline.class);
        chain = mock(ChainRpcClient.class);
        when(pipeline.getChain()).thenReturn(chain);
        when(pipeline.getSignerAddress()).thenReturn(RECIPIENT);
        adapter = new PipelineChainAdapter(pipeline, 137L);
    }

    private static SwapParams params() {
        return new SwapParams(TOKEN_A, TOKEN_B, BigInteger.valueOf(1000), BigInteger.valueOf(990),
                1_700_000_000L, RECIPIENT);
    }

    private static TransactionMetadata metadata(TxState state, String hash) {
        TransactionMetadata m = new TransactionMetadata(new TxId(0, 0));
        m.setState(state);
        m.setHash(hash);
        return m;
    }

    @Test
    public void encodes_swap_exact_tokens_for_tokens() {
        String data = PipelineChainAdapter.encodeSwap(params());

        assertTrue(data.startsWith("0x38ed1739"));
        // selector + 5 个头部字 + 数组长度 + 2 个地址
        assertEquals(2 + 8 + 64 * 8, data.length());
    }

    @Test
    public void confirmed_swap_returns_hash_and_passes_deadline() {
        when(pipeline.executeTransaction(eq(POOL), anyString(), any(TransactionOptions.class)))
                .thenReturn(TransactionResult.success(metadata(TxState.CONFIRMED, "0xh1"),
                        new TxReceipt("0xh1", 5L, "0xb", true, BigInteger.ONE)));

        assertEquals("0xh1", adapter.executeSwap(params(), POOL));

        ArgumentCaptor<TransactionOptions> captor = ArgumentCaptor.forClass(TransactionOptions.class);
        verify(pipeline).executeTransaction(eq(POOL), anyString(), captor.capture());
        assertEquals(Instant.ofEpochSecond(1_700_000_000L), captor.getValue().getDeadline());
    }

    @Test
    public void unconfirmed_broadcast_still_returns_hash() {
        when(pipeline.executeTransaction(eq(POOL), anyString(), any(TransactionOptions.class)))
                .thenReturn(TransactionResult.failure(metadata(TxState.TIMEOUT, "0xh2"), "timeout"));

        assertEquals("0xh2", adapter.executeSwap(params(), POOL));
    }

    @Test
    public void never_sent_failure_is_fatal() {
        when(pipeline.executeTransaction(eq(POOL), anyString(), any(TransactionOptions.class)))
                .thenReturn(TransactionResult.failure(metadata(TxState.FAILED, null), "Gas spike detected: too high"));

        FatalSubmissionException e = assertThrows(FatalSubmissionException.class,
                () -> adapter.executeSwap(params(), POOL));
        assertTrue(e.getMessage().contains("Gas spike detected"));
    }

    @Test
    public void sent_but_failed_swap_is_transient() {
        when(pipeline.executeTransaction(eq(POOL), anyString(), any(TransactionOptions.class)))
                .thenReturn(TransactionResult.failure(metadata(TxState.FAILED, "0xh3"), "Transaction reverted on-chain: 0xh3"));

        assertThrows(TransientSubmissionException.class, () -> adapter.executeSwap(params(), POOL));
    }

    @Test
    public void wait_checks_existing_receipt_before_polling() {
        when(chain.getTransactionReceipt("0xh1")).thenReturn(new TxReceipt("0xh1", 5L, "0xb", true, BigInteger.ONE));

        assertTrue(adapter.waitForTransaction("0xh1", Duration.ofSeconds(1)));
        verify(chain, never()).waitForTransaction(anyString(), anyInt(), any(Duration.class));
    }

    @Test
    public void wait_reports_reverted_or_missing_receipt_as_false() {
        when(chain.waitForTransaction(eq("0xh4"), anyInt(), any(Duration.class)))
                .thenReturn(new TxReceipt("0xh4", 5L, "0xb", false, BigInteger.ONE));

        assertFalse(adapter.waitForTransaction("0xh4", Duration.ofSeconds(1)));
        assertFalse(adapter.waitForTransaction("0xh5", Duration.ofSeconds(1)));
        assertEquals(RECIPIENT, adapter.getAccountAddress());
        assertEquals(137L, adapter.getChainId());
    }
}
