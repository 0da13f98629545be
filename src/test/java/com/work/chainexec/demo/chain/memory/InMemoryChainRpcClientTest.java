package com.work.chainexec.demo.chain.memory;

import com.work.chainexec.core.chain.ChainBlockTag;
import com.work.chainexec.core.chain.TxRequest;
import com.work.chainexec.core.exception.ChainRpcException;
import com.work.chainexec.core.exception.RpcErrorKind;
import com.work.chainexec.core.nonce.NonceAllocator;
import com.work.chainexec.demo.chain.web3j.CredentialsTransactionSigner;
import com.work.chainexec.txmgr.config.TxMgrProperties;
import com.work.chainexec.txmgr.domain.TxState;
import com.work.chainexec.txmgr.service.SubmissionPipeline;
import com.work.chainexec.txmgr.service.TransactionOptions;
import com.work.chainexec.txmgr.service.TransactionResult;
import com.work.chainexec.txmgr.service.TxRegistry;
import com.work.chainexec.txmgr.service.gas.GasSpikeGuard;
import com.work.chainexec.txmgr.support.metrics.NoopTxMgrMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 真实签名 + 进程内链的端到端用例。
 */
public class InMemoryChainRpcClientTest {

    // anvil 默认账户 #0
    private static final String KEY = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";
    private static final String TO = "0x70997970c51812dc3a010c7d01b50e0d17dc79c8";
    private static final BigInteger GWEI = BigInteger.TEN.pow(9);

    private InMemoryChainRpcClient chain;
    private CredentialsTransactionSigner signer;
    private TxMgrProperties props;

    @BeforeEach
    public void setUp() {
        chain = new InMemoryChainRpcClient(31337L, GWEI.multiply(BigInteger.valueOf(20)));
        signer = new CredentialsTransactionSigner(Credentials.create(KEY), 31337L);
        props = new TxMgrProperties();
        props.setMaxRetries(0);
        props.setConfirmationTimeout(Duration.ofMillis(50));
    }

    private SubmissionPipeline pipeline() {
        NonceAllocator allocator = new NonceAllocator(chain, signer.getAddress(), Runnable::run);
        return new SubmissionPipeline(chain, signer, allocator, new TxRegistry(16),
                new GasSpikeGuard(chain, props, Clock.systemUTC()), props, new NoopTxMgrMetrics(),
                d -> { }, Clock.systemUTC());
    }

    private TxRequest legacy(BigInteger gasPrice) {
        return TxRequest.builder().to(TO).gasLimit(BigInteger.valueOf(21_000)).gasPrice(gasPrice).build();
    }

    @Test
    public void signer_address_matches_key() {
        assertEquals("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266", signer.getAddress().toLowerCase());
    }

    @Test
    public void pipeline_confirms_sequential_transactions_with_consecutive_nonces() {
        SubmissionPipeline p = pipeline();

        TransactionResult first = p.executeTransaction(TO, "0x", TransactionOptions.defaults());
        TransactionResult second = p.executeTransaction(TO, "0x", TransactionOptions.defaults());

        assertTrue(first.isSuccess(), first.getError());
        assertTrue(second.isSuccess(), second.getError());
        assertEquals(Long.valueOf(0L), first.getMetadata().getNonce());
        assertEquals(Long.valueOf(1L), second.getMetadata().getNonce());
        assertEquals(2L, chain.getTransactionCount(signer.getAddress(), ChainBlockTag.LATEST));
        assertEquals(2L, chain.getLatestBlockNumber());
    }

    @Test
    public void stuck_transaction_is_replaced_with_same_nonce() {
        chain.setAutoMine(false);
        SubmissionPipeline p = pipeline();

        TransactionResult stuck = p.executeTransaction(TO, "0x",
                TransactionOptions.defaults().gasPrice(GWEI.multiply(BigInteger.TEN)));
        assertEquals(TxState.TIMEOUT, stuck.getMetadata().getState());
        assertEquals(1L, chain.getTransactionCount(signer.getAddress(), ChainBlockTag.PENDING));

        chain.setAutoMine(true);
        TransactionResult replaced = p.replaceTransaction(stuck.getMetadata().getId(), null);

        assertTrue(replaced.isSuccess(), replaced.getError());
        assertEquals(GWEI.multiply(BigInteger.valueOf(11)), replaced.getMetadata().getGasPrice());
        assertEquals(Long.valueOf(0L), replaced.getMetadata().getNonce());
        assertEquals(TxState.REPLACED, p.getTransactionStatus(stuck.getMetadata().getId()).getState());
        assertEquals(1L, chain.getTransactionCount(signer.getAddress(), ChainBlockTag.LATEST));
    }

    @Test
    public void underpriced_replacement_is_rejected_as_nonce_error() {
        chain.setAutoMine(false);
        chain.sendRawTransaction(signer.sign(legacy(GWEI.multiply(BigInteger.TEN)), 0));

        ChainRpcException e = assertThrows(ChainRpcException.class,
                () -> chain.sendRawTransaction(signer.sign(legacy(GWEI.multiply(BigInteger.valueOf(105)).divide(BigInteger.TEN)), 0)));
        assertEquals(RpcErrorKind.NONCE, e.getKind());
    }

    @Test
    public void stale_nonce_is_rejected_after_mining() {
        chain.sendRawTransaction(signer.sign(legacy(GWEI), 0));

        ChainRpcException e = assertThrows(ChainRpcException.class,
                () -> chain.sendRawTransaction(signer.sign(legacy(GWEI.multiply(BigInteger.TEN)), 0)));
        assertEquals(RpcErrorKind.NONCE, e.getKind());
        assertTrue(e.getMessage().contains("nonce too low"));
    }

    @Test
    public void pending_count_only_counts_contiguous_nonces() {
        chain.setAutoMine(false);
        chain.sendRawTransaction(signer.sign(legacy(GWEI), 0));
        chain.sendRawTransaction(signer.sign(legacy(GWEI), 2));

        assertEquals(0L, chain.getTransactionCount(signer.getAddress(), ChainBlockTag.LATEST));
        assertEquals(1L, chain.getTransactionCount(signer.getAddress(), ChainBlockTag.PENDING));

        chain.mineAll();
        assertEquals(1L, chain.getTransactionCount(signer.getAddress(), ChainBlockTag.LATEST));
    }

    @Test
    public void eip1559_transaction_is_accepted_and_mined() {
        TxRequest tx = TxRequest.builder().to(TO).gasLimit(BigInteger.valueOf(21_000))
                .maxFeePerGas(GWEI.multiply(BigInteger.valueOf(30))).maxPriorityFeePerGas(GWEI).build();

        String hash = chain.sendRawTransaction(signer.sign(tx, 0));

        assertNotNull(chain.getTransactionReceipt(hash));
        assertEquals(GWEI.multiply(BigInteger.valueOf(30)), chain.getTransaction(hash).getGasPrice());
    }
}
