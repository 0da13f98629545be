package com.work.chainexec.crosschain.adapter;

import com.work.chainexec.core.chain.TxReceipt;
import com.work.chainexec.core.exception.FatalSubmissionException;
import com.work.chainexec.core.exception.TransientSubmissionException;
import com.work.chainexec.txmgr.domain.TransactionMetadata;
import com.work.chainexec.txmgr.domain.TxState;
import com.work.chainexec.txmgr.service.SubmissionPipeline;
import com.work.chainexec.txmgr.service.TransactionOptions;
import com.work.chainexec.txmgr.service.TransactionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;

import static com.work.chainexec.core.support.ValidationUtils.requireNonEmpty;
import static com.work.chainexec.core.support.ValidationUtils.requireNonNull;

/**
 * 通过 {@link SubmissionPipeline} 发 swap：编码 UniswapV2 风格的 swapExactTokensForTokens 调用，
 * nonce、重试、gas 升价都交给 pipeline。
 */
public class PipelineChainAdapter implements ChainAdapter {

    private static final Logger log = LoggerFactory.getLogger(PipelineChainAdapter.class);

    static final String SWAP_FUNCTION = "swapExactTokensForTokens";

    private final SubmissionPipeline pipeline;
    private final long chainId;

    public PipelineChainAdapter(SubmissionPipeline pipeline, long chainId) {
        this.pipeline = requireNonNull(pipeline, "pipeline");
        this.chainId = chainId;
    }

    @Override
    public long getChainId() {
        return chainId;
    }

    @Override
    public String getAccountAddress() {
        return pipeline.getSignerAddress();
    }

    @Override
    public String executeSwap(SwapParams params, String poolAddress) {
        requireNonNull(params, "params");
        requireNonEmpty(poolAddress, "poolAddress");
        String data = encodeSwap(params);
        TransactionOptions options = TransactionOptions.defaults()
                .deadline(Instant.ofEpochSecond(params.getDeadline()));
        TransactionResult result = pipeline.executeTransaction(poolAddress, data, options);
        TransactionMetadata m = result.getMetadata();
        if (result.isSuccess()) {
            log.info("swap confirmed chainId={} pool={} hash={}", chainId, poolAddress, m.getHash());
            return m.getHash();
        }
        // 已广播但未在期限内确认：交给 waitForTransaction 继续等
        if (m != null && m.getState() == TxState.TIMEOUT && m.getHash() != null) {
            log.warn("swap broadcast but unconfirmed chainId={} hash={}", chainId, m.getHash());
            return m.getHash();
        }
        if (m != null && m.getState() == TxState.FAILED && m.getHash() == null) {
            throw new FatalSubmissionException("Swap not sent on chain " + chainId + ": " + result.getError());
        }
        throw new TransientSubmissionException("Swap failed on chain " + chainId + ": " + result.getError());
    }

    @Override
    public boolean waitForTransaction(String txHash, Duration timeout) {
        requireNonEmpty(txHash, "txHash");
        TxReceipt receipt = pipeline.getChain().getTransactionReceipt(txHash);
        if (receipt == null) {
            receipt = pipeline.getChain().waitForTransaction(txHash, 1, timeout);
        }
        return receipt != null && receipt.isSuccess();
    }

    static String encodeSwap(SwapParams params) {
        Function function = new Function(
                SWAP_FUNCTION,
                Arrays.<Type>asList(
                        new Uint256(params.getAmountIn()),
                        new Uint256(params.getMinAmountOut()),
                        new DynamicArray<>(Address.class,
                                Arrays.asList(new Address(params.getTokenIn()), new Address(params.getTokenOut()))),
                        new Address(params.getRecipient()),
                        new Uint256(params.getDeadline())),
                Collections.emptyList());
        return FunctionEncoder.encode(function);
    }
}
