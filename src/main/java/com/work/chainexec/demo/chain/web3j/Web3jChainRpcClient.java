package com.work.chainexec.demo.chain.web3j;

import com.work.chainexec.core.chain.ChainBlockTag;
import com.work.chainexec.core.chain.ChainRpcClient;
import com.work.chainexec.core.chain.PendingTransaction;
import com.work.chainexec.core.chain.TxReceipt;
import com.work.chainexec.core.exception.ChainRpcException;
import com.work.chainexec.core.exception.RpcErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthChainId;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.EthTransaction;
import org.web3j.protocol.core.methods.response.Transaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Optional;

/**
 * 基于 Web3j 的链 RPC 实现。
 *
 * <p>所有节点错误都在这里一次性分类为 {@link ChainRpcException}：
 * IO 异常视为 TRANSIENT，JSON-RPC error 按错误码与消息分类。</p>
 */
public class Web3jChainRpcClient implements ChainRpcClient {

    private static final Logger log = LoggerFactory.getLogger(Web3jChainRpcClient.class);

    private final Web3j web3j;
    private volatile long chainId;

    /**
     * @param chainId 为 0 时首次使用时查询 eth_chainId
     */
    public Web3jChainRpcClient(Web3j web3j, long chainId) {
        this.web3j = web3j;
        this.chainId = chainId;
    }

    @Override
    public long getTransactionCount(String address, ChainBlockTag tag) {
        DefaultBlockParameterName param = tag == ChainBlockTag.PENDING
                ? DefaultBlockParameterName.PENDING
                : DefaultBlockParameterName.LATEST;
        EthGetTransactionCount resp = send("eth_getTransactionCount", () -> web3j.ethGetTransactionCount(address, param).send());
        return resp.getTransactionCount().longValue();
    }

    @Override
    public BigInteger getGasPrice() {
        EthGasPrice resp = send("eth_gasPrice", () -> web3j.ethGasPrice().send());
        return resp.getGasPrice();
    }

    @Override
    public String sendRawTransaction(String signedTx) {
        EthSendTransaction resp = send("eth_sendRawTransaction", () -> web3j.ethSendRawTransaction(signedTx).send());
        return resp.getTransactionHash();
    }

    @Override
    public PendingTransaction getTransaction(String txHash) {
        EthTransaction resp = send("eth_getTransactionByHash", () -> web3j.ethGetTransactionByHash(txHash).send());
        Optional<Transaction> txOpt = resp.getTransaction();
        if (!txOpt.isPresent()) {
            return null;
        }
        Transaction tx = txOpt.get();
        String blockNumberRaw = tx.getBlockNumberRaw();
        return new PendingTransaction(
                tx.getHash(),
                tx.getFrom(),
                tx.getTo(),
                tx.getInput(),
                decode(tx.getValueRaw()),
                decode(tx.getGasRaw()),
                decode(tx.getGasPriceRaw()),
                decode(tx.getNonceRaw()).longValue(),
                blockNumberRaw == null ? null : Numeric.decodeQuantity(blockNumberRaw).longValue());
    }

    @Override
    public TxReceipt getTransactionReceipt(String txHash) {
        EthGetTransactionReceipt resp = send("eth_getTransactionReceipt", () -> web3j.ethGetTransactionReceipt(txHash).send());
        Optional<TransactionReceipt> receiptOpt = resp.getTransactionReceipt();
        if (!receiptOpt.isPresent()) {
            return null;
        }
        TransactionReceipt r = receiptOpt.get();
        return new TxReceipt(txHash, r.getBlockNumber().longValue(), r.getBlockHash(), isReceiptSuccess(r), r.getGasUsed());
    }

    @Override
    public long getLatestBlockNumber() {
        EthBlockNumber resp = send("eth_blockNumber", () -> web3j.ethBlockNumber().send());
        return resp.getBlockNumber().longValue();
    }

    @Override
    public long getChainId() {
        if (chainId <= 0) {
            EthChainId resp = send("eth_chainId", () -> web3j.ethChainId().send());
            chainId = resp.getChainId().longValue();
        }
        return chainId;
    }

    private <T extends Response<?>> T send(String method, RpcCall<T> call) {
        T resp;
        try {
            resp = call.send();
        } catch (IOException e) {
            log.warn("web3j call failed method={} err={}", method, e.getMessage());
            throw new ChainRpcException(RpcErrorKind.TRANSIENT, null, method + " failed: " + e.getMessage(), e);
        }
        if (resp.hasError()) {
            Response.Error error = resp.getError();
            throw ChainRpcException.classified(String.valueOf(error.getCode()), error.getMessage(), null);
        }
        return resp;
    }

    private static BigInteger decode(String quantity) {
        return quantity == null ? BigInteger.ZERO : Numeric.decodeQuantity(quantity);
    }

    private boolean isReceiptSuccess(TransactionReceipt receipt) {
        // EVM receipt status: 0x1 success, 0x0 failure；个别链没有 status 字段，按成功处理
        String status = receipt.getStatus();
        if (status == null) {
            return true;
        }
        return !"0x0".equalsIgnoreCase(status);
    }

    @FunctionalInterface
    private interface RpcCall<T> {
        T send() throws IOException;
    }
}
