package com.work.chainexec.core.chain;

import com.work.chainexec.core.exception.ChainRpcException;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 链交互最小端口（EVM JSON-RPC 语义）。
 *
 * <p>实现类负责在边界处把节点错误转换为已分类的 {@link ChainRpcException}。</p>
 */
public interface ChainRpcClient {

    /**
     * eth_getTransactionCount(address, tag)。
     */
    long getTransactionCount(String address, ChainBlockTag tag);

    /**
     * eth_gasPrice（wei）。
     */
    BigInteger getGasPrice();

    /**
     * eth_sendRawTransaction，返回 txHash。
     */
    String sendRawTransaction(String signedTx);

    /**
     * eth_getTransactionByHash。返回 null 表示节点不认识该交易。
     */
    PendingTransaction getTransaction(String txHash);

    /**
     * eth_getTransactionReceipt。返回 null 表示 NotFound（尚未打包）。
     */
    TxReceipt getTransactionReceipt(String txHash);

    long getLatestBlockNumber();

    long getChainId();

    /**
     * 等待交易达到指定确认数；超过 timeout 返回 null（不代表链上交易作废）。
     *
     * <p>默认实现按固定间隔轮询 receipt 与最新高度，实现类可改为订阅。</p>
     */
    default TxReceipt waitForTransaction(String txHash, int confirmations, Duration timeout) {
        long deadline = System.currentTimeMillis() + (timeout == null ? 0L : timeout.toMillis());
        int required = Math.max(1, confirmations);
        while (true) {
            TxReceipt receipt = getTransactionReceipt(txHash);
            if (receipt != null) {
                if (required == 1 || getLatestBlockNumber() - receipt.getBlockNumber() + 1 >= required) {
                    return receipt;
                }
            }
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return null;
            }
            try {
                Thread.sleep(Math.min(remaining, 1000L));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }
    }
}
