package com.work.chainexec.demo.chain.memory;

import com.work.chainexec.core.chain.ChainBlockTag;
import com.work.chainexec.core.chain.ChainRpcClient;
import com.work.chainexec.core.chain.PendingTransaction;
import com.work.chainexec.core.chain.TxReceipt;
import com.work.chainexec.core.exception.ChainRpcException;
import com.work.chainexec.core.exception.RpcErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.SignedRawTransaction;
import org.web3j.crypto.TransactionDecoder;
import org.web3j.crypto.transaction.type.Transaction1559;

import java.math.BigInteger;
import java.security.SignatureException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 进程内模拟链（chain.mode=mock）。
 *
 * <ul>
 *   <li>解码真实签名的 raw transaction，按恢复出的 from 记账</li>
 *   <li>nonce 低于已打包计数时返回 "nonce too low"；同 nonce 替换要求 gas 至少 +10%</li>
 *   <li>autoMine=true 时连续 nonce 立即打包；关闭后交易停留在 mempool，可用于演示替换</li>
 * </ul>
 */
public class InMemoryChainRpcClient implements ChainRpcClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChainRpcClient.class);

    private static final BigInteger BASE_GAS_USED = BigInteger.valueOf(21_000);

    private final long chainId;
    private volatile BigInteger gasPrice;
    private volatile boolean autoMine = true;

    private final Object monitor = new Object();
    private long blockNumber;
    private final Map<String, Long> minedCount = new HashMap<>();
    private final Map<String, TreeMap<Long, String>> mempool = new HashMap<>();
    private final Map<String, StoredTx> transactions = new HashMap<>();

    public InMemoryChainRpcClient(long chainId, BigInteger gasPrice) {
        this.chainId = chainId;
        this.gasPrice = gasPrice;
    }

    public void setGasPrice(BigInteger gasPrice) {
        this.gasPrice = gasPrice;
    }

    public void setAutoMine(boolean autoMine) {
        this.autoMine = autoMine;
    }

    /**
     * 打包所有可连续执行的交易。
     */
    public void mineAll() {
        synchronized (monitor) {
            for (String from : mempool.keySet()) {
                mine(from);
            }
        }
    }

    @Override
    public long getTransactionCount(String address, ChainBlockTag tag) {
        String from = normalize(address);
        synchronized (monitor) {
            long mined = minedCount.getOrDefault(from, 0L);
            if (tag != ChainBlockTag.PENDING) {
                return mined;
            }
            TreeMap<Long, String> pool = mempool.get(from);
            long next = mined;
            while (pool != null && pool.containsKey(next)) {
                next++;
            }
            return next;
        }
    }

    @Override
    public BigInteger getGasPrice() {
        return gasPrice;
    }

    @Override
    public String sendRawTransaction(String signedTx) {
        RawTransaction raw = TransactionDecoder.decode(signedTx);
        if (!(raw instanceof SignedRawTransaction)) {
            throw new ChainRpcException(RpcErrorKind.FATAL, null, "transaction is not signed");
        }
        String from;
        try {
            from = normalize(((SignedRawTransaction) raw).getFrom());
        } catch (SignatureException e) {
            throw new ChainRpcException(RpcErrorKind.FATAL, null, "invalid sender: " + e.getMessage(), e);
        }
        long nonce = raw.getNonce().longValue();
        BigInteger price = effectiveGasPrice(raw);
        String hash = Hash.sha3(signedTx);

        synchronized (monitor) {
            long mined = minedCount.getOrDefault(from, 0L);
            if (nonce < mined) {
                throw ChainRpcException.classified("nonce too low: next nonce " + mined + ", tx nonce " + nonce);
            }
            TreeMap<Long, String> pool = mempool.computeIfAbsent(from, k -> new TreeMap<>());
            String existingHash = pool.get(nonce);
            if (existingHash != null && !existingHash.equals(hash)) {
                BigInteger existingPrice = transactions.get(existingHash).gasPrice;
                BigInteger floor = existingPrice.multiply(BigInteger.valueOf(110)).divide(BigInteger.valueOf(100));
                if (price.compareTo(floor) < 0) {
                    throw ChainRpcException.classified("replacement transaction underpriced");
                }
                transactions.remove(existingHash);
                log.info("mempool replace from={} nonce={} old={} new={}", from, nonce, existingHash, hash);
            }
            transactions.put(hash, new StoredTx(hash, from, raw, price));
            pool.put(nonce, hash);
            if (autoMine) {
                mine(from);
            }
        }
        return hash;
    }

    @Override
    public PendingTransaction getTransaction(String txHash) {
        synchronized (monitor) {
            StoredTx tx = transactions.get(txHash);
            if (tx == null) {
                return null;
            }
            RawTransaction raw = tx.raw;
            return new PendingTransaction(tx.hash, tx.from, raw.getTo(), raw.getData(), raw.getValue(),
                    raw.getGasLimit(), tx.gasPrice, raw.getNonce().longValue(), tx.blockNumber);
        }
    }

    @Override
    public TxReceipt getTransactionReceipt(String txHash) {
        synchronized (monitor) {
            StoredTx tx = transactions.get(txHash);
            if (tx == null || tx.blockNumber == null) {
                return null;
            }
            return new TxReceipt(tx.hash, tx.blockNumber, blockHash(tx.blockNumber), true, BASE_GAS_USED);
        }
    }

    @Override
    public long getLatestBlockNumber() {
        synchronized (monitor) {
            return blockNumber;
        }
    }

    @Override
    public long getChainId() {
        return chainId;
    }

    @Override
    public TxReceipt waitForTransaction(String txHash, int confirmations, Duration timeout) {
        if (autoMine) {
            return getTransactionReceipt(txHash);
        }
        return ChainRpcClient.super.waitForTransaction(txHash, confirmations, timeout);
    }

    // 调用方持有 monitor
    private void mine(String from) {
        TreeMap<Long, String> pool = mempool.get(from);
        long next = minedCount.getOrDefault(from, 0L);
        while (pool != null && pool.containsKey(next)) {
            String hash = pool.remove(next);
            blockNumber++;
            transactions.get(hash).blockNumber = blockNumber;
            next++;
            log.debug("mined hash={} from={} block={}", hash, from, blockNumber);
        }
        minedCount.put(from, next);
    }

    private static BigInteger effectiveGasPrice(RawTransaction raw) {
        if (raw.getTransaction() instanceof Transaction1559) {
            return ((Transaction1559) raw.getTransaction()).getMaxFeePerGas();
        }
        return raw.getGasPrice() == null ? BigInteger.ZERO : raw.getGasPrice();
    }

    private static String blockHash(long number) {
        return Hash.sha3String("block-" + number);
    }

    private static String normalize(String address) {
        return address == null ? null : address.toLowerCase(Locale.ROOT);
    }

    private static final class StoredTx {
        private final String hash;
        private final String from;
        private final RawTransaction raw;
        private final BigInteger gasPrice;
        private Long blockNumber;

        private StoredTx(String hash, String from, RawTransaction raw, BigInteger gasPrice) {
            this.hash = hash;
            this.from = from;
            this.raw = raw;
            this.gasPrice = gasPrice;
        }
    }
}
