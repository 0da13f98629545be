package com.work.chainexec.core.nonce;

import com.work.chainexec.core.chain.ChainRpcClient;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import static com.work.chainexec.core.support.ValidationUtils.requireNonEmpty;
import static com.work.chainexec.core.support.ValidationUtils.requireNonNull;

/**
 * 每条链、每个签名地址只对应一个 {@link NonceAllocator}，保证同地址的所有提交路径共享同一把锁。
 */
public class NonceAllocatorRegistry {

    private final Executor resyncExecutor;
    private final Map<String, NonceAllocator> allocators = new ConcurrentHashMap<>();

    public NonceAllocatorRegistry(Executor resyncExecutor) {
        this.resyncExecutor = requireNonNull(resyncExecutor, "resyncExecutor");
    }

    public NonceAllocator forAddress(ChainRpcClient chain, String address) {
        requireNonNull(chain, "chain");
        requireNonEmpty(address, "address");
        String key = chain.getChainId() + ":" + address.toLowerCase(Locale.ROOT);
        return allocators.computeIfAbsent(key, k -> new NonceAllocator(chain, address, resyncExecutor));
    }

    public int size() {
        return allocators.size();
    }
}
