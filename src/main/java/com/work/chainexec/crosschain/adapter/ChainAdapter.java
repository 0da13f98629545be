package com.work.chainexec.crosschain.adapter;

import java.time.Duration;

/**
 * 单条链上的 swap 执行端口，每个 chainId 一个实例。
 */
public interface ChainAdapter {

    long getChainId();

    /**
     * 该链上发交易的账户地址，未配置收款地址时作为 swap 的 recipient。
     */
    String getAccountAddress();

    /**
     * 发出 swap 交易，返回交易 hash。发送失败时抛出异常。
     */
    String executeSwap(SwapParams params, String poolAddress);

    /**
     * @return 在 timeout 内确认且执行成功返回 true
     */
    boolean waitForTransaction(String txHash, Duration timeout);
}
