package com.work.chainexec.crosschain.bridge;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 跨链桥协作方。具体协议（Wormhole / Stargate 等）的接入由宿主实现。
 */
public interface BridgeManager {

    /**
     * @return 可用路由；没有则返回 null
     */
    BridgeRoute selectBridge(long fromChainId, long toChainId, String token, BigInteger amount);

    BridgeTransfer executeBridge(BridgeRoute route);

    /**
     * 阻塞直到目标链到账或超时。
     *
     * @return 到账返回 true；失败或超时返回 false
     */
    boolean waitForBridge(String txHash, Duration timeout);
}
