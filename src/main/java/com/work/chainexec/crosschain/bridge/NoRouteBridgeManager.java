package com.work.chainexec.crosschain.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 未接入任何桥时的缺省实现：永远没有路由，bridge hop 以 "No bridge route available" 失败。
 */
public class NoRouteBridgeManager implements BridgeManager {

    private static final Logger log = LoggerFactory.getLogger(NoRouteBridgeManager.class);

    @Override
    public BridgeRoute selectBridge(long fromChainId, long toChainId, String token, BigInteger amount) {
        log.warn("no bridge configured from={} to={} token={}", fromChainId, toChainId, token);
        return null;
    }

    @Override
    public BridgeTransfer executeBridge(BridgeRoute route) {
        throw new IllegalStateException("No bridge configured: " + route.getBridge());
    }

    @Override
    public boolean waitForBridge(String txHash, Duration timeout) {
        return false;
    }
}
