package com.work.chainexec.relay;

/**
 * 提交通道类型。
 */
public enum RelayType {
    /**
     * 普通节点 RPC，交易进入公开 mempool。
     */
    PUBLIC_RPC,
    /**
     * Flashbots Protect 风格：eth_sendPrivateTransaction。
     */
    FLASHBOTS_PROTECT,
    /**
     * MEV-Share 风格：mev_sendBundle（v0.1）。
     */
    MEV_SHARE,
    /**
     * 直连 builder 的 RPC。
     */
    BUILDER_RPC
}
