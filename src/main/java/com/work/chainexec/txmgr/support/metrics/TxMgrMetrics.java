package com.work.chainexec.txmgr.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 设计目标：
 * - 核心路径只调用接口，不绑定具体 metrics 实现
 * - 业务/平台可通过自定义 Bean 接入 Micrometer 等实现
 * - 替代监听器广播：回调点显式、同步、类型化
 */
public interface TxMgrMetrics {

    default void submission(String result) {
    }

    default void retry(int attempt, String errorKind) {
    }

    default void replacement(String result) {
    }

    default void gasSpikeRejected(String reason) {
    }

    default void nonceResync(String address) {
    }

    default void relaySubmission(String relayType, String result) {
    }

    default void bundleInclusion(String result, long blocksWaited) {
    }

    default void hop(String hopType, String result) {
    }

    default void recoveryDecision(String action) {
    }
}
