package com.work.chainexec.crosschain.recovery;

/**
 * 路径中途失败后的处置策略。实现可以抛异常或返回 null，编排器都按 HOLD 处理。
 */
@FunctionalInterface
public interface RecoveryHook {

    RecoveryDecision decide(RecoveryContext context);

    static RecoveryHook holdAll() {
        return ctx -> RecoveryDecision.hold("Funds held on chain " + ctx.getStrandedChainId()
                + ": " + ctx.getStrandedAmount() + " " + ctx.getStrandedToken());
    }
}
