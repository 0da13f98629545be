package com.work.chainexec.crosschain.recovery;

import com.work.chainexec.crosschain.domain.CrossChainPath;

import static com.work.chainexec.core.support.ValidationUtils.requireNonNull;

public final class RecoveryDecision {

    public enum Action {
        /**
         * 不动资金，只上报停留位置，交给人工处理。
         */
        HOLD,
        /**
         * 执行一条补偿路径（桥回源链、换成稳定币等）。
         */
        COMPENSATE
    }

    private final Action action;
    private final CrossChainPath compensationPath;
    private final String note;

    private RecoveryDecision(Action action, CrossChainPath compensationPath, String note) {
        this.action = action;
        this.compensationPath = compensationPath;
        this.note = note;
    }

    public static RecoveryDecision hold(String note) {
        return new RecoveryDecision(Action.HOLD, null, note);
    }

    public static RecoveryDecision compensate(CrossChainPath compensationPath, String note) {
        return new RecoveryDecision(Action.COMPENSATE, requireNonNull(compensationPath, "compensationPath"), note);
    }

    public Action getAction() {
        return action;
    }

    public CrossChainPath getCompensationPath() {
        return compensationPath;
    }

    public String getNote() {
        return note;
    }
}
