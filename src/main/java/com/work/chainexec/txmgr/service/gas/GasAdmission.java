package com.work.chainexec.txmgr.service.gas;

import java.math.BigInteger;

/**
 * gas 准入检查结果。currentGasPrice 可能为 null（价格查询失败时放行）。
 */
public class GasAdmission {

    private final boolean allowed;
    private final BigInteger currentGasPrice;
    private final String reason;

    private GasAdmission(boolean allowed, BigInteger currentGasPrice, String reason) {
        this.allowed = allowed;
        this.currentGasPrice = currentGasPrice;
        this.reason = reason;
    }

    public static GasAdmission allow(BigInteger currentGasPrice) {
        return new GasAdmission(true, currentGasPrice, null);
    }

    public static GasAdmission reject(BigInteger currentGasPrice, String reason) {
        return new GasAdmission(false, currentGasPrice, reason);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public BigInteger getCurrentGasPrice() {
        return currentGasPrice;
    }

    public String getReason() {
        return reason;
    }
}
