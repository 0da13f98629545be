package com.work.chainexec.txmgr.web.dto;

import javax.validation.constraints.NotNull;
import java.math.BigInteger;

public class ReplaceTxRequest {

    /**
     * 期望的新 gas price（wei）；低于原价 +10% 时按 +10% 提交。
     */
    @NotNull(message = "gasPrice 不能为空")
    private BigInteger gasPrice;

    public BigInteger getGasPrice() {
        return gasPrice;
    }

    public void setGasPrice(BigInteger gasPrice) {
        this.gasPrice = gasPrice;
    }
}
