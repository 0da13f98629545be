package com.work.chainexec.txmgr.web.dto;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;
import java.math.BigInteger;

/**
 * 创建交易请求。fee 字段都不传时按节点当前 gas price 发 legacy 交易。
 */
public class CreateTxRequest {

    @NotBlank(message = "to 不能为空")
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "to 必须是 0x 开头的 40 位十六进制地址")
    private String to;

    @Pattern(regexp = "^0x([0-9a-fA-F]{2})*$", message = "data 必须是 0x 开头的十六进制")
    private String data;

    private BigInteger value;

    private BigInteger gasLimit;

    private BigInteger gasPrice;

    private BigInteger maxFeePerGas;

    private BigInteger maxPriorityFeePerGas;

    /**
     * 覆盖默认重试次数（可选）。
     */
    @Min(value = 0, message = "maxRetries 不能为负数")
    private Integer maxRetries;

    public String getTo() {
        return to;
    }

    public void setTo(String to) {
        this.to = to;
    }

    public String getData() {
        return data;
    }

    public void setData(String data) {
        this.data = data;
    }

    public BigInteger getValue() {
        return value;
    }

    public void setValue(BigInteger value) {
        this.value = value;
    }

    public BigInteger getGasLimit() {
        return gasLimit;
    }

    public void setGasLimit(BigInteger gasLimit) {
        this.gasLimit = gasLimit;
    }

    public BigInteger getGasPrice() {
        return gasPrice;
    }

    public void setGasPrice(BigInteger gasPrice) {
        this.gasPrice = gasPrice;
    }

    public BigInteger getMaxFeePerGas() {
        return maxFeePerGas;
    }

    public void setMaxFeePerGas(BigInteger maxFeePerGas) {
        this.maxFeePerGas = maxFeePerGas;
    }

    public BigInteger getMaxPriorityFeePerGas() {
        return maxPriorityFeePerGas;
    }

    public void setMaxPriorityFeePerGas(BigInteger maxPriorityFeePerGas) {
        this.maxPriorityFeePerGas = maxPriorityFeePerGas;
    }

    public Integer getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(Integer maxRetries) {
        this.maxRetries = maxRetries;
    }
}
