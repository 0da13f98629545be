package com.work.chainexec.core.chain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 待签名的交易请求（不含 nonce，nonce 由分配器或调用方在签名时显式给出）。
 *
 * <p>fee 字段二选一：同时给出 maxFeePerGas 与 maxPriorityFeePerGas 时按 EIP-1559 签名，否则按 legacy gasPrice。</p>
 */
public final class TxRequest {

    private final String to;
    private final String data;
    private final BigInteger value;
    private final BigInteger gasLimit;
    private final BigInteger gasPrice;
    private final BigInteger maxFeePerGas;
    private final BigInteger maxPriorityFeePerGas;

    private TxRequest(Builder b) {
        this.to = b.to;
        this.data = b.data == null ? "0x" : b.data;
        this.value = b.value == null ? BigInteger.ZERO : b.value;
        this.gasLimit = b.gasLimit;
        this.gasPrice = b.gasPrice;
        this.maxFeePerGas = b.maxFeePerGas;
        this.maxPriorityFeePerGas = b.maxPriorityFeePerGas;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .to(to)
                .data(data)
                .value(value)
                .gasLimit(gasLimit)
                .gasPrice(gasPrice)
                .maxFeePerGas(maxFeePerGas)
                .maxPriorityFeePerGas(maxPriorityFeePerGas);
    }

    public boolean isEip1559() {
        return maxFeePerGas != null && maxPriorityFeePerGas != null;
    }

    public String getTo() {
        return to;
    }

    public String getData() {
        return data;
    }

    public BigInteger getValue() {
        return value;
    }

    public BigInteger getGasLimit() {
        return gasLimit;
    }

    public BigInteger getGasPrice() {
        return gasPrice;
    }

    public BigInteger getMaxFeePerGas() {
        return maxFeePerGas;
    }

    public BigInteger getMaxPriorityFeePerGas() {
        return maxPriorityFeePerGas;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TxRequest)) return false;
        TxRequest that = (TxRequest) o;
        return Objects.equals(to, that.to)
                && Objects.equals(data, that.data)
                && Objects.equals(value, that.value)
                && Objects.equals(gasLimit, that.gasLimit)
                && Objects.equals(gasPrice, that.gasPrice)
                && Objects.equals(maxFeePerGas, that.maxFeePerGas)
                && Objects.equals(maxPriorityFeePerGas, that.maxPriorityFeePerGas);
    }

    @Override
    public int hashCode() {
        return Objects.hash(to, data, value, gasLimit, gasPrice, maxFeePerGas, maxPriorityFeePerGas);
    }

    @Override
    public String toString() {
        return "TxRequest{to=" + to + ", value=" + value + ", gasLimit=" + gasLimit
                + ", gasPrice=" + gasPrice + ", maxFeePerGas=" + maxFeePerGas
                + ", maxPriorityFeePerGas=" + maxPriorityFeePerGas + "}";
    }

    public static final class Builder {
        private String to;
        private String data;
        private BigInteger value;
        private BigInteger gasLimit;
        private BigInteger gasPrice;
        private BigInteger maxFeePerGas;
        private BigInteger maxPriorityFeePerGas;

        private Builder() {
        }

        public Builder to(String to) {
            this.to = to;
            return this;
        }

        public Builder data(String data) {
            this.data = data;
            return this;
        }

        public Builder value(BigInteger value) {
            this.value = value;
            return this;
        }

        public Builder gasLimit(BigInteger gasLimit) {
            this.gasLimit = gasLimit;
            return this;
        }

        public Builder gasPrice(BigInteger gasPrice) {
            this.gasPrice = gasPrice;
            return this;
        }

        public Builder maxFeePerGas(BigInteger maxFeePerGas) {
            this.maxFeePerGas = maxFeePerGas;
            return this;
        }

        public Builder maxPriorityFeePerGas(BigInteger maxPriorityFeePerGas) {
            this.maxPriorityFeePerGas = maxPriorityFeePerGas;
            return this;
        }

        public TxRequest build() {
            return new TxRequest(this);
        }
    }
}
