package com.work.chainexec.relay.web.dto;

import com.work.chainexec.relay.PrivacyLevel;
import com.work.chainexec.relay.RelayType;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;
import java.math.BigInteger;

public class PrivateTxRequest {

    @NotBlank
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "to 必须是 0x 开头的 20 字节地址")
    private String to;

    @Pattern(regexp = "^(0x)?[0-9a-fA-F]*$", message = "data 必须是十六进制")
    private String data;

    private BigInteger value;
    private BigInteger gasLimit;
    private BigInteger gasPrice;
    private PrivacyLevel privacyLevel;
    private RelayType preferredRelay;
    private boolean fastMode;
    private boolean allowPublicFallback;

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

    public PrivacyLevel getPrivacyLevel() {
        return privacyLevel;
    }

    public void setPrivacyLevel(PrivacyLevel privacyLevel) {
        this.privacyLevel = privacyLevel;
    }

    public RelayType getPreferredRelay() {
        return preferredRelay;
    }

    public void setPreferredRelay(RelayType preferredRelay) {
        this.preferredRelay = preferredRelay;
    }

    public boolean isFastMode() {
        return fastMode;
    }

    public void setFastMode(boolean fastMode) {
        this.fastMode = fastMode;
    }

    public boolean isAllowPublicFallback() {
        return allowPublicFallback;
    }

    public void setAllowPublicFallback(boolean allowPublicFallback) {
        this.allowPublicFallback = allowPublicFallback;
    }
}
